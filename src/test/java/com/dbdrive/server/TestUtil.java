package com.dbdrive.server;

import lombok.extern.slf4j.Slf4j;

import java.util.function.BooleanSupplier;

@Slf4j
public class TestUtil {

    public static void waitMillis(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("wait interrupted", e);
        }
    }

    public static void waitSec(long sec) {
        waitMillis(sec * 1000);
    }

    /**
     * Polls every 100ms until the condition holds.
     *
     * @return false when the timeout elapsed first
     */
    public static boolean waitUntil(BooleanSupplier condition, long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            waitMillis(100);
        }
        boolean result = condition.getAsBoolean();
        if (!result) {
            log.warn("waitUntil timed out after {} ms", timeoutMillis);
        }
        return result;
    }
}
