package com.dbdrive.server.util;

import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.internal.CommandResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.Executor;
import org.apache.commons.exec.PumpStreamHandler;
import org.apache.commons.lang3.ObjectUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Slf4j
public class CommandUtil {

    public static final int NO_EXIT_CODE = -1;

    public static CommandResult execute(
            CommandLine commandLine,
            Map<String, String> extraEnv,
            Duration timeout) throws ValidationException {
        return execute(commandLine, extraEnv, null, timeout);
    }

    /**
     * Runs the command and blocks until it exits or the watchdog kills it.
     *
     * @param stdoutSink receives stdout when not null, otherwise stdout is captured into the result
     */
    public static CommandResult execute(
            CommandLine commandLine,
            Map<String, String> extraEnv,
            OutputStream stdoutSink,
            Duration timeout) throws ValidationException {
        if (ObjectUtils.anyNull(commandLine, timeout)) {
            throw new ValidationException("execute command failed. commandLine or timeout is null");
        }
        Executor executor = DefaultExecutor.builder().get();
        // 1. stdout goes to the sink or to memory, stderr always to memory
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        executor.setStreamHandler(new PumpStreamHandler(stdoutSink == null ? stdout : stdoutSink, stderr));
        // 2. kill the process after timeout
        ExecuteWatchdog watchdog = ExecuteWatchdog.builder().setTimeout(timeout).get();
        executor.setWatchdog(watchdog);
        // 3. only exit code 0 is success
        executor.setExitValue(0);
        try {
            int exitCode = executor.execute(commandLine, genEnv(extraEnv));
            return CommandResult.success(exitCode, getStdAsString(stdout));
        } catch (ExecuteException e) {
            String error = watchdog.killedProcess() ?
                    "killed after %s. stderr: %s".formatted(timeout, getStdAsString(stderr)) :
                    getStdAsString(stderr);
            return CommandResult.failed(e.getExitValue(), error);
        } catch (IOException e) {
            return CommandResult.failed(
                    NO_EXIT_CODE,
                    "exception: %s with stderr: %s".formatted(e, getStdAsString(stderr)));
        }
    }

    private static String getStdAsString(ByteArrayOutputStream std) {
        return std.toString(StandardCharsets.UTF_8).trim();
    }

    private static Map<String, String> genEnv(Map<String, String> extraEnv) {
        Map<String, String> result = new HashMap<>(System.getenv());
        if (ObjectUtils.isNotEmpty(extraEnv)) {
            result.putAll(extraEnv);
        }
        return result;
    }
}
