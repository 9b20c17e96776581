package com.dbdrive.server.service.scheduler;

import com.dbdrive.server.TestUtil;
import com.dbdrive.server.model.internal.ScheduledJobInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScheduledJobRegistryTest {

    private ThreadPoolTaskScheduler taskScheduler;

    private ScheduledJobRegistry registry;

    @BeforeEach
    void setUp() {
        this.taskScheduler = new ThreadPoolTaskScheduler();
        this.taskScheduler.setPoolSize(2);
        this.taskScheduler.initialize();
        this.registry = new ScheduledJobRegistry();
    }

    @AfterEach
    void tearDown() {
        this.registry.stopClock();
        this.taskScheduler.shutdown();
    }

    @Test
    void ShouldKeepOneEntryWhenReplaceSameName() {
        this.registry.startClock(this.taskScheduler);
        this.registry.replace(entry("nightly", "0 0 2 * * *", () -> {}));
        this.registry.replace(entry("nightly", "0 30 3 * * *", () -> {}));

        List<ScheduledJobInfo> snapshot = this.registry.snapshot();

        assertEquals(1, snapshot.size());
        assertEquals("0 30 3 * * *", snapshot.get(0).getCronExpression());
        assertNotNull(snapshot.get(0).getNextFireTime());
        assertNull(snapshot.get(0).getPreviousFireTime());
    }

    @Test
    void ShouldNotArmWhenClockStopped() {
        this.registry.replace(entry("nightly", "0 0 2 * * *", () -> {}));

        assertTrue(this.registry.contains("nightly"));
        assertNull(this.registry.snapshot().get(0).getNextFireTime());

        this.registry.startClock(this.taskScheduler);
        assertNotNull(this.registry.snapshot().get(0).getNextFireTime());

        this.registry.stopClock();
        assertEquals(1, this.registry.size());
        assertNull(this.registry.snapshot().get(0).getNextFireTime());
    }

    @Test
    void ShouldStopFiringWhenRemoved() {
        AtomicInteger fired = new AtomicInteger();
        this.registry.startClock(this.taskScheduler);
        this.registry.replace(entry("every-second", "* * * * * *", fired::incrementAndGet));

        assertTrue(TestUtil.waitUntil(() -> fired.get() > 0, 3000));
        assertNotNull(this.registry.snapshot().get(0).getPreviousFireTime());

        assertTrue(this.registry.remove("every-second"));
        assertFalse(this.registry.remove("every-second"));
        int firedAtRemoval = fired.get();
        TestUtil.waitMillis(1500);
        assertTrue(fired.get() <= firedAtRemoval + 1);
        assertEquals(0, this.registry.size());
    }

    @Test
    void ShouldReturnImmutableSnapshotWhenListing() {
        this.registry.replace(entry("nightly", "0 0 2 * * *", () -> {}));

        List<ScheduledJobInfo> snapshot = this.registry.snapshot();

        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(null));
        this.registry.remove("nightly");
        assertEquals(1, snapshot.size());
    }

    private static ScheduledEntry entry(String jobName, String cronExpression, Runnable task) {
        return new ScheduledEntry(jobName, cronExpression, CronExpression.parse(cronExpression), task);
    }
}
