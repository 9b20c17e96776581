package com.dbdrive.server.service.scheduler;

import com.dbdrive.server.InMemoryConfigStore;
import com.dbdrive.server.StubDatabaseBackupFactory;
import com.dbdrive.server.StubStorageService;
import com.dbdrive.server.TestUtil;
import com.dbdrive.server.enums.RunStatusEnum;
import com.dbdrive.server.exception.ResourceNotFoundException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.entity.JobConfigEntity;
import com.dbdrive.server.model.internal.ScheduledJobInfo;
import com.dbdrive.server.service.executor.BackupJobExecutor;
import com.dbdrive.server.service.notification.ChannelAdapterRegistry;
import com.dbdrive.server.service.notification.NotificationDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class BackupSchedulerTest {

    @TempDir
    Path tempDir;

    private InMemoryConfigStore configStore;

    private ThreadPoolTaskScheduler backupCronScheduler;

    private ExecutorService backupJobWorker;

    private ExecutorService notificationExecutor;

    private BackupScheduler backupScheduler;

    @BeforeEach
    void setUp() {
        this.configStore = new InMemoryConfigStore();
        this.backupCronScheduler = new ThreadPoolTaskScheduler();
        this.backupCronScheduler.setPoolSize(2);
        this.backupCronScheduler.setRemoveOnCancelPolicy(true);
        this.backupCronScheduler.initialize();
        this.backupJobWorker = Executors.newFixedThreadPool(2);
        this.notificationExecutor = Executors.newFixedThreadPool(2);
        NotificationDispatcher notificationDispatcher = new NotificationDispatcher(
                this.configStore, new ChannelAdapterRegistry(List.of()), this.notificationExecutor, 5);
        BackupJobExecutor backupJobExecutor = new BackupJobExecutor(
                this.configStore,
                new StubDatabaseBackupFactory("nightly_20240101.sql", 2048),
                new StubStorageService("F1", "D1", "https://x/D1"),
                notificationDispatcher,
                this.tempDir.toString());
        this.backupScheduler = new BackupScheduler(
                this.configStore, backupJobExecutor, this.backupCronScheduler, this.backupJobWorker);
    }

    @AfterEach
    void tearDown() {
        this.backupScheduler.stop();
        this.backupCronScheduler.shutdown();
        this.backupJobWorker.shutdownNow();
        this.notificationExecutor.shutdownNow();
    }

    @Test
    void ShouldKeepSingleEntryWhenAddSameJobTwice() {
        this.backupScheduler.addOrReplaceJob(this.configStore.addJob("nightly", "0 0 2 * * *", "full", true));
        this.backupScheduler.addOrReplaceJob(this.configStore.addJob("nightly", "0 0 3 * * *", "full", true));

        List<ScheduledJobInfo> scheduled = this.backupScheduler.listScheduled();

        assertEquals(1, scheduled.size());
        assertEquals("nightly", scheduled.get(0).getJobName());
        assertEquals("0 0 3 * * *", scheduled.get(0).getCronExpression());
    }

    @Test
    void ShouldLeaveRegistryUntouchedWhenCronInvalid() {
        this.backupScheduler.addOrReplaceJob(this.configStore.addJob("nightly", "0 0 2 * * *", "full", true));
        JobConfigEntity broken = this.configStore.addJob("nightly", "not a cron", "full", true);

        assertThrows(ValidationException.class, () -> this.backupScheduler.addOrReplaceJob(broken));

        List<ScheduledJobInfo> scheduled = this.backupScheduler.listScheduled();
        assertEquals(1, scheduled.size());
        assertEquals("0 0 2 * * *", scheduled.get(0).getCronExpression());
    }

    @Test
    void ShouldRejectWhenJobDisabled() {
        JobConfigEntity disabled = this.configStore.addJob("weekly", "0 0 2 * * SUN", "full", false);

        assertThrows(ValidationException.class, () -> this.backupScheduler.addOrReplaceJob(disabled));
        assertThrows(ValidationException.class, () -> this.backupScheduler.addOrReplaceJob(null));
        assertTrue(this.backupScheduler.listScheduled().isEmpty());
    }

    @Test
    void ShouldDoNothingWhenRemoveAbsentJob() {
        this.backupScheduler.addOrReplaceJob(this.configStore.addJob("nightly", "0 0 2 * * *", "full", true));

        assertDoesNotThrow(() -> this.backupScheduler.removeJob("unknown"));
        assertEquals(1, this.backupScheduler.listScheduled().size());

        this.backupScheduler.removeJob("nightly");
        this.backupScheduler.removeJob("nightly");
        assertTrue(this.backupScheduler.listScheduled().isEmpty());
    }

    @Test
    void ShouldLoadEnabledJobsAndSkipBrokenOnesWhenStart() {
        this.configStore.addJob("nightly", "0 0 2 * * *", "full", true);
        this.configStore.addJob("broken", "61 * * * * *", "full", true);
        this.configStore.addJob("disabled", "0 0 4 * * *", "full", false);

        this.backupScheduler.start().join();

        List<ScheduledJobInfo> scheduled = this.backupScheduler.listScheduled();
        assertEquals(1, scheduled.size());
        assertEquals("nightly", scheduled.get(0).getJobName());
        assertNotNull(scheduled.get(0).getNextFireTime());
        assertTrue(this.backupScheduler.isRunning());

        // second start is a no-op
        this.backupScheduler.start().join();
        assertEquals(1, this.backupScheduler.listScheduled().size());
    }

    @Test
    void ShouldRearmEntriesWhenRestart() {
        this.configStore.addJob("nightly", "0 0 2 * * *", "full", true);
        this.backupScheduler.start().join();

        this.backupScheduler.stop();
        assertFalse(this.backupScheduler.isRunning());
        assertEquals(1, this.backupScheduler.listScheduled().size());
        assertNull(this.backupScheduler.listScheduled().get(0).getNextFireTime());

        this.backupScheduler.start().join();
        assertNotNull(this.backupScheduler.listScheduled().get(0).getNextFireTime());
    }

    @Test
    void ShouldRunBackupWhenCronFires() {
        this.backupScheduler.start().join();
        this.backupScheduler.addOrReplaceJob(this.configStore.addJob("every-second", "* * * * * *", "full", true));

        boolean succeeded = TestUtil.waitUntil(() -> this.configStore.getHistories().stream()
                .anyMatch(history -> RunStatusEnum.SUCCESS.getName().equals(history.getStatus())), 5000);

        assertTrue(succeeded);
        assertNotNull(this.backupScheduler.listScheduled().get(0).getPreviousFireTime());
    }

    @Test
    void ShouldRunOnceWhenTriggerNow() {
        this.configStore.addJob("nightly", "0 0 2 * * *", "full", true);

        this.backupScheduler.triggerNow("nightly");

        assertTrue(TestUtil.waitUntil(() -> this.configStore.getHistories().stream()
                .anyMatch(history -> RunStatusEnum.SUCCESS.getName().equals(history.getStatus())), 5000));
        assertEquals(1, this.configStore.getHistories().size());
        assertEquals("nightly", this.configStore.getHistories().get(0).getJobName());
    }

    @Test
    void ShouldThrowWhenTriggerUnknownJob() {
        assertThrows(ResourceNotFoundException.class, () -> this.backupScheduler.triggerNow("missing"));
        assertThrows(ValidationException.class, () -> this.backupScheduler.triggerNow(" "));
        assertTrue(this.configStore.getHistoryWrites().isEmpty());
    }

    @Test
    void ShouldKeepOneEntryPerNameWhenConcurrentAdds() throws InterruptedException {
        this.backupScheduler.start().join();
        int threads = 8;
        ExecutorService callers = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(1);
        List<Throwable> errors = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            int hour = i;
            callers.execute(() -> {
                try {
                    ready.await();
                    for (int j = 0; j < 50; j++) {
                        JobConfigEntity job = new JobConfigEntity();
                        job.setJobName("nightly");
                        job.setCronExpression("0 %d %d * * *".formatted(j % 60, hour));
                        job.setBackupMode("full");
                        job.setEnabled(true);
                        this.backupScheduler.addOrReplaceJob(job);
                    }
                } catch (Throwable e) {
                    synchronized (errors) {
                        errors.add(e);
                    }
                }
            });
        }
        ready.countDown();
        callers.shutdown();
        assertTrue(callers.awaitTermination(10, TimeUnit.SECONDS));

        assertTrue(errors.isEmpty());
        assertEquals(1, this.backupScheduler.listScheduled().size());
        // only the surviving trigger is armed
        assertEquals(1, this.backupCronScheduler.getScheduledThreadPoolExecutor().getQueue().size());
    }
}
