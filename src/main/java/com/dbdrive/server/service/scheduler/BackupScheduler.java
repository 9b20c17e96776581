package com.dbdrive.server.service.scheduler;

import com.dbdrive.server.enums.BackupModeEnum;
import com.dbdrive.server.exception.BusinessException;
import com.dbdrive.server.exception.DbDriveException;
import com.dbdrive.server.exception.ResourceNotFoundException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.entity.JobConfigEntity;
import com.dbdrive.server.model.internal.ScheduledJobInfo;
import com.dbdrive.server.service.executor.BackupJobExecutor;
import com.dbdrive.server.service.store.ConfigStore;
import com.dbdrive.server.util.CronUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps every enabled job on its cron schedule.
 * <p>
 * Firing never waits for the run: each firing hands a {@link BackupJobExecutor} run to the
 * job worker pool. A job may be triggered again while its previous run is still going.
 */
@Slf4j
@Service
public class BackupScheduler {

    private final ConfigStore configStore;

    private final BackupJobExecutor backupJobExecutor;

    private final TaskScheduler backupCronScheduler;

    private final Executor backupJobWorker;

    private final ScheduledJobRegistry registry = new ScheduledJobRegistry();

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Autowired
    public BackupScheduler(
            ConfigStore configStore,
            BackupJobExecutor backupJobExecutor,
            @Qualifier("backupCronScheduler") TaskScheduler backupCronScheduler,
            @Qualifier("backupJobWorker") Executor backupJobWorker) {
        this.configStore = configStore;
        this.backupJobExecutor = backupJobExecutor;
        this.backupCronScheduler = backupCronScheduler;
        this.backupJobWorker = backupJobWorker;
    }

    /**
     * Arms the clock and loads every enabled job in the background. Calling it again while
     * running does nothing.
     *
     * @return completes once the enabled jobs are loaded
     */
    public CompletableFuture<Void> start() {
        if (!this.running.compareAndSet(false, true)) {
            log.debug("start scheduler. already running");
            return CompletableFuture.completedFuture(null);
        }
        this.registry.startClock(this.backupCronScheduler);
        log.info("scheduler started");
        return CompletableFuture.runAsync(this::loadEnabledJobs, this.backupJobWorker)
                .exceptionally(throwable -> {
                    log.error("start scheduler failed. can't load enabled jobs", throwable);
                    return null;
                });
    }

    /**
     * Cancels every armed trigger. Runs in flight are not awaited and entries are kept, so the
     * next {@link #start()} re-arms them.
     */
    public void stop() {
        if (!this.running.compareAndSet(true, false)) {
            return;
        }
        this.registry.stopClock();
        log.info("scheduler stopped");
    }

    public boolean isRunning() {
        return this.running.get();
    }

    public void addOrReplaceJob(JobConfigEntity jobConfig) throws ValidationException {
        if (ObjectUtils.isEmpty(jobConfig) || StringUtils.isBlank(jobConfig.getJobName())) {
            throw new ValidationException("addOrReplaceJob failed. jobConfig or jobName is empty");
        }
        if (!Boolean.TRUE.equals(jobConfig.getEnabled())) {
            throw new ValidationException("addOrReplaceJob failed. job %s is disabled"
                    .formatted(jobConfig.getJobName()));
        }
        if (BackupModeEnum.fromMode(jobConfig.getBackupMode()) == null) {
            throw new ValidationException("addOrReplaceJob failed. unsupported backup mode %s"
                    .formatted(jobConfig.getBackupMode()));
        }
        // parse before touching the registry
        CronExpression cron = CronUtil.parse(jobConfig.getCronExpression());
        ScheduledEntry entry = new ScheduledEntry(
                jobConfig.getJobName(),
                jobConfig.getCronExpression().trim(),
                cron,
                () -> this.submitRun(jobConfig));
        this.registry.replace(entry);
        log.info("job scheduled. job is {}, cron is {}", jobConfig.getJobName(), jobConfig.getCronExpression());
    }

    public void removeJob(String jobName) {
        if (this.registry.remove(jobName)) {
            log.info("job unscheduled. job is {}", jobName);
        }
    }

    /**
     * Starts one run of the job and returns without waiting for it. The outcome shows up in
     * the backup history.
     */
    public void triggerNow(String jobName) throws ResourceNotFoundException, BusinessException {
        if (StringUtils.isBlank(jobName)) {
            throw new ValidationException("triggerNow failed. jobName is blank");
        }
        JobConfigEntity jobConfig = this.configStore.getJob(jobName);
        this.submitRun(jobConfig);
        log.info("job triggered manually. job is {}", jobName);
    }

    public List<ScheduledJobInfo> listScheduled() {
        return this.registry.snapshot();
    }

    private void loadEnabledJobs() {
        List<JobConfigEntity> jobConfigs = this.configStore.listEnabledJobs();
        int loaded = 0;
        for (JobConfigEntity jobConfig : jobConfigs) {
            try {
                this.addOrReplaceJob(jobConfig);
                loaded++;
            } catch (DbDriveException e) {
                log.warn("load job failed. job is {}, error is {}", jobConfig.getJobName(), e.getDbDriveMessage());
            }
        }
        log.info("enabled jobs loaded. {} of {}", loaded, jobConfigs.size());
    }

    private void submitRun(JobConfigEntity jobConfig) throws BusinessException {
        try {
            this.backupJobWorker.execute(() -> this.runSafely(jobConfig));
        } catch (RejectedExecutionException e) {
            throw new BusinessException("submit backup run failed. job is %s".formatted(jobConfig.getJobName()), e);
        }
    }

    private void runSafely(JobConfigEntity jobConfig) {
        try {
            this.backupJobExecutor.execute(jobConfig);
        } catch (RuntimeException e) {
            log.error("backup run failed. job is {}", jobConfig.getJobName(), e);
        }
    }
}
