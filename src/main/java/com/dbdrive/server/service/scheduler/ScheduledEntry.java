package com.dbdrive.server.service.scheduler;

import com.dbdrive.server.model.internal.ScheduledJobInfo;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;

/**
 * One live cron trigger for one job. Arm and cancel are only called by
 * {@link ScheduledJobRegistry} under its write lock.
 */
@Slf4j
public class ScheduledEntry {

    @Getter
    private final String jobName;

    @Getter
    private final String cronExpression;

    private final CronExpression cron;

    private final Runnable task;

    private ScheduledFuture<?> future;

    private volatile Instant previousFireTime;

    public ScheduledEntry(String jobName, String cronExpression, CronExpression cron, Runnable task) {
        this.jobName = jobName;
        this.cronExpression = cronExpression;
        this.cron = cron;
        this.task = task;
    }

    void arm(TaskScheduler taskScheduler) {
        if (this.isArmed()) {
            return;
        }
        this.future = taskScheduler.schedule(this::fire, new CronTrigger(this.cronExpression));
        log.debug("trigger armed. job is {}, cron is {}", this.jobName, this.cronExpression);
    }

    void cancel() {
        if (this.future == null) {
            return;
        }
        // a run already handed to the worker pool is not interrupted
        this.future.cancel(false);
        this.future = null;
        log.debug("trigger cancelled. job is {}", this.jobName);
    }

    boolean isArmed() {
        return this.future != null && !this.future.isDone();
    }

    private void fire() {
        this.previousFireTime = Instant.now();
        try {
            this.task.run();
        } catch (RuntimeException e) {
            // an exception here would stop the cron trigger for good
            log.error("fire trigger failed. job is {}", this.jobName, e);
        }
    }

    ScheduledJobInfo toInfo() {
        Instant nextFireTime = null;
        if (this.isArmed()) {
            ZonedDateTime next = this.cron.next(ZonedDateTime.now());
            nextFireTime = next == null ? null : next.toInstant();
        }
        return new ScheduledJobInfo(this.jobName, this.cronExpression, nextFireTime, this.previousFireTime);
    }
}
