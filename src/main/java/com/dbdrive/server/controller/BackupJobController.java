package com.dbdrive.server.controller;

import com.dbdrive.server.model.api.global.DbDriveHttpResponse;
import com.dbdrive.server.model.api.job.JobConfigInfo;
import com.dbdrive.server.model.api.job.JobConfigRequest;
import com.dbdrive.server.model.entity.BackupHistoryEntity;
import com.dbdrive.server.model.internal.ScheduledJobInfo;
import com.dbdrive.server.service.facade.JobConfigFacadeService;
import com.dbdrive.server.service.scheduler.BackupScheduler;
import com.dbdrive.server.util.CronUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/backup-job")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class BackupJobController {

    private final JobConfigFacadeService jobConfigFacadeService;

    private final BackupScheduler backupScheduler;

    @Autowired
    public BackupJobController(
            JobConfigFacadeService jobConfigFacadeService,
            BackupScheduler backupScheduler) {
        this.jobConfigFacadeService = jobConfigFacadeService;
        this.backupScheduler = backupScheduler;
    }

    @PostMapping("/create-job")
    public DbDriveHttpResponse<JobConfigInfo> createJob(@RequestBody JobConfigRequest jobConfigRequest) {
        return DbDriveHttpResponse.success(this.jobConfigFacadeService.createJob(jobConfigRequest));
    }

    @PostMapping("/update-job")
    public DbDriveHttpResponse<JobConfigInfo> updateJob(@RequestBody JobConfigRequest jobConfigRequest) {
        return DbDriveHttpResponse.success(this.jobConfigFacadeService.updateJob(jobConfigRequest));
    }

    @PostMapping("/delete-job")
    public DbDriveHttpResponse<Void> deleteJob(@RequestParam("jobName") String jobName) {
        this.jobConfigFacadeService.deleteJob(jobName);
        return DbDriveHttpResponse.success();
    }

    @GetMapping("/get-all-job")
    public DbDriveHttpResponse<List<JobConfigInfo>> getAllJob() {
        return DbDriveHttpResponse.success(this.jobConfigFacadeService.listJobs());
    }

    // fire and forget, poll get-history for the outcome
    @PostMapping("/trigger-job")
    public DbDriveHttpResponse<Void> triggerJob(@RequestParam("jobName") String jobName) {
        this.backupScheduler.triggerNow(jobName);
        return DbDriveHttpResponse.success(null, "job %s triggered".formatted(jobName));
    }

    @GetMapping("/get-scheduled-job")
    public DbDriveHttpResponse<List<ScheduledJobInfo>> getScheduledJob() {
        return DbDriveHttpResponse.success(this.backupScheduler.listScheduled());
    }

    @GetMapping("/get-history")
    public DbDriveHttpResponse<List<BackupHistoryEntity>> getHistory(
            @RequestParam(value = "jobName", required = false) String jobName,
            @RequestParam(value = "limit", defaultValue = "20") long limit,
            @RequestParam(value = "offset", defaultValue = "0") long offset) {
        return DbDriveHttpResponse.success(this.jobConfigFacadeService.listHistory(jobName, limit, offset));
    }

    @GetMapping("/get-next-run-times")
    public DbDriveHttpResponse<List<LocalDateTime>> getNextRunTimes(
            @RequestParam("cronExpression") String cronExpression,
            @RequestParam(value = "count", defaultValue = "5") int count) {
        return DbDriveHttpResponse.success(CronUtil.nextRunTimes(cronExpression, count));
    }

    @PostMapping("/start-scheduler")
    public DbDriveHttpResponse<Void> startScheduler() {
        this.backupScheduler.start();
        return DbDriveHttpResponse.success();
    }

    @PostMapping("/stop-scheduler")
    public DbDriveHttpResponse<Void> stopScheduler() {
        this.backupScheduler.stop();
        return DbDriveHttpResponse.success();
    }
}
