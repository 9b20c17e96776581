package com.dbdrive.server.service.facade;

import com.dbdrive.server.enums.BackupModeEnum;
import com.dbdrive.server.exception.DbException;
import com.dbdrive.server.exception.ResourceNotFoundException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.api.job.JobConfigInfo;
import com.dbdrive.server.model.api.job.JobConfigRequest;
import com.dbdrive.server.model.entity.BackupHistoryEntity;
import com.dbdrive.server.model.entity.JobConfigEntity;
import com.dbdrive.server.service.db.impl.BackupHistoryService;
import com.dbdrive.server.service.db.impl.JobConfigService;
import com.dbdrive.server.service.scheduler.BackupScheduler;
import com.dbdrive.server.util.EntityValidationUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Job config CRUD. Every change is mirrored into the {@link BackupScheduler}: enabled jobs are
 * (re)scheduled, disabled or deleted ones are unscheduled.
 */
@Slf4j
@Service
public class JobConfigFacadeService {

    private final JobConfigService jobConfigService;

    private final BackupHistoryService backupHistoryService;

    private final BackupScheduler backupScheduler;

    @Autowired
    public JobConfigFacadeService(
            JobConfigService jobConfigService,
            BackupHistoryService backupHistoryService,
            BackupScheduler backupScheduler) {
        this.jobConfigService = jobConfigService;
        this.backupHistoryService = backupHistoryService;
        this.backupScheduler = backupScheduler;
    }

    public JobConfigInfo createJob(JobConfigRequest jobConfigRequest) throws ValidationException, DbException {
        EntityValidationUtil.isCreateJobConfigRequestValid(jobConfigRequest);
        JobConfigEntity jobConfigEntity = new JobConfigEntity();
        jobConfigEntity.setJobName(jobConfigRequest.getJobName().trim());
        jobConfigEntity.setCronExpression(jobConfigRequest.getCronExpression().trim());
        jobConfigEntity.setBackupMode(BackupModeEnum.fromMode(jobConfigRequest.getBackupMode()).getMode());
        jobConfigEntity.setDatabaseConnectionRef(jobConfigRequest.getDatabaseConnectionRef().trim());
        jobConfigEntity.setDatabaseKind(StringUtils.defaultIfBlank(jobConfigRequest.getDatabaseKind(), "mysql"));
        jobConfigEntity.setEnabled(ObjectUtils.defaultIfNull(jobConfigRequest.getEnabled(), true));
        this.jobConfigService.createJobConfig(jobConfigEntity);
        this.syncScheduler(jobConfigEntity);
        log.info("job created. job is {}", jobConfigEntity);
        return JobConfigInfo.from(jobConfigEntity);
    }

    public JobConfigInfo updateJob(JobConfigRequest jobConfigRequest)
            throws ValidationException, ResourceNotFoundException, DbException {
        EntityValidationUtil.isUpdateJobConfigRequestValid(jobConfigRequest);
        JobConfigEntity jobConfigEntity = this.getJobOrThrow(jobConfigRequest.getJobName());
        // only the fields present in the request change
        if (StringUtils.isNotBlank(jobConfigRequest.getCronExpression())) {
            jobConfigEntity.setCronExpression(jobConfigRequest.getCronExpression().trim());
        }
        if (StringUtils.isNotBlank(jobConfigRequest.getBackupMode())) {
            jobConfigEntity.setBackupMode(BackupModeEnum.fromMode(jobConfigRequest.getBackupMode()).getMode());
        }
        if (StringUtils.isNotBlank(jobConfigRequest.getDatabaseConnectionRef())) {
            jobConfigEntity.setDatabaseConnectionRef(jobConfigRequest.getDatabaseConnectionRef().trim());
        }
        if (StringUtils.isNotBlank(jobConfigRequest.getDatabaseKind())) {
            jobConfigEntity.setDatabaseKind(jobConfigRequest.getDatabaseKind().trim());
        }
        if (ObjectUtils.isNotEmpty(jobConfigRequest.getEnabled())) {
            jobConfigEntity.setEnabled(jobConfigRequest.getEnabled());
        }
        this.jobConfigService.updateJobConfig(jobConfigEntity);
        this.syncScheduler(jobConfigEntity);
        log.info("job updated. job is {}", jobConfigEntity);
        return JobConfigInfo.from(jobConfigEntity);
    }

    public void deleteJob(String jobName) throws ResourceNotFoundException, DbException {
        JobConfigEntity jobConfigEntity = this.getJobOrThrow(jobName);
        this.backupScheduler.removeJob(jobConfigEntity.getJobName());
        this.jobConfigService.deleteByJobName(jobConfigEntity.getJobName());
        log.info("job deleted. job is {}", jobName);
    }

    public List<JobConfigInfo> listJobs() {
        return this.jobConfigService.getAll().stream().map(JobConfigInfo::from).toList();
    }

    public List<BackupHistoryEntity> listHistory(String jobName, long limit, long offset) throws ValidationException {
        return this.backupHistoryService.listHistory(jobName, limit, offset);
    }

    private JobConfigEntity getJobOrThrow(String jobName) throws ResourceNotFoundException {
        JobConfigEntity jobConfigEntity = this.jobConfigService.getByJobName(jobName);
        if (ObjectUtils.isEmpty(jobConfigEntity)) {
            throw new ResourceNotFoundException("getJob failed. jobName %s not found".formatted(jobName));
        }
        return jobConfigEntity;
    }

    private void syncScheduler(JobConfigEntity jobConfigEntity) throws ValidationException {
        if (Boolean.TRUE.equals(jobConfigEntity.getEnabled())) {
            this.backupScheduler.addOrReplaceJob(jobConfigEntity);
        } else {
            this.backupScheduler.removeJob(jobConfigEntity.getJobName());
        }
    }
}
