package com.dbdrive.server.model.api.job;

import com.dbdrive.server.model.entity.JobConfigEntity;
import lombok.Data;

/**
 * Job config as returned over http. The connection ref carries credentials and is left out.
 */
@Data
public class JobConfigInfo {

    private String jobConfigId;

    private String jobName;

    private String cronExpression;

    private String backupMode;

    private String databaseKind;

    private boolean enabled;

    public static JobConfigInfo from(JobConfigEntity jobConfigEntity) {
        JobConfigInfo jobConfigInfo = new JobConfigInfo();
        jobConfigInfo.setJobConfigId(String.valueOf(jobConfigEntity.getJobConfigId()));
        jobConfigInfo.setJobName(jobConfigEntity.getJobName());
        jobConfigInfo.setCronExpression(jobConfigEntity.getCronExpression());
        jobConfigInfo.setBackupMode(jobConfigEntity.getBackupMode());
        jobConfigInfo.setDatabaseKind(jobConfigEntity.getDatabaseKind());
        jobConfigInfo.setEnabled(Boolean.TRUE.equals(jobConfigEntity.getEnabled()));
        return jobConfigInfo;
    }
}
