package com.dbdrive.server.util;

import com.dbdrive.server.enums.BackupModeEnum;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.api.channel.ChannelConfigRequest;
import com.dbdrive.server.model.api.job.JobConfigRequest;
import com.dbdrive.server.service.backup.MysqlConnectionInfo;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

public class EntityValidationUtil {

    public static void isCreateJobConfigRequestValid(
            JobConfigRequest jobConfigRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(jobConfigRequest)) {
            throw new ValidationException("isCreateJobConfigRequestValid failed. jobConfigRequest is null");
        }
        if (StringUtils.isAnyBlank(
                jobConfigRequest.getJobName(),
                jobConfigRequest.getCronExpression(),
                jobConfigRequest.getBackupMode(),
                jobConfigRequest.getDatabaseConnectionRef()
        )) {
            throw new ValidationException("isCreateJobConfigRequestValid failed. " +
                    "jobName, cronExpression, backupMode or databaseConnectionRef is blank. " +
                    "jobConfigRequest is %s".formatted(jobConfigRequest));
        }
        isJobConfigFieldValid(jobConfigRequest);
    }

    public static void isUpdateJobConfigRequestValid(
            JobConfigRequest jobConfigRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(jobConfigRequest) || StringUtils.isBlank(jobConfigRequest.getJobName())) {
            throw new ValidationException("isUpdateJobConfigRequestValid failed. jobName is blank");
        }
        isJobConfigFieldValid(jobConfigRequest);
    }

    // fields that are present must be well formed
    private static void isJobConfigFieldValid(JobConfigRequest jobConfigRequest) throws ValidationException {
        if (StringUtils.isNotBlank(jobConfigRequest.getCronExpression())) {
            CronUtil.validate(jobConfigRequest.getCronExpression());
        }
        if (StringUtils.isNotBlank(jobConfigRequest.getDatabaseConnectionRef())) {
            isDatabaseConnectionRefValid(jobConfigRequest.getDatabaseConnectionRef());
        }
        if (StringUtils.isNotBlank(jobConfigRequest.getBackupMode())
                && BackupModeEnum.fromMode(jobConfigRequest.getBackupMode()) == null) {
            throw new ValidationException("isJobConfigFieldValid failed. unsupported backupMode %s"
                    .formatted(jobConfigRequest.getBackupMode()));
        }
    }

    // the ref carries a password, keep it out of the message
    private static void isDatabaseConnectionRefValid(String databaseConnectionRef) throws ValidationException {
        if (!MysqlConnectionInfo.isMysqlRef(databaseConnectionRef)) {
            throw new ValidationException("isDatabaseConnectionRefValid failed. only mysql connection is supported");
        }
        MysqlConnectionInfo.parse(databaseConnectionRef);
    }

    public static void isCreateChannelConfigRequestValid(
            ChannelConfigRequest channelConfigRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(channelConfigRequest)) {
            throw new ValidationException("isCreateChannelConfigRequestValid failed. channelConfigRequest is null");
        }
        if (StringUtils.isAnyBlank(channelConfigRequest.getChannelName(), channelConfigRequest.getChannelKind())) {
            throw new ValidationException("isCreateChannelConfigRequestValid failed. " +
                    "channelName or channelKind is blank. channelConfigRequest is %s".formatted(channelConfigRequest));
        }
        if (ObjectUtils.isEmpty(channelConfigRequest.getSettings())) {
            throw new ValidationException("isCreateChannelConfigRequestValid failed. settings is empty");
        }
    }

    public static void isUpdateChannelConfigRequestValid(
            ChannelConfigRequest channelConfigRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(channelConfigRequest) || StringUtils.isBlank(channelConfigRequest.getChannelName())) {
            throw new ValidationException("isUpdateChannelConfigRequestValid failed. channelName is blank");
        }
    }
}
