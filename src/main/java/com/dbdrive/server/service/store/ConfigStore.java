package com.dbdrive.server.service.store;

import com.dbdrive.server.exception.DbException;
import com.dbdrive.server.exception.ResourceNotFoundException;
import com.dbdrive.server.model.entity.BackupHistoryEntity;
import com.dbdrive.server.model.entity.ChannelConfigEntity;
import com.dbdrive.server.model.entity.JobConfigEntity;
import com.dbdrive.server.model.entity.TokenConfigEntity;

import java.util.List;

/**
 * Durable home of job configs, channel configs, run history and the drive token pair, as seen
 * by the scheduler, the executor, the dispatcher and the credential service.
 */
public interface ConfigStore {

    List<JobConfigEntity> listEnabledJobs() throws DbException;

    JobConfigEntity getJob(String jobName) throws ResourceNotFoundException;

    /**
     * Inserts the row when it has no id yet (and assigns one), otherwise overwrites it.
     */
    void saveOrUpdateHistory(BackupHistoryEntity backupHistoryEntity) throws DbException;

    List<ChannelConfigEntity> listEnabledChannels() throws DbException;

    ChannelConfigEntity getChannel(String channelName) throws ResourceNotFoundException;

    // null until a token has been stored
    TokenConfigEntity getToken() throws DbException;

    void saveToken(TokenConfigEntity tokenConfigEntity) throws DbException;
}
