package com.dbdrive.server.service.store;

import com.dbdrive.server.exception.DbException;
import com.dbdrive.server.exception.ResourceNotFoundException;
import com.dbdrive.server.model.entity.BackupHistoryEntity;
import com.dbdrive.server.model.entity.ChannelConfigEntity;
import com.dbdrive.server.model.entity.JobConfigEntity;
import com.dbdrive.server.model.entity.TokenConfigEntity;
import com.dbdrive.server.service.db.impl.BackupHistoryService;
import com.dbdrive.server.service.db.impl.ChannelConfigService;
import com.dbdrive.server.service.db.impl.JobConfigService;
import com.dbdrive.server.service.db.impl.TokenConfigService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class DbConfigStore implements ConfigStore {

    private final JobConfigService jobConfigService;

    private final ChannelConfigService channelConfigService;

    private final BackupHistoryService backupHistoryService;

    private final TokenConfigService tokenConfigService;

    @Autowired
    public DbConfigStore(
            JobConfigService jobConfigService,
            ChannelConfigService channelConfigService,
            BackupHistoryService backupHistoryService,
            TokenConfigService tokenConfigService) {
        this.jobConfigService = jobConfigService;
        this.channelConfigService = channelConfigService;
        this.backupHistoryService = backupHistoryService;
        this.tokenConfigService = tokenConfigService;
    }

    @Override
    public List<JobConfigEntity> listEnabledJobs() throws DbException {
        return this.jobConfigService.getAllEnabled();
    }

    @Override
    public JobConfigEntity getJob(String jobName) throws ResourceNotFoundException {
        JobConfigEntity jobConfigEntity = this.jobConfigService.getByJobName(jobName);
        if (ObjectUtils.isEmpty(jobConfigEntity)) {
            throw new ResourceNotFoundException("getJob failed. jobName %s not found".formatted(jobName));
        }
        return jobConfigEntity;
    }

    @Override
    public void saveOrUpdateHistory(BackupHistoryEntity backupHistoryEntity) throws DbException {
        this.backupHistoryService.saveOrUpdateHistory(backupHistoryEntity);
    }

    @Override
    public List<ChannelConfigEntity> listEnabledChannels() throws DbException {
        return this.channelConfigService.getAllEnabled();
    }

    @Override
    public ChannelConfigEntity getChannel(String channelName) throws ResourceNotFoundException {
        ChannelConfigEntity channelConfigEntity = this.channelConfigService.getByChannelName(channelName);
        if (ObjectUtils.isEmpty(channelConfigEntity)) {
            throw new ResourceNotFoundException("getChannel failed. channelName %s not found"
                    .formatted(channelName));
        }
        return channelConfigEntity;
    }

    @Override
    public TokenConfigEntity getToken() throws DbException {
        return this.tokenConfigService.getLatest();
    }

    @Override
    public void saveToken(TokenConfigEntity tokenConfigEntity) throws DbException {
        this.tokenConfigService.saveToken(tokenConfigEntity);
    }
}
