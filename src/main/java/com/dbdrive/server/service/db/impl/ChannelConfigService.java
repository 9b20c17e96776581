package com.dbdrive.server.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.dbdrive.server.exception.DbException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.mapper.ChannelConfigMapper;
import com.dbdrive.server.model.entity.ChannelConfigEntity;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class ChannelConfigService extends ServiceImpl<ChannelConfigMapper, ChannelConfigEntity> {

    public ChannelConfigEntity getByChannelName(String channelName) {
        if (StringUtils.isBlank(channelName)) {
            return null;
        }
        LambdaQueryWrapper<ChannelConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ChannelConfigEntity::getChannelName, channelName);
        List<ChannelConfigEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? null : dbResult.get(0);
    }

    public List<ChannelConfigEntity> getAllEnabled() {
        LambdaQueryWrapper<ChannelConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ChannelConfigEntity::getEnabled, true);
        queryWrapper.orderByAsc(ChannelConfigEntity::getChannelConfigId);
        return this.list(queryWrapper);
    }

    public List<ChannelConfigEntity> getAll() {
        LambdaQueryWrapper<ChannelConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.orderByAsc(ChannelConfigEntity::getChannelConfigId);
        return this.list(queryWrapper);
    }

    public ChannelConfigEntity createChannelConfig(
            ChannelConfigEntity channelConfigEntity) throws ValidationException, DbException {
        if (ObjectUtils.isEmpty(channelConfigEntity)) {
            throw new ValidationException("createChannelConfig failed. channelConfigEntity is null");
        }
        if (ObjectUtils.isNotEmpty(this.getByChannelName(channelConfigEntity.getChannelName()))) {
            throw new ValidationException("createChannelConfig failed. channelName %s already exists"
                    .formatted(channelConfigEntity.getChannelName()));
        }
        boolean saved = this.save(channelConfigEntity);
        if (!saved) {
            throw new DbException("createChannelConfig failed. can't write to database.");
        }
        return channelConfigEntity;
    }

    public void updateChannelConfig(
            ChannelConfigEntity channelConfigEntity) throws ValidationException, DbException {
        if (ObjectUtils.anyNull(channelConfigEntity, channelConfigEntity.getChannelConfigId())) {
            throw new ValidationException("updateChannelConfig failed. " +
                    "channelConfigEntity or channelConfigId is null");
        }
        boolean updated = this.updateById(channelConfigEntity);
        if (!updated) {
            throw new DbException("updateChannelConfig failed. can't write to database.");
        }
    }

    public boolean deleteByChannelName(String channelName) {
        LambdaQueryWrapper<ChannelConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ChannelConfigEntity::getChannelName, channelName);
        return this.remove(queryWrapper);
    }
}
