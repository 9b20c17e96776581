package com.dbdrive.server.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.dbdrive.server.exception.DbException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.mapper.BackupHistoryMapper;
import com.dbdrive.server.model.entity.BackupHistoryEntity;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class BackupHistoryService extends ServiceImpl<BackupHistoryMapper, BackupHistoryEntity> {

    // insert when the id is absent, otherwise update the whole row
    public void saveOrUpdateHistory(BackupHistoryEntity backupHistoryEntity) throws ValidationException, DbException {
        if (ObjectUtils.isEmpty(backupHistoryEntity)) {
            throw new ValidationException("saveOrUpdateHistory failed. backupHistoryEntity is null");
        }
        boolean written = ObjectUtils.isEmpty(backupHistoryEntity.getBackupHistoryId()) ?
                this.save(backupHistoryEntity) :
                this.updateById(backupHistoryEntity);
        if (!written) {
            throw new DbException("saveOrUpdateHistory failed. can't write to database. history is %s"
                    .formatted(backupHistoryEntity));
        }
    }

    // newest first, jobName is optional
    public List<BackupHistoryEntity> listHistory(String jobName, long limit, long offset) {
        if (limit <= 0 || offset < 0) {
            throw new ValidationException("listHistory failed. limit is %d, offset is %d".formatted(limit, offset));
        }
        LambdaQueryWrapper<BackupHistoryEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(StringUtils.isNotBlank(jobName), BackupHistoryEntity::getJobName, jobName);
        queryWrapper.orderByDesc(BackupHistoryEntity::getBackupHistoryId);
        queryWrapper.last("LIMIT %d OFFSET %d".formatted(limit, offset));
        return this.list(queryWrapper);
    }

    public BackupHistoryEntity getByBackupHistoryId(long backupHistoryId) {
        return this.getById(backupHistoryId);
    }
}
