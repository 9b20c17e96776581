package com.dbdrive.server.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.dbdrive.server.exception.DbException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.mapper.JobConfigMapper;
import com.dbdrive.server.model.entity.JobConfigEntity;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class JobConfigService extends ServiceImpl<JobConfigMapper, JobConfigEntity> {

    public JobConfigEntity getByJobName(String jobName) {
        if (StringUtils.isBlank(jobName)) {
            return null;
        }
        LambdaQueryWrapper<JobConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(JobConfigEntity::getJobName, jobName);
        List<JobConfigEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? null : dbResult.get(0);
    }

    public List<JobConfigEntity> getAllEnabled() {
        LambdaQueryWrapper<JobConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(JobConfigEntity::getEnabled, true);
        queryWrapper.orderByAsc(JobConfigEntity::getJobConfigId);
        return this.list(queryWrapper);
    }

    public List<JobConfigEntity> getAll() {
        LambdaQueryWrapper<JobConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.orderByAsc(JobConfigEntity::getJobConfigId);
        return this.list(queryWrapper);
    }

    public JobConfigEntity createJobConfig(JobConfigEntity jobConfigEntity) throws ValidationException, DbException {
        if (ObjectUtils.isEmpty(jobConfigEntity)) {
            throw new ValidationException("createJobConfig failed. jobConfigEntity is null");
        }
        if (ObjectUtils.isNotEmpty(this.getByJobName(jobConfigEntity.getJobName()))) {
            throw new ValidationException("createJobConfig failed. jobName %s already exists"
                    .formatted(jobConfigEntity.getJobName()));
        }
        boolean saved = this.save(jobConfigEntity);
        if (!saved) {
            throw new DbException("createJobConfig failed. can't write to database.");
        }
        return jobConfigEntity;
    }

    public void updateJobConfig(JobConfigEntity jobConfigEntity) throws ValidationException, DbException {
        if (ObjectUtils.anyNull(jobConfigEntity, jobConfigEntity.getJobConfigId())) {
            throw new ValidationException("updateJobConfig failed. jobConfigEntity or jobConfigId is null");
        }
        boolean updated = this.updateById(jobConfigEntity);
        if (!updated) {
            throw new DbException("updateJobConfig failed. can't write to database.");
        }
    }

    public boolean deleteByJobName(String jobName) throws DbException {
        LambdaQueryWrapper<JobConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(JobConfigEntity::getJobName, jobName);
        return this.remove(queryWrapper);
    }
}
