package com.dbdrive.server.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.dbdrive.server.exception.DbException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.mapper.TokenConfigMapper;
import com.dbdrive.server.model.entity.TokenConfigEntity;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * One drive token pair per server. Saving always overwrites the latest row.
 */
@Service
@Slf4j
public class TokenConfigService extends ServiceImpl<TokenConfigMapper, TokenConfigEntity> {

    public TokenConfigEntity getLatest() {
        LambdaQueryWrapper<TokenConfigEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.orderByDesc(TokenConfigEntity::getTokenConfigId);
        queryWrapper.last("LIMIT 1");
        List<TokenConfigEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? null : dbResult.get(0);
    }

    public void saveToken(TokenConfigEntity tokenConfigEntity) throws ValidationException, DbException {
        if (ObjectUtils.isEmpty(tokenConfigEntity)) {
            throw new ValidationException("saveToken failed. tokenConfigEntity is null");
        }
        if (ObjectUtils.isEmpty(tokenConfigEntity.getTokenConfigId())) {
            TokenConfigEntity latest = this.getLatest();
            if (ObjectUtils.isNotEmpty(latest)) {
                tokenConfigEntity.setTokenConfigId(latest.getTokenConfigId());
            }
        }
        boolean written = ObjectUtils.isEmpty(tokenConfigEntity.getTokenConfigId()) ?
                this.save(tokenConfigEntity) :
                this.updateById(tokenConfigEntity);
        if (!written) {
            throw new DbException("saveToken failed. can't write to database. token is %s"
                    .formatted(tokenConfigEntity));
        }
    }
}
