package com.dbdrive.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.dbdrive.server.model.entity.ChannelConfigEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ChannelConfigMapper extends BaseMapper<ChannelConfigEntity> {
}
