package com.dbdrive.server.model.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("channel_config")
public class ChannelConfigEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long channelConfigId;

    // unique
    private String channelName;

    // slack, discord, chatwork
    private String channelKind;

    // json object, webhook url and tokens live here
    @ToString.Exclude
    private String settings;

    @TableField(fill = FieldFill.INSERT)
    private Boolean enabled;

    @TableField(fill = FieldFill.INSERT)
    private Boolean notifyOnSuccess;

    @TableField(fill = FieldFill.INSERT)
    private Boolean notifyOnError;
}
