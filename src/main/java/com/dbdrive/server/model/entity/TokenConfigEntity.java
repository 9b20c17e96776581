package com.dbdrive.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.sql.Timestamp;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("token_config")
public class TokenConfigEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long tokenConfigId;

    private String clientId;

    @ToString.Exclude
    private String accessToken;

    @ToString.Exclude
    private String refreshToken;

    private String tokenType;

    // access token expiry
    private Timestamp expiry;
}
