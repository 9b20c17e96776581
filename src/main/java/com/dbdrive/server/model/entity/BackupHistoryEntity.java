package com.dbdrive.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.sql.Timestamp;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("backup_history")
public class BackupHistoryEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long backupHistoryId;

    private String jobName;

    private String databaseKind;

    // RUNNING, SUCCESS, FAILED
    private String status;

    private Timestamp startedAt;

    // null until terminal
    private Timestamp completedAt;

    private String artifactName;

    // storage file id
    private String artifactId;

    private Long artifactSize;

    private String errorMessage;
}
