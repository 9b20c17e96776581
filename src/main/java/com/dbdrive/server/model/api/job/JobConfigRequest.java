package com.dbdrive.server.model.api.job;

import lombok.Data;
import lombok.ToString;

@Data
public class JobConfigRequest {

    // identifies the job on update
    private String jobName;

    private String cronExpression;

    // full, schema
    private String backupMode;

    @ToString.Exclude
    private String databaseConnectionRef;

    private String databaseKind;

    // null means true on create, unchanged on update
    private Boolean enabled;
}
