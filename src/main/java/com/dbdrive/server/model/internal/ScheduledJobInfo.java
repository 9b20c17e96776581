package com.dbdrive.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class ScheduledJobInfo {

    private String jobName;

    private String cronExpression;

    private Instant nextFireTime;

    // null until the entry has fired once
    private Instant previousFireTime;
}
