package com.dbdrive.server.model.internal;

import com.dbdrive.server.enums.RunStatusEnum;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one backup run, built by the executor and consumed by the dispatcher.
 */
@Data
@Builder
public class NotificationEvent {

    private String jobName;

    private String databaseKind;

    private RunStatusEnum outcome;

    private long sizeBytes;

    private String artifactName;

    private String artifactLink;

    private String errorMessage;

    private Instant startedAt;

    private Instant completedAt;

    public Duration getDuration() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = completedAt == null ? Instant.now() : completedAt;
        return Duration.between(startedAt, end);
    }
}
