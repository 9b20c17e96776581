package com.dbdrive.server.model.internal;

import com.dbdrive.server.enums.MessageTypeEnum;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;

/**
 * Channel independent message. Each adapter turns it into its own wire payload.
 */
@Data
@Builder
public class NotificationMessage {

    private MessageTypeEnum type;

    private String title;

    private String text;

    // insertion ordered
    @Builder.Default
    private LinkedHashMap<String, String> fields = new LinkedHashMap<>();

    private Instant timestamp;

    private String jobName;
}
