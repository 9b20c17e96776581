package com.dbdrive.server.service.notification;

import com.dbdrive.server.enums.MessageTypeEnum;
import com.dbdrive.server.model.internal.NotificationEvent;
import com.dbdrive.server.model.internal.NotificationMessage;
import com.dbdrive.server.util.FormatUtil;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.LinkedHashMap;

public class NotificationMessageFactory {

    public static final String DATABASE_TYPE = "Database Type";

    public static final String FILE_NAME = "File Name";

    public static final String FILE_SIZE = "File Size";

    public static final String DURATION = "Duration";

    public static final String ERROR = "Error";

    public static NotificationMessage successMessage(NotificationEvent event, MessageDecoration decoration) {
        LinkedHashMap<String, String> fields = new LinkedHashMap<>();
        fields.put(decoration.label(DATABASE_TYPE), StringUtils.defaultString(event.getDatabaseKind()));
        fields.put(decoration.label(FILE_NAME), StringUtils.defaultString(event.getArtifactName()));
        fields.put(decoration.label(FILE_SIZE), FormatUtil.humanReadableSize(event.getSizeBytes()));
        fields.put(decoration.label(DURATION), FormatUtil.humanReadableDuration(event.getDuration()));
        if (StringUtils.isNotBlank(event.getArtifactLink())) {
            fields.put(decoration.getLinkLabel(), decoration.getLinkTemplate().formatted(event.getArtifactLink()));
        }
        return NotificationMessage.builder()
                .type(MessageTypeEnum.SUCCESS)
                .title("%sBackup Completed: %s".formatted(decoration.getSuccessTitlePrefix(), event.getJobName()))
                .text("Database backup completed successfully for %s".formatted(emphasize(event, decoration)))
                .fields(fields)
                .timestamp(completedOrNow(event))
                .jobName(event.getJobName())
                .build();
    }

    public static NotificationMessage failureMessage(NotificationEvent event, MessageDecoration decoration) {
        LinkedHashMap<String, String> fields = new LinkedHashMap<>();
        fields.put(decoration.label(DATABASE_TYPE), StringUtils.defaultString(event.getDatabaseKind()));
        fields.put(decoration.label(DURATION), FormatUtil.humanReadableDuration(event.getDuration()));
        fields.put(decoration.label(ERROR), StringUtils.defaultString(event.getErrorMessage()));
        return NotificationMessage.builder()
                .type(MessageTypeEnum.ERROR)
                .title("%sBackup Failed: %s".formatted(decoration.getFailureTitlePrefix(), event.getJobName()))
                .text("Database backup failed for %s".formatted(emphasize(event, decoration)))
                .fields(fields)
                .timestamp(completedOrNow(event))
                .jobName(event.getJobName())
                .build();
    }

    public static NotificationMessage testMessage(String channelName, String channelKind) {
        LinkedHashMap<String, String> fields = new LinkedHashMap<>();
        fields.put("Channel", channelKind);
        fields.put("Configuration", channelName);
        fields.put("Test Status", "Success");
        return NotificationMessage.builder()
                .type(MessageTypeEnum.INFO)
                .title("Test Notification")
                .text("This is a test notification from the Database Backup Service via %s".formatted(channelKind))
                .fields(fields)
                .timestamp(Instant.now())
                .build();
    }

    private static String emphasize(NotificationEvent event, MessageDecoration decoration) {
        return decoration.getEmphasis() + event.getJobName() + decoration.getEmphasis();
    }

    private static Instant completedOrNow(NotificationEvent event) {
        return event.getCompletedAt() == null ? Instant.now() : event.getCompletedAt();
    }
}
