package com.dbdrive.server.service.notification;

import com.dbdrive.server.enums.MessageTypeEnum;
import com.dbdrive.server.enums.RunStatusEnum;
import com.dbdrive.server.model.internal.NotificationEvent;
import com.dbdrive.server.model.internal.NotificationMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotificationMessageFactoryTest {

    private final Instant completedAt = Instant.parse("2024-01-01T02:01:30Z");

    private final NotificationEvent successEvent = NotificationEvent.builder()
            .jobName("nightly")
            .databaseKind("mysql")
            .outcome(RunStatusEnum.SUCCESS)
            .sizeBytes(2048)
            .artifactName("nightly_20240101.sql")
            .artifactLink("https://x/D1")
            .startedAt(Instant.parse("2024-01-01T02:00:00Z"))
            .completedAt(this.completedAt)
            .build();

    @Test
    void ShouldKeepFieldOrderWhenSuccessMessage() {
        NotificationMessage message = NotificationMessageFactory.successMessage(
                this.successEvent, MessageDecoration.plain());

        assertEquals(MessageTypeEnum.SUCCESS, message.getType());
        assertEquals("Backup Completed: nightly", message.getTitle());
        assertEquals("Database backup completed successfully for nightly", message.getText());
        assertEquals(
                List.of("Database Type", "File Name", "File Size", "Duration", "Google Drive Link"),
                new ArrayList<>(message.getFields().keySet()));
        assertEquals("2.0 KB", message.getFields().get("File Size"));
        assertEquals("1m30s", message.getFields().get("Duration"));
        assertEquals("https://x/D1", message.getFields().get("Google Drive Link"));
        assertEquals(this.completedAt, message.getTimestamp());
        assertEquals("nightly", message.getJobName());
    }

    @Test
    void ShouldOmitLinkWhenArtifactLinkMissing() {
        this.successEvent.setArtifactLink(null);

        NotificationMessage message = NotificationMessageFactory.successMessage(
                this.successEvent, MessageDecoration.plain());

        assertFalse(message.getFields().containsKey("Google Drive Link"));
        assertEquals(4, message.getFields().size());
    }

    @Test
    void ShouldApplyDecorationWhenDecorated() {
        MessageDecoration decoration = MessageDecoration.builder()
                .successTitlePrefix("✅ ")
                .emphasis("**")
                .linkLabel("Drive")
                .linkTemplate("[View File](%s)")
                .fieldLabels(Map.of(NotificationMessageFactory.FILE_SIZE, "📊 File Size"))
                .build();

        NotificationMessage message = NotificationMessageFactory.successMessage(this.successEvent, decoration);

        assertEquals("✅ Backup Completed: nightly", message.getTitle());
        assertEquals("Database backup completed successfully for **nightly**", message.getText());
        assertEquals("2.0 KB", message.getFields().get("📊 File Size"));
        assertEquals("[View File](https://x/D1)", message.getFields().get("Drive"));
    }

    @Test
    void ShouldCarryErrorWhenFailureMessage() {
        NotificationEvent event = NotificationEvent.builder()
                .jobName("nightly")
                .databaseKind("mysql")
                .outcome(RunStatusEnum.FAILED)
                .errorMessage("connection refused")
                .startedAt(Instant.parse("2024-01-01T02:00:00Z"))
                .completedAt(Instant.parse("2024-01-01T02:00:05Z"))
                .build();

        NotificationMessage message = NotificationMessageFactory.failureMessage(event, MessageDecoration.plain());

        assertEquals(MessageTypeEnum.ERROR, message.getType());
        assertEquals("Backup Failed: nightly", message.getTitle());
        assertEquals(List.of("Database Type", "Duration", "Error"), new ArrayList<>(message.getFields().keySet()));
        assertEquals("connection refused", message.getFields().get("Error"));
        assertEquals("5s", message.getFields().get("Duration"));
    }

    @Test
    void ShouldBeInfoWhenTestMessage() {
        NotificationMessage message = NotificationMessageFactory.testMessage("ops", "slack");

        assertEquals(MessageTypeEnum.INFO, message.getType());
        assertEquals("Test Notification", message.getTitle());
        assertEquals("slack", message.getFields().get("Channel"));
        assertEquals("ops", message.getFields().get("Configuration"));
        assertNotNull(message.getTimestamp());
    }
}
