package com.dbdrive.server.service.notification;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * Channel specific markup applied on top of the common success and failure messages.
 */
@Getter
@Builder
public class MessageDecoration {

    @Builder.Default
    private final String successTitlePrefix = "";

    @Builder.Default
    private final String failureTitlePrefix = "";

    // wraps the job name in the message text, "*" for slack, "**" for discord
    @Builder.Default
    private final String emphasis = "";

    @Builder.Default
    private final String linkLabel = "Google Drive Link";

    // receives the link as its only argument
    @Builder.Default
    private final String linkTemplate = "%s";

    // field label -> decorated label
    @Builder.Default
    private final Map<String, String> fieldLabels = Map.of();

    public String label(String field) {
        return this.fieldLabels.getOrDefault(field, field);
    }

    public static MessageDecoration plain() {
        return MessageDecoration.builder().build();
    }
}
