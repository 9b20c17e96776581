package com.dbdrive.server.model.notification.slack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SlackWebhookPayload {

    @JsonProperty("channel")
    private String channel;

    @JsonProperty("username")
    private String username;

    @JsonProperty("icon_emoji")
    private String iconEmoji;

    @JsonProperty("icon_url")
    private String iconUrl;

    @JsonProperty("text")
    private String text;

    @JsonProperty("attachments")
    private List<Attachment> attachments = new ArrayList<>();

    @Data
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class Attachment {

        @JsonProperty("color")
        private String color;

        @JsonProperty("title")
        private String title;

        @JsonProperty("text")
        private String text;

        @JsonProperty("fields")
        private List<Field> fields = new ArrayList<>();

        @JsonProperty("footer")
        private String footer;

        // epoch seconds
        @JsonProperty("ts")
        private Long ts;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Field {

        @JsonProperty("title")
        private String title;

        @JsonProperty("value")
        private String value;

        @JsonProperty("short")
        private boolean shortField;
    }
}
