package com.dbdrive.server.model.notification.discord;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class DiscordWebhookPayload {

    @JsonProperty("username")
    private String username;

    @JsonProperty("avatar_url")
    private String avatarUrl;

    @JsonProperty("content")
    private String content;

    @JsonProperty("embeds")
    private List<Embed> embeds = new ArrayList<>();

    @Data
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class Embed {

        @JsonProperty("title")
        private String title;

        @JsonProperty("description")
        private String description;

        // 0xRRGGBB
        @JsonProperty("color")
        private Integer color;

        @JsonProperty("fields")
        private List<EmbedField> fields = new ArrayList<>();

        @JsonProperty("footer")
        private Footer footer;

        // RFC 3339
        @JsonProperty("timestamp")
        private String timestamp;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EmbedField {

        @JsonProperty("name")
        private String name;

        @JsonProperty("value")
        private String value;

        @JsonProperty("inline")
        private boolean inline;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Footer {

        @JsonProperty("text")
        private String text;
    }
}
