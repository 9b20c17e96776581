package com.dbdrive.server.model.notification.discord;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class DiscordSettings {

    @JsonProperty("webhook_url")
    private String webhookUrl;

    @JsonProperty("username")
    private String username;

    @JsonProperty("avatar_url")
    private String avatarUrl;
}
