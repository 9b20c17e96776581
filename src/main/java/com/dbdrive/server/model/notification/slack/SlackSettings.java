package com.dbdrive.server.model.notification.slack;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class SlackSettings {

    @JsonProperty("webhook_url")
    private String webhookUrl;

    // overrides the webhook's default channel
    @JsonProperty("channel")
    private String channel;

    @JsonProperty("username")
    private String username;

    @JsonProperty("icon_emoji")
    private String iconEmoji;

    @JsonProperty("icon_url")
    private String iconUrl;
}
