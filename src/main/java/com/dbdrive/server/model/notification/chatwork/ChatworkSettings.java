package com.dbdrive.server.model.notification.chatwork;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

@Data
public class ChatworkSettings {

    @ToString.Exclude
    @JsonProperty("api_token")
    private String apiToken;

    @JsonProperty("room_id")
    private String roomId;
}
