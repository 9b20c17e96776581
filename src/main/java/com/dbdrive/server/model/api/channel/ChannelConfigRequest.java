package com.dbdrive.server.model.api.channel;

import lombok.Data;
import lombok.ToString;

import java.util.Map;

@Data
public class ChannelConfigRequest {

    // identifies the channel on update
    private String channelName;

    // slack, discord, chatwork
    private String channelKind;

    @ToString.Exclude
    private Map<String, Object> settings;

    private Boolean enabled;

    private Boolean notifyOnSuccess;

    private Boolean notifyOnError;
}
