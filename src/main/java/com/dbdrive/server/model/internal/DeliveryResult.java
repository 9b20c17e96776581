package com.dbdrive.server.model.internal;

import com.dbdrive.server.enums.ChannelKindEnum;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class DeliveryResult {

    private String channelName;

    // null when the stored kind has no adapter
    private ChannelKindEnum channelKind;

    private boolean success;

    private String error;

    private Instant sentAt;

    public static DeliveryResult success(String channelName, ChannelKindEnum channelKind, Instant sentAt) {
        return new DeliveryResult(channelName, channelKind, true, null, sentAt);
    }

    public static DeliveryResult failed(
            String channelName, ChannelKindEnum channelKind, Instant sentAt, String error) {
        return new DeliveryResult(channelName, channelKind, false, error, sentAt);
    }
}
