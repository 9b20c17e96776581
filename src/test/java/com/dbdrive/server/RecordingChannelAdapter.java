package com.dbdrive.server;

import com.dbdrive.server.enums.ChannelKindEnum;
import com.dbdrive.server.exception.DeliveryException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.internal.NotificationMessage;
import com.dbdrive.server.service.notification.channel.ChannelAdapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Adapter driven by its settings: {@code target} names the delivery, {@code delayMs} slows
 * the send down, {@code fail} makes it throw and {@code invalid} fails validation.
 */
public class RecordingChannelAdapter implements ChannelAdapter {

    private final ChannelKindEnum kind;

    private final List<String> deliveries = new CopyOnWriteArrayList<>();

    public RecordingChannelAdapter(ChannelKindEnum kind) {
        this.kind = kind;
    }

    public static Map<String, Object> settings(String target, long delayMs, boolean fail) {
        return Map.of("target", target, "delayMs", delayMs, "fail", fail);
    }

    @Override
    public ChannelKindEnum kind() {
        return this.kind;
    }

    @Override
    public void validateConfig(Map<String, Object> settings) throws ValidationException {
        if (settings.containsKey("invalid") || !settings.containsKey("target")) {
            throw new ValidationException("recording validateConfig failed. target is required");
        }
    }

    @Override
    public void send(NotificationMessage message, Map<String, Object> settings) throws DeliveryException {
        long delayMs = ((Number) settings.getOrDefault("delayMs", 0)).longValue();
        if (delayMs > 0) {
            TestUtil.waitMillis(delayMs);
        }
        if (Boolean.TRUE.equals(settings.get("fail"))) {
            throw new DeliveryException("recording send failed. target is %s".formatted(settings.get("target")));
        }
        this.deliveries.add(settings.get("target") + "|" + message.getTitle());
    }

    public List<String> getDeliveries() {
        return new ArrayList<>(this.deliveries);
    }

    public List<String> getTargets() {
        return this.deliveries.stream().map(delivery -> delivery.substring(0, delivery.indexOf('|'))).toList();
    }
}
