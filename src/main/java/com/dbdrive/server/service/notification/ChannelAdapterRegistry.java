package com.dbdrive.server.service.notification;

import com.dbdrive.server.enums.ChannelKindEnum;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.service.notification.channel.ChannelAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Channel kind -> adapter. Built once from every {@link ChannelAdapter} bean.
 */
@Slf4j
@Component
public class ChannelAdapterRegistry {

    private final Map<ChannelKindEnum, ChannelAdapter> adapters = new EnumMap<>(ChannelKindEnum.class);

    @Autowired
    public ChannelAdapterRegistry(List<ChannelAdapter> channelAdapters) {
        for (ChannelAdapter channelAdapter : channelAdapters) {
            ChannelAdapter previous = this.adapters.put(channelAdapter.kind(), channelAdapter);
            if (previous != null) {
                throw new IllegalStateException("ChannelAdapterRegistry init failed. duplicate adapter for %s"
                        .formatted(channelAdapter.kind()));
            }
        }
        log.info("channel adapters registered. kinds are {}", this.adapters.keySet());
    }

    // null when no adapter serves the kind
    public ChannelAdapter find(String channelKind) {
        ChannelKindEnum kind = ChannelKindEnum.fromKind(channelKind);
        return kind == null ? null : this.adapters.get(kind);
    }

    public ChannelAdapter get(String channelKind) throws ValidationException {
        ChannelAdapter channelAdapter = this.find(channelKind);
        if (channelAdapter == null) {
            throw new ValidationException("get channel adapter failed. unsupported channel kind %s"
                    .formatted(channelKind));
        }
        return channelAdapter;
    }

    public Set<ChannelKindEnum> supportedKinds() {
        return Collections.unmodifiableSet(this.adapters.keySet());
    }
}
