package com.dbdrive.server.service.notification;

import com.dbdrive.server.enums.ChannelKindEnum;
import com.dbdrive.server.exception.DbDriveException;
import com.dbdrive.server.exception.ResourceNotFoundException;
import com.dbdrive.server.model.entity.ChannelConfigEntity;
import com.dbdrive.server.model.internal.DeliveryResult;
import com.dbdrive.server.model.internal.NotificationEvent;
import com.dbdrive.server.model.internal.NotificationMessage;
import com.dbdrive.server.service.notification.channel.ChannelAdapter;
import com.dbdrive.server.service.store.ConfigStore;
import com.dbdrive.server.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Fans a run outcome out to every enabled channel that opted in to it.
 * <p>
 * All deliveries are started on the notification pool before any of them is joined, so the
 * wall clock of one dispatch is bounded by the slowest channel, not by the sum of them.
 * A failing channel only produces a failed {@link DeliveryResult}; it never affects the
 * other channels or the caller.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final ConfigStore configStore;

    private final ChannelAdapterRegistry channelAdapterRegistry;

    private final Executor notificationExecutor;

    private final long sendTimeoutSec;

    @Autowired
    public NotificationDispatcher(
            ConfigStore configStore,
            ChannelAdapterRegistry channelAdapterRegistry,
            @Qualifier("notificationExecutor") Executor notificationExecutor,
            @Value("${dbdrive.server.notification.sendTimeoutSec:30}") long sendTimeoutSec) {
        this.configStore = configStore;
        this.channelAdapterRegistry = channelAdapterRegistry;
        this.notificationExecutor = notificationExecutor;
        this.sendTimeoutSec = sendTimeoutSec;
    }

    public List<DeliveryResult> dispatchSuccess(NotificationEvent event) {
        return this.dispatch(
                event,
                channel -> Boolean.TRUE.equals(channel.getNotifyOnSuccess()),
                adapter -> adapter.renderSuccess(event));
    }

    public List<DeliveryResult> dispatchFailure(NotificationEvent event) {
        return this.dispatch(
                event,
                channel -> Boolean.TRUE.equals(channel.getNotifyOnError()),
                adapter -> adapter.renderFailure(event));
    }

    /**
     * Sends a test message through one channel, whether it is enabled or not.
     */
    public DeliveryResult testChannel(String channelName) throws ResourceNotFoundException {
        ChannelConfigEntity channel = this.configStore.getChannel(channelName);
        ChannelAdapter adapter = this.channelAdapterRegistry.find(channel.getChannelKind());
        if (adapter == null) {
            return unsupported(channel);
        }
        NotificationMessage message = NotificationMessageFactory.testMessage(
                channel.getChannelName(),
                adapter.kind().getKind());
        return this.deliver(channel, adapter, message);
    }

    private List<DeliveryResult> dispatch(
            NotificationEvent event,
            Predicate<ChannelConfigEntity> optedIn,
            Function<ChannelAdapter, NotificationMessage> render) {
        List<ChannelConfigEntity> channels;
        try {
            channels = this.configStore.listEnabledChannels();
        } catch (DbDriveException e) {
            log.error("dispatch failed. can't load channels. job is {}", event.getJobName(), e);
            return List.of();
        }
        if (CollectionUtils.isEmpty(channels)) {
            return List.of();
        }
        // start every delivery first
        List<CompletableFuture<DeliveryResult>> futures = new ArrayList<>();
        for (ChannelConfigEntity channel : channels) {
            if (!optedIn.test(channel)) {
                continue;
            }
            ChannelAdapter adapter = this.channelAdapterRegistry.find(channel.getChannelKind());
            if (adapter == null) {
                futures.add(CompletableFuture.completedFuture(unsupported(channel)));
                continue;
            }
            futures.add(this.deliverAsync(channel, adapter, render));
        }
        // then join all
        List<DeliveryResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<DeliveryResult> future : futures) {
            results.add(future.join());
        }
        long failed = results.stream().filter(result -> !result.isSuccess()).count();
        log.info("dispatch done. job is {}, outcome is {}, channels {}, failed {}",
                event.getJobName(), event.getOutcome(), results.size(), failed);
        return results;
    }

    private CompletableFuture<DeliveryResult> deliverAsync(
            ChannelConfigEntity channel,
            ChannelAdapter adapter,
            Function<ChannelAdapter, NotificationMessage> render) {
        CompletableFuture<DeliveryResult> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> this.deliver(channel, adapter, render.apply(adapter)),
                    this.notificationExecutor);
        } catch (RuntimeException e) {
            // pool rejected the task
            log.error("deliverAsync failed. channel is {}", channel.getChannelName(), e);
            return CompletableFuture.completedFuture(
                    DeliveryResult.failed(channel.getChannelName(), adapter.kind(), Instant.now(), e.getMessage()));
        }
        return future
                .orTimeout(this.sendTimeoutSec, TimeUnit.SECONDS)
                .exceptionally(throwable -> {
                    Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null ?
                            throwable.getCause() : throwable;
                    String error = cause instanceof TimeoutException ?
                            "send timed out after %d seconds".formatted(this.sendTimeoutSec) :
                            cause.toString();
                    log.warn("deliverAsync failed. channel is {}, error is {}", channel.getChannelName(), error);
                    return DeliveryResult.failed(channel.getChannelName(), adapter.kind(), Instant.now(), error);
                });
    }

    private DeliveryResult deliver(ChannelConfigEntity channel, ChannelAdapter adapter, NotificationMessage message) {
        try {
            Map<String, Object> settings = JsonUtil.deserializeToMap(channel.getSettings());
            adapter.validateConfig(settings);
            adapter.send(message, settings);
            log.debug("deliver succeeded. channel is {}", channel.getChannelName());
            return DeliveryResult.success(channel.getChannelName(), adapter.kind(), Instant.now());
        } catch (DbDriveException e) {
            log.warn("deliver failed. channel is {}, error is {}",
                    channel.getChannelName(), e.getDbDriveMessage());
            return DeliveryResult.failed(channel.getChannelName(), adapter.kind(), Instant.now(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("deliver failed. channel is {}", channel.getChannelName(), e);
            return DeliveryResult.failed(channel.getChannelName(), adapter.kind(), Instant.now(), e.toString());
        }
    }

    private static DeliveryResult unsupported(ChannelConfigEntity channel) {
        log.warn("deliver failed. channel {} has unsupported kind {}",
                channel.getChannelName(), channel.getChannelKind());
        return DeliveryResult.failed(
                channel.getChannelName(),
                ChannelKindEnum.fromKind(channel.getChannelKind()),
                Instant.now(),
                "unsupported channel kind %s".formatted(channel.getChannelKind()));
    }
}
