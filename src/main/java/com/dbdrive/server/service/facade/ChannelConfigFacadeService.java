package com.dbdrive.server.service.facade;

import com.dbdrive.server.exception.DbException;
import com.dbdrive.server.exception.ResourceNotFoundException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.api.channel.ChannelConfigInfo;
import com.dbdrive.server.model.api.channel.ChannelConfigRequest;
import com.dbdrive.server.model.entity.ChannelConfigEntity;
import com.dbdrive.server.model.internal.DeliveryResult;
import com.dbdrive.server.service.db.impl.ChannelConfigService;
import com.dbdrive.server.service.notification.ChannelAdapterRegistry;
import com.dbdrive.server.service.notification.NotificationDispatcher;
import com.dbdrive.server.service.notification.channel.ChannelAdapter;
import com.dbdrive.server.util.EntityValidationUtil;
import com.dbdrive.server.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class ChannelConfigFacadeService {

    private final ChannelConfigService channelConfigService;

    private final ChannelAdapterRegistry channelAdapterRegistry;

    private final NotificationDispatcher notificationDispatcher;

    @Autowired
    public ChannelConfigFacadeService(
            ChannelConfigService channelConfigService,
            ChannelAdapterRegistry channelAdapterRegistry,
            NotificationDispatcher notificationDispatcher) {
        this.channelConfigService = channelConfigService;
        this.channelAdapterRegistry = channelAdapterRegistry;
        this.notificationDispatcher = notificationDispatcher;
    }

    public ChannelConfigInfo createChannel(ChannelConfigRequest channelConfigRequest)
            throws ValidationException, DbException {
        EntityValidationUtil.isCreateChannelConfigRequestValid(channelConfigRequest);
        // the adapter owns the settings format
        ChannelAdapter channelAdapter = this.channelAdapterRegistry.get(channelConfigRequest.getChannelKind());
        channelAdapter.validateConfig(channelConfigRequest.getSettings());
        ChannelConfigEntity channelConfigEntity = new ChannelConfigEntity();
        channelConfigEntity.setChannelName(channelConfigRequest.getChannelName().trim());
        channelConfigEntity.setChannelKind(channelAdapter.kind().getKind());
        channelConfigEntity.setSettings(JsonUtil.serializeToString(channelConfigRequest.getSettings()));
        channelConfigEntity.setEnabled(ObjectUtils.defaultIfNull(channelConfigRequest.getEnabled(), true));
        channelConfigEntity.setNotifyOnSuccess(
                ObjectUtils.defaultIfNull(channelConfigRequest.getNotifyOnSuccess(), true));
        channelConfigEntity.setNotifyOnError(ObjectUtils.defaultIfNull(channelConfigRequest.getNotifyOnError(), true));
        this.channelConfigService.createChannelConfig(channelConfigEntity);
        log.info("channel created. channel is {}", channelConfigEntity);
        return ChannelConfigInfo.from(channelConfigEntity);
    }

    public ChannelConfigInfo updateChannel(ChannelConfigRequest channelConfigRequest)
            throws ValidationException, ResourceNotFoundException, DbException {
        EntityValidationUtil.isUpdateChannelConfigRequestValid(channelConfigRequest);
        ChannelConfigEntity channelConfigEntity = this.getChannelOrThrow(channelConfigRequest.getChannelName());
        if (ObjectUtils.isNotEmpty(channelConfigRequest.getChannelKind())
                || ObjectUtils.isNotEmpty(channelConfigRequest.getSettings())) {
            String channelKind = ObjectUtils.isNotEmpty(channelConfigRequest.getChannelKind()) ?
                    channelConfigRequest.getChannelKind() : channelConfigEntity.getChannelKind();
            ChannelAdapter channelAdapter = this.channelAdapterRegistry.get(channelKind);
            // a kind change needs settings of the new kind
            Map<String, Object> settings = ObjectUtils.isNotEmpty(channelConfigRequest.getSettings()) ?
                    channelConfigRequest.getSettings() :
                    JsonUtil.deserializeToMap(channelConfigEntity.getSettings());
            channelAdapter.validateConfig(settings);
            channelConfigEntity.setChannelKind(channelAdapter.kind().getKind());
            channelConfigEntity.setSettings(JsonUtil.serializeToString(settings));
        }
        if (ObjectUtils.isNotEmpty(channelConfigRequest.getEnabled())) {
            channelConfigEntity.setEnabled(channelConfigRequest.getEnabled());
        }
        if (ObjectUtils.isNotEmpty(channelConfigRequest.getNotifyOnSuccess())) {
            channelConfigEntity.setNotifyOnSuccess(channelConfigRequest.getNotifyOnSuccess());
        }
        if (ObjectUtils.isNotEmpty(channelConfigRequest.getNotifyOnError())) {
            channelConfigEntity.setNotifyOnError(channelConfigRequest.getNotifyOnError());
        }
        this.channelConfigService.updateChannelConfig(channelConfigEntity);
        log.info("channel updated. channel is {}", channelConfigEntity);
        return ChannelConfigInfo.from(channelConfigEntity);
    }

    public void deleteChannel(String channelName) throws ResourceNotFoundException, DbException {
        ChannelConfigEntity channelConfigEntity = this.getChannelOrThrow(channelName);
        this.channelConfigService.deleteByChannelName(channelConfigEntity.getChannelName());
        log.info("channel deleted. channel is {}", channelName);
    }

    public List<ChannelConfigInfo> listChannels() {
        return this.channelConfigService.getAll().stream().map(ChannelConfigInfo::from).toList();
    }

    public DeliveryResult testChannel(String channelName) throws ResourceNotFoundException {
        return this.notificationDispatcher.testChannel(channelName);
    }

    private ChannelConfigEntity getChannelOrThrow(String channelName) throws ResourceNotFoundException {
        ChannelConfigEntity channelConfigEntity = this.channelConfigService.getByChannelName(channelName);
        if (ObjectUtils.isEmpty(channelConfigEntity)) {
            throw new ResourceNotFoundException("getChannel failed. channelName %s not found".formatted(channelName));
        }
        return channelConfigEntity;
    }
}
