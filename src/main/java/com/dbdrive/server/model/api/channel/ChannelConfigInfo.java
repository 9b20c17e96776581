package com.dbdrive.server.model.api.channel;

import com.dbdrive.server.model.entity.ChannelConfigEntity;
import lombok.Data;

/**
 * Channel config as returned over http. Settings hold tokens and webhook secrets and are left out.
 */
@Data
public class ChannelConfigInfo {

    private String channelConfigId;

    private String channelName;

    private String channelKind;

    private boolean enabled;

    private boolean notifyOnSuccess;

    private boolean notifyOnError;

    public static ChannelConfigInfo from(ChannelConfigEntity channelConfigEntity) {
        ChannelConfigInfo channelConfigInfo = new ChannelConfigInfo();
        channelConfigInfo.setChannelConfigId(String.valueOf(channelConfigEntity.getChannelConfigId()));
        channelConfigInfo.setChannelName(channelConfigEntity.getChannelName());
        channelConfigInfo.setChannelKind(channelConfigEntity.getChannelKind());
        channelConfigInfo.setEnabled(Boolean.TRUE.equals(channelConfigEntity.getEnabled()));
        channelConfigInfo.setNotifyOnSuccess(Boolean.TRUE.equals(channelConfigEntity.getNotifyOnSuccess()));
        channelConfigInfo.setNotifyOnError(Boolean.TRUE.equals(channelConfigEntity.getNotifyOnError()));
        return channelConfigInfo;
    }
}
