package com.dbdrive.server.controller;

import com.dbdrive.server.model.api.channel.ChannelConfigInfo;
import com.dbdrive.server.model.api.channel.ChannelConfigRequest;
import com.dbdrive.server.model.api.global.DbDriveHttpResponse;
import com.dbdrive.server.model.internal.DeliveryResult;
import com.dbdrive.server.service.facade.ChannelConfigFacadeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/notification-channel")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class NotificationChannelController {

    private final ChannelConfigFacadeService channelConfigFacadeService;

    @Autowired
    public NotificationChannelController(ChannelConfigFacadeService channelConfigFacadeService) {
        this.channelConfigFacadeService = channelConfigFacadeService;
    }

    @PostMapping("/create-channel")
    public DbDriveHttpResponse<ChannelConfigInfo> createChannel(
            @RequestBody ChannelConfigRequest channelConfigRequest) {
        return DbDriveHttpResponse.success(this.channelConfigFacadeService.createChannel(channelConfigRequest));
    }

    @PostMapping("/update-channel")
    public DbDriveHttpResponse<ChannelConfigInfo> updateChannel(
            @RequestBody ChannelConfigRequest channelConfigRequest) {
        return DbDriveHttpResponse.success(this.channelConfigFacadeService.updateChannel(channelConfigRequest));
    }

    @PostMapping("/delete-channel")
    public DbDriveHttpResponse<Void> deleteChannel(@RequestParam("channelName") String channelName) {
        this.channelConfigFacadeService.deleteChannel(channelName);
        return DbDriveHttpResponse.success();
    }

    @GetMapping("/get-all-channel")
    public DbDriveHttpResponse<List<ChannelConfigInfo>> getAllChannel() {
        return DbDriveHttpResponse.success(this.channelConfigFacadeService.listChannels());
    }

    // a failed delivery is still a 200, the result carries the error
    @PostMapping("/test-channel")
    public DbDriveHttpResponse<DeliveryResult> testChannel(@RequestParam("channelName") String channelName) {
        DeliveryResult deliveryResult = this.channelConfigFacadeService.testChannel(channelName);
        return DbDriveHttpResponse.success(
                deliveryResult,
                deliveryResult.isSuccess() ? "test notification sent" : "test notification failed");
    }
}
