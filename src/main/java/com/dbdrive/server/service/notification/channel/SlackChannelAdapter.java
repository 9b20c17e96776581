package com.dbdrive.server.service.notification.channel;

import com.dbdrive.server.enums.ChannelKindEnum;
import com.dbdrive.server.enums.MessageTypeEnum;
import com.dbdrive.server.exception.DeliveryException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.internal.NotificationMessage;
import com.dbdrive.server.model.notification.slack.SlackSettings;
import com.dbdrive.server.model.notification.slack.SlackWebhookPayload;
import com.dbdrive.server.service.notification.MessageDecoration;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

@Slf4j
@Component
public class SlackChannelAdapter extends AbstractHttpChannelAdapter {

    private static final MessageDecoration DECORATION = MessageDecoration.builder()
            .successTitlePrefix(":white_check_mark: ")
            .failureTitlePrefix(":x: ")
            .emphasis("*")
            .linkLabel("Google Drive")
            .linkTemplate("<%s|View File>")
            .build();

    @Autowired
    public SlackChannelAdapter(@Qualifier("notificationRestClient") RestClient notificationRestClient) {
        super(notificationRestClient);
    }

    @Override
    public ChannelKindEnum kind() {
        return ChannelKindEnum.SLACK;
    }

    @Override
    public void validateConfig(Map<String, Object> settings) throws ValidationException {
        requireHttpUrl(settings, "webhook_url", this.kind().getKind());
    }

    @Override
    public MessageDecoration decoration() {
        return DECORATION;
    }

    @Override
    public void send(NotificationMessage message, Map<String, Object> settings)
            throws ValidationException, DeliveryException {
        SlackSettings slackSettings = this.readSettings(settings, SlackSettings.class);
        SlackWebhookPayload payload = createPayload(message, slackSettings);
        int statusCode = this.postJson(slackSettings.getWebhookUrl(), payload);
        if (statusCode != HttpStatus.OK.value()) {
            throw new DeliveryException("slack send failed. webhook returned status %d".formatted(statusCode));
        }
        log.debug("slack message sent. title is {}", message.getTitle());
    }

    static SlackWebhookPayload createPayload(NotificationMessage message, SlackSettings slackSettings) {
        SlackWebhookPayload.Attachment attachment = new SlackWebhookPayload.Attachment();
        attachment.setColor(colorForType(message.getType()));
        attachment.setTitle(message.getTitle());
        attachment.setText(message.getText());
        attachment.setFooter(FOOTER);
        if (message.getTimestamp() != null) {
            attachment.setTs(message.getTimestamp().getEpochSecond());
        }
        message.getFields().forEach((title, value) ->
                attachment.getFields().add(new SlackWebhookPayload.Field(title, value, true)));
        if (StringUtils.isNotBlank(message.getJobName())) {
            attachment.getFields().add(new SlackWebhookPayload.Field("Configuration", message.getJobName(), true));
        }
        SlackWebhookPayload payload = new SlackWebhookPayload();
        payload.getAttachments().add(attachment);
        payload.setChannel(StringUtils.trimToNull(slackSettings.getChannel()));
        payload.setUsername(StringUtils.trimToNull(slackSettings.getUsername()));
        payload.setIconEmoji(StringUtils.trimToNull(slackSettings.getIconEmoji()));
        payload.setIconUrl(StringUtils.trimToNull(slackSettings.getIconUrl()));
        return payload;
    }

    static String colorForType(MessageTypeEnum type) {
        if (type == null) {
            return "#808080";
        }
        return switch (type) {
            case SUCCESS -> "good";
            case ERROR -> "danger";
            case WARNING -> "warning";
            case INFO -> "#36a64f";
        };
    }
}
