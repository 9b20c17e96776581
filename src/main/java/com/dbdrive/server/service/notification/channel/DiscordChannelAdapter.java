package com.dbdrive.server.service.notification.channel;

import com.dbdrive.server.enums.ChannelKindEnum;
import com.dbdrive.server.enums.MessageTypeEnum;
import com.dbdrive.server.exception.DeliveryException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.internal.NotificationMessage;
import com.dbdrive.server.model.notification.discord.DiscordSettings;
import com.dbdrive.server.model.notification.discord.DiscordWebhookPayload;
import com.dbdrive.server.service.notification.MessageDecoration;
import com.dbdrive.server.service.notification.NotificationMessageFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.format.DateTimeFormatter;
import java.util.Map;

@Slf4j
@Component
public class DiscordChannelAdapter extends AbstractHttpChannelAdapter {

    private static final MessageDecoration DECORATION = MessageDecoration.builder()
            .successTitlePrefix("✅ ")
            .failureTitlePrefix("❌ ")
            .emphasis("**")
            .linkLabel("🔗 Google Drive")
            .linkTemplate("[View File](%s)")
            .fieldLabels(Map.of(
                    NotificationMessageFactory.DATABASE_TYPE, "🗄️ Database Type",
                    NotificationMessageFactory.FILE_NAME, "📁 File Name",
                    NotificationMessageFactory.FILE_SIZE, "📊 File Size",
                    NotificationMessageFactory.DURATION, "⏱️ Duration",
                    NotificationMessageFactory.ERROR, "❌ Error"))
            .build();

    @Autowired
    public DiscordChannelAdapter(@Qualifier("notificationRestClient") RestClient notificationRestClient) {
        super(notificationRestClient);
    }

    @Override
    public ChannelKindEnum kind() {
        return ChannelKindEnum.DISCORD;
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
        DiscordSettings discordSettings = this.readSettings(settings, DiscordSettings.class);
        DiscordWebhookPayload payload = createPayload(message, discordSettings);
        int statusCode = this.postJson(discordSettings.getWebhookUrl(), payload);
        // discord answers 204 for webhooks without ?wait=true
        if (!HttpStatusCode.valueOf(statusCode).is2xxSuccessful()) {
            throw new DeliveryException("discord send failed. webhook returned status %d".formatted(statusCode));
        }
        log.debug("discord message sent. title is {}", message.getTitle());
    }

    static DiscordWebhookPayload createPayload(NotificationMessage message, DiscordSettings discordSettings) {
        DiscordWebhookPayload.Embed embed = new DiscordWebhookPayload.Embed();
        embed.setTitle(message.getTitle());
        embed.setDescription(message.getText());
        embed.setColor(colorForType(message.getType()));
        embed.setFooter(new DiscordWebhookPayload.Footer(FOOTER));
        if (message.getTimestamp() != null) {
            embed.setTimestamp(DateTimeFormatter.ISO_INSTANT.format(message.getTimestamp()));
        }
        message.getFields().forEach((name, value) ->
                embed.getFields().add(new DiscordWebhookPayload.EmbedField(name, value, true)));
        if (StringUtils.isNotBlank(message.getJobName())) {
            embed.getFields().add(new DiscordWebhookPayload.EmbedField("Configuration", message.getJobName(), true));
        }
        DiscordWebhookPayload payload = new DiscordWebhookPayload();
        payload.getEmbeds().add(embed);
        payload.setUsername(StringUtils.trimToNull(discordSettings.getUsername()));
        payload.setAvatarUrl(StringUtils.trimToNull(discordSettings.getAvatarUrl()));
        return payload;
    }

    static int colorForType(MessageTypeEnum type) {
        if (type == null) {
            return 0x0099FF;
        }
        return switch (type) {
            case SUCCESS -> 0x00FF00;
            case ERROR -> 0xFF0000;
            case WARNING -> 0xFFFF00;
            case INFO -> 0x0099FF;
        };
    }
}
