package com.dbdrive.server.service.notification.channel;

import com.dbdrive.server.enums.ChannelKindEnum;
import com.dbdrive.server.enums.MessageTypeEnum;
import com.dbdrive.server.exception.DeliveryException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.internal.NotificationMessage;
import com.dbdrive.server.model.notification.chatwork.ChatworkSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

@Slf4j
@Component
public class ChatworkChannelAdapter extends AbstractHttpChannelAdapter {

    private static final DateTimeFormatter TIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final String baseUrl;

    @Autowired
    public ChatworkChannelAdapter(
            @Qualifier("notificationRestClient") RestClient notificationRestClient,
            @Value("${dbdrive.server.notification.chatworkBaseUrl:https://api.chatwork.com/v2}") String baseUrl) {
        super(notificationRestClient);
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
    }

    @Override
    public ChannelKindEnum kind() {
        return ChannelKindEnum.CHATWORK;
    }

    @Override
    public void validateConfig(Map<String, Object> settings) throws ValidationException {
        requireText(settings, "api_token", this.kind().getKind());
        requireText(settings, "room_id", this.kind().getKind());
    }

    @Override
    public void send(NotificationMessage message, Map<String, Object> settings)
            throws ValidationException, DeliveryException {
        ChatworkSettings chatworkSettings = this.readSettings(settings, ChatworkSettings.class);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("body", formatMessage(message));
        // don't mark as unread for the sender
        form.add("self_unread", "0");
        int statusCode = this.postForm(
                "%s/rooms/%s/messages".formatted(this.baseUrl, chatworkSettings.getRoomId().trim()),
                form,
                headers -> {
                    headers.set("X-ChatWorkToken", chatworkSettings.getApiToken());
                    headers.set("User-Agent", USER_AGENT);
                });
        if (statusCode != HttpStatus.OK.value()) {
            throw new DeliveryException("chatwork send failed. api returned status %d".formatted(statusCode));
        }
        log.debug("chatwork message sent. title is {}", message.getTitle());
    }

    static String formatMessage(NotificationMessage message) {
        StringBuilder sb = new StringBuilder();
        sb.append("[info][title]%s %s[/title]\n".formatted(emojiForType(message.getType()), message.getTitle()));
        if (message.getTimestamp() != null) {
            sb.append("⏰ Time: %s\n".formatted(TIME_FORMATTER.format(message.getTimestamp())));
        }
        sb.append("[hr]\n");
        if (StringUtils.isNotBlank(message.getText())) {
            sb.append("📝 %s\n".formatted(message.getText()));
        }
        if (!message.getFields().isEmpty()) {
            sb.append("\n📌 Details:\n");
            message.getFields().forEach((key, value) -> sb.append("• %s: %s\n".formatted(key, value)));
        }
        sb.append("[hr]\n");
        if (StringUtils.isNotBlank(message.getJobName())) {
            sb.append("⚙️ Config: %s\n".formatted(message.getJobName()));
        }
        sb.append("[/info]");
        return sb.toString();
    }

    static String emojiForType(MessageTypeEnum type) {
        if (type == null) {
            return "📝";
        }
        return switch (type) {
            case SUCCESS -> "✅";
            case ERROR -> "❌";
            case WARNING -> "⚠️";
            case INFO -> "ℹ️";
        };
    }
}
