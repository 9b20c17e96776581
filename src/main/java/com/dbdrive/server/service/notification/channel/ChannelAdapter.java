package com.dbdrive.server.service.notification.channel;

import com.dbdrive.server.enums.ChannelKindEnum;
import com.dbdrive.server.exception.DeliveryException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.internal.NotificationEvent;
import com.dbdrive.server.model.internal.NotificationMessage;
import com.dbdrive.server.service.notification.MessageDecoration;
import com.dbdrive.server.service.notification.NotificationMessageFactory;

import java.util.Map;

/**
 * One notification channel kind. Adapters are stateless beans: the per-channel settings
 * (webhook url, tokens) travel with every call, so one adapter serves every channel config
 * of its kind.
 */
public interface ChannelAdapter {

    ChannelKindEnum kind();

    /**
     * Checks that every field the channel needs is present and well formed.
     */
    void validateConfig(Map<String, Object> settings) throws ValidationException;

    /**
     * Delivers one message. Blocking; bounded by the http client timeouts.
     */
    void send(NotificationMessage message, Map<String, Object> settings)
            throws ValidationException, DeliveryException;

    default MessageDecoration decoration() {
        return MessageDecoration.plain();
    }

    default NotificationMessage renderSuccess(NotificationEvent event) {
        return NotificationMessageFactory.successMessage(event, this.decoration());
    }

    default NotificationMessage renderFailure(NotificationEvent event) {
        return NotificationMessageFactory.failureMessage(event, this.decoration());
    }
}
