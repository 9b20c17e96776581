package com.dbdrive.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


/**
 * A single notification channel could not deliver a message.
 */
@EqualsAndHashCode(callSuper = false)
public class DeliveryException extends DbDriveException {

    public DeliveryException(String message) {
        super(HttpStatus.BAD_GATEWAY, message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, cause);
    }
}
