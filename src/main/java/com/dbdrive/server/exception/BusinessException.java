package com.dbdrive.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


/**
 * Failure of an external collaborator (database dump, storage upload, credential refresh).
 * Recorded on the run's history instead of being rethrown past the executor.
 */
@EqualsAndHashCode(callSuper = false)
public class BusinessException extends DbDriveException {

    public BusinessException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public BusinessException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
