package com.dbdrive.server.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@Data
@EqualsAndHashCode(callSuper = false)
public class DbDriveException extends RuntimeException {

    private HttpStatus status;

    public DbDriveException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public DbDriveException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public DbDriveException(String message) {
        super(message);
    }

    public DbDriveException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getDbDriveMessage() {
        StringBuilder sb = new StringBuilder();
        buildMessageChain(this, sb, 0);
        return sb.toString();
    }

    // <exception name> : <exception message> -> <cause> ...
    private static void buildMessageChain(Throwable throwable, StringBuilder sb, int depth) {
        if (throwable == null || depth > 20) return;
        sb.append("%s : %s -> ".formatted(
                throwable.getClass().getSimpleName(),
                throwable instanceof DbDriveException ? throwable.getMessage() : throwable.toString()));
        buildMessageChain(throwable.getCause(), sb, depth + 1);
    }

    @Override
    public String toString() {
        return getDbDriveMessage();
    }
}
