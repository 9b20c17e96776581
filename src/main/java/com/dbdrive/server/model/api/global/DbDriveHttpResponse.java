package com.dbdrive.server.model.api.global;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.dbdrive.server.exception.DbDriveException;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.http.HttpStatus;


@Data
public class DbDriveHttpResponse<T> {

    private int statusCode;

    private String message;

    private T data;

    @JsonSerialize(using = ToStringSerializer.class)
    private final long timestamp = System.currentTimeMillis();

    private DbDriveHttpResponse() {}

    public static <T> DbDriveHttpResponse<T> success(T data, String message) {
        DbDriveHttpResponse<T> result = new DbDriveHttpResponse<>();
        result.statusCode = HttpStatus.OK.value();
        result.message = message;
        result.data = data;
        return result;
    }

    public static <T> DbDriveHttpResponse<T> success(T data) {
        return success(data, "success");
    }

    public static DbDriveHttpResponse<Void> success() {
        return success(null);
    }

    public static DbDriveHttpResponse<Void> fail(DbDriveException e) {
        DbDriveHttpResponse<Void> result = new DbDriveHttpResponse<>();
        result.statusCode = ObjectUtils.isEmpty(e.getStatus()) ?
                HttpStatus.INTERNAL_SERVER_ERROR.value() :
                e.getStatus().value();
        result.message = e.getDbDriveMessage();
        return result;
    }
}
