package com.dbdrive.server.model.drive;

import com.dbdrive.server.exception.BusinessException;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;

@Data
public class DriveResponse<T> {

    private int httpCode;

    private boolean success;

    private T data;

    // has response but http code is not 2xx
    private String errorBody;

    // does not have response
    private BusinessException ex;

    private DriveResponse() {}

    public static <T> DriveResponse<T> success(int httpCode, T data) {
        DriveResponse<T> driveResponse = new DriveResponse<>();
        driveResponse.setHttpCode(httpCode);
        driveResponse.setSuccess(true);
        driveResponse.setData(data);
        return driveResponse;
    }

    public static <T> DriveResponse<T> error(int httpCode, String errorBody) {
        DriveResponse<T> driveResponse = new DriveResponse<>();
        driveResponse.setHttpCode(httpCode);
        driveResponse.setSuccess(false);
        driveResponse.setErrorBody(errorBody);
        return driveResponse;
    }

    public static <T> DriveResponse<T> error(Throwable ex) {
        DriveResponse<T> driveResponse = new DriveResponse<>();
        driveResponse.setSuccess(false);
        driveResponse.setEx(new BusinessException("drive request failed with unexpected exception", ex));
        return driveResponse;
    }

    public BusinessException getBusinessException() {
        if (this.success) return null;
        if (ObjectUtils.isEmpty(this.ex)) {
            return new BusinessException("drive response has error http code %d. body is %s"
                    .formatted(this.httpCode, this.errorBody));
        }
        return this.ex;
    }
}
