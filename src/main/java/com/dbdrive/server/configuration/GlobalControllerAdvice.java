package com.dbdrive.server.configuration;

import com.baomidou.mybatisplus.core.exceptions.MybatisPlusException;
import com.dbdrive.server.exception.BusinessException;
import com.dbdrive.server.exception.DbDriveException;
import com.dbdrive.server.exception.DbException;
import com.dbdrive.server.exception.JsonException;
import com.dbdrive.server.exception.ResourceNotFoundException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.api.global.DbDriveHttpResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;


@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<DbDriveHttpResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("controller failed. business logic failed. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<DbDriveHttpResponse<Void>> handleResourceNotFoundException(ResourceNotFoundException e) {
        log.warn("controller failed. resource not found. {}", e.getMessage());
        return toResponse(e);
    }

    @ExceptionHandler(JsonException.class)
    public ResponseEntity<DbDriveHttpResponse<Void>> handleJsonException(JsonException e) {
        log.warn("controller failed. json process failed. ", e);
        return toResponse(e);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<DbDriveHttpResponse<Void>> handleValidationException(ValidationException e) {
        log.warn("controller failed. validation failed. {}", e.getDbDriveMessage());
        return toResponse(e);
    }

    @ExceptionHandler(MybatisPlusException.class)
    public ResponseEntity<DbDriveHttpResponse<Void>> handleDBException(MybatisPlusException e) {
        log.warn("controller failed. db error happen.", e);
        return toResponse(new DbException("db error.", e));
    }

    @ExceptionHandler(DbDriveException.class)
    public ResponseEntity<DbDriveHttpResponse<Void>> handleDbDriveException(DbDriveException e) {
        log.warn("controller failed. DbDriveException happen", e);
        return toResponse(e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<DbDriveHttpResponse<Void>> handleGlobalException(Exception e) {
        log.warn("controller failed.", e);
        return toResponse(new DbDriveException(HttpStatus.INTERNAL_SERVER_ERROR, e.toString()));
    }

    private static ResponseEntity<DbDriveHttpResponse<Void>> toResponse(DbDriveException e) {
        DbDriveHttpResponse<Void> dbDriveHttpResponse = DbDriveHttpResponse.fail(e);
        return ResponseEntity.status(dbDriveHttpResponse.getStatusCode()).body(dbDriveHttpResponse);
    }
}
