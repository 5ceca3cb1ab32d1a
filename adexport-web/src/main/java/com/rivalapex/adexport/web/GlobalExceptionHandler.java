package com.rivalapex.adexport.web;

import com.rivalapex.adexport.server.exception.ExportValidationException;
import com.rivalapex.adexport.server.exception.NotFoundException;
import com.rivalapex.adexport.server.exception.SyncInProgressException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 领域异常到 HTTP 状态码的映射。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ExportValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ExportValidationException e) {
        return ApiResponses.error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception e) {
        log.debug("请求无法解析: {}", e.getMessage());
        return ApiResponses.error(HttpStatus.BAD_REQUEST, "Invalid request");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException e) {
        return ApiResponses.error(HttpStatus.UNAUTHORIZED, "Unauthorized");
    }

    @ExceptionHandler(TenantAccessException.class)
    public ResponseEntity<Map<String, Object>> handleForbidden(TenantAccessException e) {
        log.warn("拒绝跨租户访问: {}", e.getMessage());
        return ApiResponses.error(HttpStatus.FORBIDDEN, "Forbidden");
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException e) {
        return ApiResponses.error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(SyncInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(SyncInProgressException e) {
        return ApiResponses.error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("请求处理失败", e);
        return ApiResponses.error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }
}
