package com.example.purgebot.exception;

import com.example.purgebot.platform.GuildUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理逻辑，所有错误都以 JSON 返回，不向调用方泄露堆栈信息。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 已有清理或同步在执行 (409)
     */
    @ExceptionHandler(OperationInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(OperationInProgressException e,
                                                              HttpServletRequest request) {
        log.warn("[Conflict] Path: {}, {}", request.getRequestURI(), e.getMessage());
        Map<String, Object> error = body(HttpStatus.CONFLICT, e.getMessage(), request);
        error.put("activeOperation", e.getActiveOperation());
        return new ResponseEntity<>(error, HttpStatus.CONFLICT);
    }

    /**
     * Discord 服务器不可达 (503)
     */
    @ExceptionHandler(GuildUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(GuildUnavailableException e,
                                                                 HttpServletRequest request) {
        log.warn("[Unavailable] Path: {}, {}", request.getRequestURI(), e.getMessage());
        return new ResponseEntity<>(body(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), request),
                HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * 处理资源未找到异常 (404)
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoResourceFoundException e,
                                                              HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}", request.getRequestURI());
        return new ResponseEntity<>(body(HttpStatus.NOT_FOUND, "Not Found", request), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return new ResponseEntity<>(body(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Check the service logs.", request),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static Map<String, Object> body(HttpStatus status, String message, HttpServletRequest request) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("ok", false);
        error.put("status", status.value());
        error.put("error", message);
        error.put("path", request.getRequestURI());
        return error;
    }
}
