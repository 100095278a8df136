package com.example.dealerhooks.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 全局异常处理逻辑
 * 所有错误统一返回 JSON，不向调用方泄露堆栈信息。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({ SubscriptionNotFoundException.class, DeliveryNotFoundException.class })
    public ResponseEntity<Map<String, Object>> handleNotFound(WebhookException e, HttpServletRequest request) {
        log.debug("[NotFound] Path: {}, {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.NOT_FOUND, e.getMessage(), request);
    }

    @ExceptionHandler(InvalidSubscriptionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(InvalidSubscriptionException e,
            HttpServletRequest request) {
        log.warn("[InvalidSubscription] Path: {}, {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    /**
     * 重投被拒绝（已成功或额度用尽）
     */
    @ExceptionHandler({ DeliveryAlreadySucceededException.class, RetryLimitExceededException.class })
    public ResponseEntity<Map<String, Object>> handleRetryRejected(WebhookException e, HttpServletRequest request) {
        log.warn("[RetryRejected] Path: {}, {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleBeanValidation(MethodArgumentNotValidException e,
            HttpServletRequest request) {
        String errors = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("[Validation] Path: {}, {}", request.getRequestURI(), errors);
        return error(HttpStatus.BAD_REQUEST, errors, request);
    }

    /**
     * 请求体不是合法 JSON
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e,
            HttpServletRequest request) {
        log.warn("[UnreadableBody] Path: {}, {}", request.getRequestURI(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request body.", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e,
            HttpServletRequest request) {
        log.warn("[TypeMismatch] Path: {}, {}={}", request.getRequestURI(), e.getName(), e.getValue());
        return error(HttpStatus.BAD_REQUEST, "Invalid value for '" + e.getName() + "': " + e.getValue(), request);
    }

    /**
     * 处理资源未找到异常 (404)
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException e,
            HttpServletRequest request) {
        log.debug("[ResourceNotFound] Path: {}", request.getRequestURI());
        return error(HttpStatus.NOT_FOUND, "Resource not found.", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact administrator.", request);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, HttpServletRequest request) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", status.value());
        error.put("error", status.getReasonPhrase());
        error.put("message", message);
        error.put("path", request.getRequestURI());
        return new ResponseEntity<>(error, status);
    }
}
