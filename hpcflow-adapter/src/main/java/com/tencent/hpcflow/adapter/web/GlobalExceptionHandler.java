package com.tencent.hpcflow.adapter.web;

import com.tencent.hpcflow.client.dto.Response;
import com.tencent.hpcflow.domain.exception.ErrorCode;
import com.tencent.hpcflow.domain.exception.HpcflowException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 把异常转换为失败响应
 * <p>
 * errCode 取错误码名称，errEntity 取出错实体，HTTP 状态由错误码决定。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(HpcflowException.class)
    public ResponseEntity<Response> handleHpcflow(HpcflowException e) {
        HttpStatus status = statusOf(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Request failed on {}: {}", e.getEntity(), e.getMessage(), e);
        } else {
            log.debug("Request rejected on {}: {}", e.getEntity(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(Response.buildFailure(e.getErrorCode().name(), e.getEntity(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Response> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest()
                .body(Response.buildFailure(ErrorCode.VALIDATION_ERROR.name(), "request", message));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Response> handleConstraintViolation(ConstraintViolationException e) {
        return ResponseEntity.badRequest()
                .body(Response.buildFailure(ErrorCode.VALIDATION_ERROR.name(), "request", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Response> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(Response.buildFailure(ErrorCode.PARSE_ERROR.name(), "request", "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Response.buildFailure("INTERNAL_ERROR", e.getMessage()));
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code) {
            case VALIDATION_ERROR:
            case PARSE_ERROR:
            case INVALID_CONFIG:
            case UNKNOWN_PACKAGE:
            case ORDER_CONSTRAINT:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
            case RESOURCE_PLAN_STALE:
                return HttpStatus.CONFLICT;
            case INSUFFICIENT_RESOURCES:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case LAUNCH_TIMEOUT:
            case NODE_UNRESPONSIVE:
                return HttpStatus.GATEWAY_TIMEOUT;
            case INTEGRITY_ERROR:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
