package com.lexiconhub.dictionaryingest.application.common.error;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebExchange;

/**
 * 관리 API 전역 예외 처리기.
 *
 * <p>예외를 {@link ErrorResponse} 형태로 변환하여 반환한다.</p>
 */
@Order(-2)
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * {@link NotFoundException}을 404 응답으로 변환한다.
     */
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e, ServerWebExchange ex) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), ex, e.code());
    }

    /**
     * 수동 flush 중 적재 실패(재시도 소진)를 503 응답으로 변환한다.
     */
    @ExceptionHandler(FlushFailureException.class)
    public ResponseEntity<ErrorResponse> handleFlushFailure(FlushFailureException e, ServerWebExchange ex) {
        log.warn("Flush failure surfaced to admin API. batchId={}", e.batchId(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), ex, e.code());
    }

    /**
     * DB 접근/SQL 오류를 500 응답으로 변환한다.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDb(DataAccessException e, ServerWebExchange ex) {
        log.error("Database error on {}", ex.getRequest().getPath().value(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Database error", ex, "DB_ERROR");
    }

    /**
     * 처리되지 않은 예외를 500 응답으로 변환한다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, ServerWebExchange ex) {
        log.error("Unexpected error on {}", ex.getRequest().getPath().value(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", ex, "INTERNAL_ERROR");
    }

    /**
     * 경로 변수 검증(ConstraintViolation) 실패를 400 응답으로 변환한다.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException e, ServerWebExchange ex) {
        String msg = e.getConstraintViolations().stream()
                .findFirst()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .orElse("Validation failed");

        return respond(HttpStatus.BAD_REQUEST, msg, ex, "VALIDATION_ERROR");
    }

    /**
     * 핸들러 메서드 파라미터 검증 실패를 400 응답으로 변환한다.
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException e, ServerWebExchange ex) {
        String msg = e.getAllErrors().stream()
                .findFirst()
                .map(err -> String.valueOf(err.getDefaultMessage()))
                .orElse("Validation failed");

        return respond(HttpStatus.BAD_REQUEST, msg, ex, "VALIDATION_ERROR");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message,
                                                         ServerWebExchange ex, String code) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status, message, ex.getRequest().getPath().value(), code));
    }
}
