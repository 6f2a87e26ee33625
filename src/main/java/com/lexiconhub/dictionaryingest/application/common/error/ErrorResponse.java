package com.lexiconhub.dictionaryingest.application.common.error;

import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * 관리 API 에러 응답.
 *
 * @param timestamp 발생 시각
 * @param status    HTTP 상태 코드
 * @param error     상태 문구(예: {@code Not Found})
 * @param message   사람이 읽을 메시지
 * @param path      요청 경로
 * @param code      애플리케이션 에러 코드(예: {@code MERGE_REPORT_NOT_FOUND}, {@code VALIDATION_ERROR})
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String code
) {
    public static ErrorResponse of(HttpStatus status, String message, String path, String code) {
        return new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(), message, path, code);
    }
}
