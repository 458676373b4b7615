package com.socialevents.eventhub.application.common.error;

import java.time.Instant;

/**
 * 공통 에러 응답 DTO.
 *
 * @param timestamp 에러 발생 시각
 * @param status    HTTP 상태 코드
 * @param error     HTTP 상태 메시지
 * @param message   에러 메시지
 * @param path      요청 경로
 * @param code      애플리케이션 에러 코드
 * @param retryable 같은 요청을 다시 보내면 성공할 수 있는지
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String code,
        boolean retryable
) {
    public static ErrorResponse of(int status, String error, String message, String path, String code) {
        return new ErrorResponse(Instant.now(), status, error, message, path, code, false);
    }

    public static ErrorResponse retryable(int status, String error, String message, String path, String code) {
        return new ErrorResponse(Instant.now(), status, error, message, path, code, true);
    }
}
