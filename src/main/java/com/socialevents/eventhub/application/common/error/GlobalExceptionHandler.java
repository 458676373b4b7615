package com.socialevents.eventhub.application.common.error;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * 전역 예외 처리기.
 *
 * <p>애플리케이션 전반의 예외를 {@link ErrorResponse} 형태로 변환하여 반환한다.
 * 잘못된 커서는 여기까지 오지 않는다(첫 페이지로 대체).</p>
 */
@Order(-2)
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * {@link BadRequestException}(페이지 크기/방향 오류 포함)을 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse
     */
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException e, ServerWebExchange ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(400, "Bad Request", e.getMessage(), path(ex), e.code()));
    }

    /**
     * 저장소가 실행할 수 없는 필터 조합을 500 응답으로 변환한다.
     *
     * <p>메시지에 누락된 인덱스의 컬렉션/필드가 포함된다.</p>
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 500 ErrorResponse(UNSUPPORTED_FILTER_COMBINATION)
     */
    @ExceptionHandler(UnsupportedFilterCombinationException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedFilter(UnsupportedFilterCombinationException e,
                                                                 ServerWebExchange ex) {
        log.warn("Unsupported filter combination on {}: {}", e.collection(), e.fields());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(500, "Internal Server Error", e.getMessage(), path(ex), e.code()));
    }

    /**
     * 저장소 일시 장애/타임아웃을 503 응답(재시도 가능)으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 503 ErrorResponse(STORE_UNAVAILABLE)
     */
    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException e, ServerWebExchange ex) {
        log.warn("Store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "1")
                .body(ErrorResponse.retryable(503, "Service Unavailable", e.getMessage(), path(ex), e.code()));
    }

    /**
     * DB 접근 오류를 500 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 500 ErrorResponse(DB_ERROR)
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDb(DataAccessException e, ServerWebExchange ex) {
        log.error("Database error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(500, "Internal Server Error", "Database error", path(ex), "DB_ERROR"));
    }

    /**
     * 처리되지 않은 예외를 500 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 500 ErrorResponse(INTERNAL_ERROR)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, ServerWebExchange ex) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(500, "Internal Server Error", "Unexpected error", path(ex), "INTERNAL_ERROR"));
    }

    /**
     * 검증(ConstraintViolation) 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException e, ServerWebExchange ex) {
        String msg = e.getConstraintViolations().stream()
                .findFirst()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .orElse("Validation failed");

        return validationError(msg, ex);
    }

    /**
     * 컨트롤러 파라미터 검증(HandlerMethodValidation) 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException e, ServerWebExchange ex) {
        String msg = e.getParameterValidationResults().stream()
                .filter(r -> !r.getResolvableErrors().isEmpty())
                .findFirst()
                .map(r -> r.getMethodParameter().getParameterName() + ": "
                        + r.getResolvableErrors().get(0).getDefaultMessage())
                .orElse("Validation failed");

        return validationError(msg, ex);
    }

    /**
     * 바인딩/파라미터 검증(WebExchangeBind) 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e, ServerWebExchange ex) {
        String msg = e.getFieldErrors().stream()
                .findFirst()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .orElse("Validation failed");

        return validationError(msg, ex);
    }

    /**
     * 타입 변환 실패 등 잘못된 입력을 400 응답으로 변환한다(예: isOnline=abc).
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e, ServerWebExchange ex) {
        String name = (e.getMethodParameter() == null) ? null : e.getMethodParameter().getParameterName();
        String msg = (name == null) ? "Invalid request input" : name + ": invalid value";
        return validationError(msg, ex);
    }

    private static ResponseEntity<ErrorResponse> validationError(String msg, ServerWebExchange ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(400, "Bad Request", msg, path(ex), "VALIDATION_ERROR"));
    }

    private static String path(ServerWebExchange ex) {
        return ex.getRequest().getPath().value();
    }
}
