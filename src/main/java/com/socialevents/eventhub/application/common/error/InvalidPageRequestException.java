package com.socialevents.eventhub.application.common.error;

/**
 * 페이지 요청 검증 실패(페이지 크기/방향 등).
 *
 * <p>저장소 접근 전에 던져지며 400으로 응답된다.</p>
 */
public class InvalidPageRequestException extends BadRequestException {

    public static final String INVALID_PAGE_SIZE = "INVALID_PAGE_SIZE";
    public static final String INVALID_DIRECTION = "INVALID_DIRECTION";
    public static final String INVALID_PAGE_REQUEST = "INVALID_PAGE_REQUEST";

    public InvalidPageRequestException(String message, String code) {
        super(message, code);
    }

    public static InvalidPageRequestException invalidPageSize(int pageSize, int max) {
        return new InvalidPageRequestException(
                "size must be between 1 and " + max + " (was " + pageSize + ")", INVALID_PAGE_SIZE);
    }

    public static InvalidPageRequestException invalidDirection(String direction) {
        return new InvalidPageRequestException(
                "direction must be 'next' or 'prev' (was '" + direction + "')", INVALID_DIRECTION);
    }
}
