package com.socialevents.eventhub.application.common.pagination;

import com.socialevents.eventhub.application.common.error.InvalidPageRequestException;

import java.util.Locale;

/**
 * 페이지 이동 방향.
 */
public enum PageDirection {
    NEXT,
    PREV;

    /**
     * 요청 파라미터 문자열을 방향으로 변환한다. null/공백이면 {@link #NEXT}.
     *
     * @param value "next" 또는 "prev"(대소문자 무시)
     * @return 방향
     * @throws InvalidPageRequestException 알 수 없는 값인 경우
     */
    public static PageDirection from(String value) {
        if (value == null || value.isBlank()) return NEXT;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "next" -> NEXT;
            case "prev" -> PREV;
            default -> throw InvalidPageRequestException.invalidDirection(value);
        };
    }
}
