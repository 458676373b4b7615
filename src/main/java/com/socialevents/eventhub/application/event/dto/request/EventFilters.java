package com.socialevents.eventhub.application.event.dto.request;

/**
 * 이벤트 목록 선택 필터. 모든 값은 선택이며 null이면 적용하지 않는다.
 *
 * @param city         도시(location.city)
 * @param state        주(location.state)
 * @param category     카테고리(categories 배열 포함)
 * @param isOnline     온라인 여부
 * @param creatorEmail 생성자 이메일
 * @param startDate    시작 시각 하한(ISO-8601, 포함)
 * @param endDate      시작 시각 상한(ISO-8601, 포함)
 */
public record EventFilters(
        String city,
        String state,
        String category,
        Boolean isOnline,
        String creatorEmail,
        String startDate,
        String endDate
) {
    public static EventFilters none() {
        return new EventFilters(null, null, null, null, null, null, null);
    }
}
