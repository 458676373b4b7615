package com.socialevents.eventhub.application.event.dto.response;

import com.socialevents.eventhub.application.common.pagination.scan.ScanRecord;

import java.util.List;
import java.util.Map;

/**
 * 이벤트 목록 아이템.
 *
 * @param eventId        이벤트 ID
 * @param eventName      이벤트 이름
 * @param startTime      시작 시각(ISO-8601, 없으면 null)
 * @param city           도시
 * @param state          주
 * @param categories     카테고리
 * @param isOnline       온라인 여부
 * @param origin         출처(manual/external)
 * @param createdByEmail 생성자 이메일
 */
public record EventItemResponse(
        String eventId,
        String eventName,
        String startTime,
        String city,
        String state,
        List<String> categories,
        Boolean isOnline,
        String origin,
        String createdByEmail
) {

    /**
     * 스캔 레코드(원본 문서)에서 응답 아이템을 만든다.
     *
     * @param record 스캔 레코드
     * @return 응답 아이템
     */
    public static EventItemResponse from(ScanRecord record) {
        Map<String, Object> f = record.fields();
        Map<?, ?> location = (f.get("location") instanceof Map<?, ?> m) ? m : Map.of();
        return new EventItemResponse(
                record.tieBreakId(),
                asString(f.get("eventName")),
                record.sortKey(),
                asString(location.get("city")),
                asString(location.get("state")),
                asStrings(f.get("categories")),
                (f.get("isOnline") instanceof Boolean b) ? b : null,
                asString(f.get("origin")),
                asString(f.get("createdByEmail"))
        );
    }

    private static String asString(Object o) {
        return (o == null) ? null : String.valueOf(o);
    }

    private static List<String> asStrings(Object o) {
        if (!(o instanceof List<?> list)) return List.of();
        return list.stream().map(String::valueOf).toList();
    }
}
