package com.socialevents.eventhub.application.common.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 페이지 재개 위치.
 *
 * <p>next 방향이면 직전 페이지의 마지막 아이템, prev 방향이면 첫 아이템의 위치를 가리킨다.
 * 직렬화 시 {"k": sortKey, "id": tieBreakId} 형태로 최소한의 정보만 담는다.</p>
 *
 * @param sortKey    정렬 키(없으면 null)
 * @param tieBreakId 유일 ID
 */
public record PageCursor(
        @JsonProperty("k") String sortKey,
        @JsonProperty("id") String tieBreakId
) implements CursorKeyed {

    /**
     * 아이템의 위치로 커서를 만든다.
     *
     * @param item 기준 아이템
     * @return 커서
     */
    public static PageCursor of(CursorKeyed item) {
        return new PageCursor(item.sortKey(), item.tieBreakId());
    }
}
