package com.socialevents.eventhub.application.common.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 응답의 pagination 블록.
 *
 * @param nextCursor  다음 페이지 커서(없으면 null)
 * @param prevCursor  이전 페이지 커서(없으면 null)
 * @param hasNext     다음 페이지 존재 여부
 * @param hasPrevious 이전 페이지 존재 여부
 * @param pageSize    요청 페이지 크기
 */
public record PaginationInfo(
        @JsonProperty("next_cursor") String nextCursor,
        @JsonProperty("prev_cursor") String prevCursor,
        @JsonProperty("has_next") boolean hasNext,
        @JsonProperty("has_previous") boolean hasPrevious,
        @JsonProperty("page_size") int pageSize
) {}
