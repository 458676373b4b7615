package com.socialevents.eventhub.application.common.pagination.scan;

import com.socialevents.eventhub.application.common.pagination.filter.FilterPredicate;

import java.util.List;
import java.util.Objects;

/**
 * 저장소 한 번의 범위 스캔 요청.
 *
 * @param collection 컬렉션 이름
 * @param filters    필터 조건
 * @param sort       정렬 기준
 * @param rangeHint  커서 범위 힌트(첫 페이지면 null)
 * @param descending true면 (sortField, tieBreakField) 내림차순으로 스캔
 * @param limit      최대 반환 건수
 */
public record ScanRequest(
        String collection,
        List<FilterPredicate> filters,
        SortSpec sort,
        RangeHint rangeHint,
        boolean descending,
        int limit
) {
    public ScanRequest {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(sort, "sort");
        filters = (filters == null) ? List.of() : List.copyOf(filters);
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    }
}
