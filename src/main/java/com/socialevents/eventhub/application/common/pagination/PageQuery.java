package com.socialevents.eventhub.application.common.pagination;

import com.socialevents.eventhub.application.common.pagination.filter.FilterPredicate;
import com.socialevents.eventhub.application.common.pagination.scan.SortSpec;

import java.time.Duration;
import java.util.List;

/**
 * 커서 페이지 요청.
 *
 * <p>같은 커서는 같은 (collection, filters, sort) 조합에서만 의미가 있다.</p>
 *
 * @param collection 컬렉션 이름
 * @param filters    필터 조건
 * @param sort       정렬 기준
 * @param cursor     불투명 커서 토큰(첫 페이지면 null)
 * @param pageSize   페이지 크기(null이면 설정 기본값)
 * @param direction  이동 방향
 * @param timeout    스캔 타임아웃(null이면 설정값)
 */
public record PageQuery(
        String collection,
        List<FilterPredicate> filters,
        SortSpec sort,
        String cursor,
        Integer pageSize,
        PageDirection direction,
        Duration timeout
) {
    public PageQuery {
        filters = (filters == null) ? List.of() : List.copyOf(filters);
    }

    public static PageQuery of(String collection,
                               List<FilterPredicate> filters,
                               SortSpec sort,
                               String cursor,
                               Integer pageSize,
                               PageDirection direction) {
        return new PageQuery(collection, filters, sort, cursor, pageSize, direction, null);
    }

    public PageQuery withPageSize(int pageSize) {
        return new PageQuery(collection, filters, sort, cursor, pageSize, direction, timeout);
    }

    public PageQuery withTimeout(Duration timeout) {
        return new PageQuery(collection, filters, sort, cursor, pageSize, direction, timeout);
    }
}
