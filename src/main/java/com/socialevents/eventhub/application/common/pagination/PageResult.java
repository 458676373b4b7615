package com.socialevents.eventhub.application.common.pagination;

import java.util.List;
import java.util.function.Function;

/**
 * 커서 기반 페이지 결과 DTO.
 *
 * @param items      현재 페이지 아이템 목록(오름차순)
 * @param pagination 커서/플래그 정보
 * @param <T>        아이템 타입
 */
public record PageResult<T>(
        List<T> items,
        PaginationInfo pagination
) {
    public PageResult {
        items = List.copyOf(items);
    }

    /**
     * 커서/플래그는 유지하고 아이템만 변환한다.
     *
     * @param mapper 아이템 변환 함수
     * @param <R>    변환 타입
     * @return 변환된 페이지
     */
    public <R> PageResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PageResult<>(mapped, pagination);
    }
}
