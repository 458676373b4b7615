package com.socialevents.eventhub.application.common.pagination.scan;

import java.util.Objects;

/**
 * 정렬 기준 필드 쌍. 항상 (sortField, tieBreakField) 오름차순이 기준 순서이다.
 *
 * @param sortField     1차 정렬 필드(null 허용 필드)
 * @param tieBreakField 유일 ID 필드
 */
public record SortSpec(String sortField, String tieBreakField) {
    public SortSpec {
        Objects.requireNonNull(sortField, "sortField");
        Objects.requireNonNull(tieBreakField, "tieBreakField");
    }

    /** 문서 ID(_id)를 tie-break로 쓰는 정렬 */
    public static SortSpec byField(String sortField) {
        return new SortSpec(sortField, "_id");
    }
}
