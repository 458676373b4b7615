package com.socialevents.eventhub.application.common.pagination;

import java.util.ArrayList;
import java.util.List;

/**
 * 스캔 결과에 대해 "커서보다 엄격히 뒤/앞" 조건을 정확히 다시 적용하는 필터.
 *
 * <p>저장소의 범위 조건은 sortKey가 중복되거나 null일 때 근사치일 수 있다.
 * 여기서 {@link CursorOrdering} 기준으로 경계 밖 후보를 모두 제거한다.
 * 입력 순서는 유지되며, 두 번 적용해도 결과가 같다.</p>
 */
public final class CursorBoundaryFilter {

    private CursorBoundaryFilter() {}

    /**
     * 커서 기준 방향에 맞는 후보만 남긴다.
     *
     * @param candidates 스캔 후보(저장소 반환 순서)
     * @param cursor     기준 커서(null이면 필터링하지 않음)
     * @param direction  NEXT면 커서보다 큰 것, PREV면 작은 것만 유지
     * @param <T>        아이템 타입
     * @return 경계 안쪽 후보 목록
     */
    public static <T extends CursorKeyed> List<T> retainBeyond(List<T> candidates,
                                                               CursorKeyed cursor,
                                                               PageDirection direction) {
        if (cursor == null) return candidates;

        List<T> kept = new ArrayList<>(candidates.size());
        for (T candidate : candidates) {
            int cmp = CursorOrdering.INSTANCE.compare(candidate, cursor);
            boolean beyond = (direction == PageDirection.NEXT) ? cmp > 0 : cmp < 0;
            if (beyond) kept.add(candidate);
        }
        return kept;
    }
}
