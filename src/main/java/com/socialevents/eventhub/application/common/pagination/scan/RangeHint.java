package com.socialevents.eventhub.application.common.pagination.scan;

import com.socialevents.eventhub.application.common.pagination.PageCursor;
import com.socialevents.eventhub.application.common.pagination.PageDirection;

import java.util.Objects;

/**
 * "이 위치 이후/이전부터" 스캔하라는 최선 노력(best-effort) 힌트.
 *
 * <p>저장소는 표현할 수 있는 만큼만 반영하면 되고, 정확한 경계는
 * {@link com.socialevents.eventhub.application.common.pagination.CursorBoundaryFilter}가 보정한다.</p>
 *
 * @param cursor    기준 위치
 * @param direction NEXT면 커서 이후, PREV면 커서 이전
 */
public record RangeHint(PageCursor cursor, PageDirection direction) {
    public RangeHint {
        Objects.requireNonNull(cursor, "cursor");
        Objects.requireNonNull(direction, "direction");
    }
}
