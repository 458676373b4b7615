package com.socialevents.eventhub.application.common.pagination;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("cursor boundary filter 테스트")
class CursorBoundaryFilterTest {

    private final List<PageCursor> candidates = List.of(
            new PageCursor(null, "a"),
            new PageCursor("2025-01-01", "b"),
            new PageCursor("2025-01-01", "c"),
            new PageCursor("2025-01-02", "d")
    );

    @Test
    @DisplayName("NEXT는 커서보다 엄격히 뒤인 후보만 남기는지 검증")
    void next_keepsStrictlyAfter() {
        var kept = CursorBoundaryFilter.retainBeyond(candidates, new PageCursor("2025-01-01", "b"), PageDirection.NEXT);

        assertThat(kept).extracting(PageCursor::tieBreakId).containsExactly("c", "d");
    }

    @Test
    @DisplayName("PREV는 커서보다 엄격히 앞인 후보만 남기는지 검증")
    void prev_keepsStrictlyBefore() {
        var kept = CursorBoundaryFilter.retainBeyond(candidates, new PageCursor("2025-01-01", "c"), PageDirection.PREV);

        assertThat(kept).extracting(PageCursor::tieBreakId).containsExactly("a", "b");
    }

    @Test
    @DisplayName("null 키 커서 기준으로도 경계가 정확한지 검증")
    void nullKeyCursor() {
        var kept = CursorBoundaryFilter.retainBeyond(candidates, new PageCursor(null, "a"), PageDirection.NEXT);

        assertThat(kept).extracting(PageCursor::tieBreakId).containsExactly("b", "c", "d");
        assertThat(CursorBoundaryFilter.retainBeyond(candidates, new PageCursor(null, "a"), PageDirection.PREV)).isEmpty();
    }

    @Test
    @DisplayName("두 번 적용해도 결과가 같고 커서가 없으면 그대로인지 검증")
    void idempotent_andNoCursorPassThrough() {
        var cursor = new PageCursor("2025-01-01", "b");
        var once = CursorBoundaryFilter.retainBeyond(candidates, cursor, PageDirection.NEXT);
        var twice = CursorBoundaryFilter.retainBeyond(once, cursor, PageDirection.NEXT);

        assertThat(twice).isEqualTo(once);
        assertThat(CursorBoundaryFilter.retainBeyond(candidates, null, PageDirection.NEXT)).isSameAs(candidates);
    }
}
