package com.socialevents.eventhub.application.common.pagination;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("cursor ordering 테스트")
class CursorOrderingTest {

    @Test
    @DisplayName("null 정렬 키가 가장 앞에 오고 같은 키는 ID로 정렬되는지 검증")
    void nullsFirst_thenTieBreakById() {
        List<PageCursor> items = new ArrayList<>(List.of(
                new PageCursor("2025-01-02", "a"),
                new PageCursor("2025-01-01", "c"),
                new PageCursor(null, "z"),
                new PageCursor("2025-01-01", "b"),
                new PageCursor(null, "y")
        ));

        items.sort(CursorOrdering.INSTANCE);

        assertThat(items).extracting(PageCursor::tieBreakId).containsExactly("y", "z", "b", "c", "a");
    }

    @Test
    @DisplayName("같은 위치만 0을 반환하는지 검증")
    void samePosition_comparesEqual() {
        assertThat(CursorOrdering.INSTANCE.compare(new PageCursor(null, "a"), new PageCursor(null, "a"))).isZero();
        assertThat(CursorOrdering.INSTANCE.compare(new PageCursor("k", "a"), new PageCursor("k", "b"))).isNegative();
        assertThat(CursorOrdering.compareSortKeys("k", null)).isPositive();
    }

    @Test
    @DisplayName("보충 평면 문자는 U+FFFD보다 뒤에 오도록 코드 포인트 순서로 비교되는지 검증")
    void supplementaryCharacters_sortByCodePoint() {
        String replacement = "\uFFFD";
        String emoji = "\uD83D\uDE00";

        assertThat(CursorOrdering.compareSortKeys(replacement, emoji)).isNegative();
        assertThat(CursorOrdering.INSTANCE.compare(new PageCursor("k", emoji), new PageCursor("k", replacement)))
                .isPositive();
        assertThat(CursorOrdering.compareSortKeys("ab", "ab\uD83D\uDE00")).isNegative();
        assertThat(CursorOrdering.compareSortKeys(emoji, emoji)).isZero();
    }
}
