package com.socialevents.eventhub.application.common.pagination;

import com.socialevents.eventhub.application.common.error.InvalidPageRequestException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("page direction 테스트")
class PageDirectionTest {

    @Test
    @DisplayName("next/prev를 대소문자 무시로 파싱하고 값이 없으면 NEXT인지 검증")
    void parsesKnownValues() {
        assertThat(PageDirection.from(null)).isEqualTo(PageDirection.NEXT);
        assertThat(PageDirection.from("")).isEqualTo(PageDirection.NEXT);
        assertThat(PageDirection.from("Next")).isEqualTo(PageDirection.NEXT);
        assertThat(PageDirection.from("PREV")).isEqualTo(PageDirection.PREV);
    }

    @Test
    @DisplayName("알 수 없는 값이면 INVALID_DIRECTION 예외인지 검증")
    void unknownValue_rejected() {
        assertThatThrownBy(() -> PageDirection.from("sideways"))
                .isInstanceOf(InvalidPageRequestException.class)
                .satisfies(e -> assertThat(((InvalidPageRequestException) e).code())
                        .isEqualTo(InvalidPageRequestException.INVALID_DIRECTION));
    }
}
