package com.socialevents.eventhub.infrastructure.persistence.mongo;

import com.socialevents.eventhub.application.common.pagination.filter.FilterPredicate;
import com.socialevents.eventhub.application.common.pagination.scan.RangeHintSupport;
import com.socialevents.eventhub.application.common.pagination.scan.SortSpec;
import com.socialevents.eventhub.infrastructure.persistence.mongo.config.MongoStoreProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("mongo index catalog 테스트")
class MongoIndexCatalogTest {

    private static final SortSpec SORT = SortSpec.byField("startTime");

    private static MongoIndexCatalog catalog(boolean strict) {
        return new MongoIndexCatalog(new MongoStoreProperties(RangeHintSupport.EXACT, strict, Map.of(
                "events", List.of("isArchived, startTime", "isArchived,location.city,startTime")
        ), Set.of()));
    }

    @Test
    @DisplayName("선언된 인덱스 문자열을 필드 목록으로 파싱하는지 검증")
    void parsesDeclaredIndexes() {
        var catalog = catalog(true);

        assertThat(catalog.collections()).containsExactly("events");
        assertThat(catalog.declared("events")).containsExactly(
                List.of("isArchived", "startTime"),
                List.of("isArchived", "location.city", "startTime"));
        assertThat(catalog.declared("users")).isEmpty();
    }

    @Test
    @DisplayName("커버하는 인덱스가 있으면 empty, 없으면 필요한 필드를 반환하는지 검증")
    void missingIndex_strict() {
        var catalog = catalog(true);
        var covered = List.of(FilterPredicate.eq("isArchived", false), FilterPredicate.eq("location.city", "Austin"));
        var uncovered = List.of(FilterPredicate.eq("isArchived", false), FilterPredicate.eq("origin", "external"));

        assertThat(catalog.missingIndex("events", covered, SORT)).isEmpty();
        assertThat(catalog.missingIndex("events", uncovered, SORT))
                .contains(List.of("isArchived", "origin", "startTime"));
        assertThat(catalog.missingIndex("users", List.of(), SortSpec.byField("name")))
                .contains(List.of("name"));
    }

    @Test
    @DisplayName("strict가 아니면 검사하지 않는지 검증")
    void missingIndex_lenient() {
        var uncovered = List.of(FilterPredicate.eq("origin", "external"));

        assertThat(catalog(false).missingIndex("events", uncovered, SORT)).isEmpty();
    }
}
