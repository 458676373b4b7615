package com.socialevents.eventhub.application.common.pagination.filter;

import java.util.Objects;

/**
 * 저장소 스캔에 전달되는 필터 조건.
 *
 * <p>동등 비교, 배열 포함, 단방향 범위 세 가지만 존재하며
 * 저장소 어댑터는 타입별로 분기하여 처리한다.</p>
 */
public sealed interface FilterPredicate {

    /** 조건이 걸린 필드 경로(예: "location.city") */
    String field();

    static FilterPredicate eq(String field, Object value) {
        return new Equals(field, value);
    }

    static FilterPredicate arrayContains(String field, Object value) {
        return new ArrayContains(field, value);
    }

    static FilterPredicate gte(String field, Object value) {
        return new Range(field, RangeBound.GTE, value);
    }

    static FilterPredicate lte(String field, Object value) {
        return new Range(field, RangeBound.LTE, value);
    }

    /**
     * field == value
     */
    record Equals(String field, Object value) implements FilterPredicate {
        public Equals {
            Objects.requireNonNull(field, "field");
        }
    }

    /**
     * 배열 필드에 value가 포함되어 있는지.
     */
    record ArrayContains(String field, Object value) implements FilterPredicate {
        public ArrayContains {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * field >= value 또는 field <= value
     */
    record Range(String field, RangeBound bound, Object value) implements FilterPredicate {
        public Range {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(bound, "bound");
            Objects.requireNonNull(value, "value");
        }
    }

    enum RangeBound { GTE, LTE }
}
