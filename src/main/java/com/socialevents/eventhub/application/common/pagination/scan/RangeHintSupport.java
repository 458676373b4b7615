package com.socialevents.eventhub.application.common.pagination.scan;

/**
 * 저장소가 {@link RangeHint}를 얼마나 정확히 반영하는지.
 */
public enum RangeHintSupport {
    /** 커서 경계를 그대로 표현한다. size+1 조회로 충분하다. */
    EXACT,
    /** 일부만 반영한다(예: sortKey만 비교). 넉넉히 over-fetch 해야 한다. */
    APPROXIMATE
}
