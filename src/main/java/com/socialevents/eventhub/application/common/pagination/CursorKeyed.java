package com.socialevents.eventhub.application.common.pagination;

/**
 * 커서 정렬 기준 (sortKey, tieBreakId) 쌍을 노출하는 타입.
 *
 * <p>sortKey는 없을 수 있으며(null), tieBreakId는 컬렉션 전체에서 유일하다.</p>
 */
public interface CursorKeyed {

    /** 1차 정렬 키(ISO-8601 문자열 등). 없으면 null */
    String sortKey();

    /** 동일 sortKey 간 순서를 결정하는 유일 ID */
    String tieBreakId();
}
