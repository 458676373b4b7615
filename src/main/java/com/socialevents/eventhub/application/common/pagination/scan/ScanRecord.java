package com.socialevents.eventhub.application.common.pagination.scan;

import com.socialevents.eventhub.application.common.pagination.CursorKeyed;

import java.util.Map;
import java.util.Objects;

/**
 * 스캔으로 읽어온 원본 문서 한 건.
 *
 * @param tieBreakId 문서 ID
 * @param sortKey    정렬 키(없으면 null)
 * @param fields     문서 필드(읽기 전용)
 */
public record ScanRecord(
        String tieBreakId,
        String sortKey,
        Map<String, Object> fields
) implements CursorKeyed {
    public ScanRecord {
        Objects.requireNonNull(tieBreakId, "tieBreakId");
        fields = (fields == null) ? Map.of() : fields;
    }
}
