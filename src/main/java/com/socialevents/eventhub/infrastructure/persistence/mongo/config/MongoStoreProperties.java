package com.socialevents.eventhub.infrastructure.persistence.mongo.config;

import com.socialevents.eventhub.application.common.pagination.scan.RangeHintSupport;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 문서 저장소 설정({@code eventhub.store.*}).
 *
 * <p>indexes는 컬렉션별로 선언된 복합 인덱스 목록이며 각 항목은 "필드1,필드2,..." 형식이다.
 * strictIndexes가 true면 선언된 인덱스로 커버되지 않는 필터 조합은 스캔 전에 거부된다.</p>
 *
 * @param rangeHintSupport 커서 범위 힌트 반영 수준
 * @param strictIndexes    인덱스 커버리지 검사 여부
 * @param indexes          컬렉션 → 인덱스 필드 목록
 * @param dateFields       BSON Date로 저장된 필드 경로(커서/필터 값을 Date로 바인딩)
 */
@ConfigurationProperties(prefix = "eventhub.store")
public record MongoStoreProperties(
        @DefaultValue("EXACT") RangeHintSupport rangeHintSupport,
        @DefaultValue("false") boolean strictIndexes,
        Map<String, List<String>> indexes,
        Set<String> dateFields
) {
    public MongoStoreProperties {
        indexes = (indexes == null) ? Map.of() : Map.copyOf(indexes);
        dateFields = (dateFields == null) ? Set.of() : Set.copyOf(dateFields);
    }
}
