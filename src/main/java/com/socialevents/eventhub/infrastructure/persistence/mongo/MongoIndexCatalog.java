package com.socialevents.eventhub.infrastructure.persistence.mongo;

import com.socialevents.eventhub.application.common.pagination.filter.FilterPredicate;
import com.socialevents.eventhub.application.common.pagination.scan.SortSpec;
import com.socialevents.eventhub.infrastructure.persistence.mongo.config.MongoStoreProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 컬렉션별로 선언된 복합 인덱스 목록.
 *
 * <p>필터 필드 + 정렬 필드를 모두 포함하는 인덱스가 하나라도 있어야 "실행 가능한" 조합으로 본다.
 * tie-break 필드(_id)는 모든 인덱스 끝에 붙으므로 검사하지 않는다.</p>
 */
@Component
public class MongoIndexCatalog {

    private final boolean strict;
    private final Map<String, List<List<String>>> indexes;

    public MongoIndexCatalog(MongoStoreProperties properties) {
        this.strict = properties.strictIndexes();
        this.indexes = parse(properties.indexes());
    }

    /**
     * @param collection 컬렉션 이름
     * @return 선언된 인덱스(필드 순서 유지)
     */
    public List<List<String>> declared(String collection) {
        return indexes.getOrDefault(collection, List.of());
    }

    /**
     * @return 인덱스가 선언된 컬렉션 이름
     */
    public Set<String> collections() {
        return indexes.keySet();
    }

    /**
     * 요청을 커버하는 인덱스가 없으면 그 인덱스가 가져야 할 필드 목록을 반환한다.
     *
     * @param collection 컬렉션 이름
     * @param filters    필터 조건
     * @param sort       정렬 기준
     * @return 누락된 인덱스 필드(검사 비활성화 또는 커버되면 empty)
     */
    public Optional<List<String>> missingIndex(String collection, List<FilterPredicate> filters, SortSpec sort) {
        if (!strict) return Optional.empty();

        List<String> required = requiredFields(filters, sort);
        for (List<String> index : declared(collection)) {
            if (index.containsAll(required)) return Optional.empty();
        }
        return Optional.of(required);
    }

    /**
     * 필터 필드(등장 순서) 뒤에 정렬 필드를 붙인 목록.
     */
    static List<String> requiredFields(List<FilterPredicate> filters, SortSpec sort) {
        Set<String> fields = new LinkedHashSet<>();
        for (FilterPredicate f : filters) fields.add(f.field());
        fields.add(sort.sortField());
        return new ArrayList<>(fields);
    }

    private static Map<String, List<List<String>>> parse(Map<String, List<String>> raw) {
        Map<String, List<List<String>>> parsed = new LinkedHashMap<>();
        raw.forEach((collection, specs) -> {
            List<List<String>> list = new ArrayList<>();
            for (String spec : specs) {
                List<String> fields = Arrays.stream(spec.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();
                if (!fields.isEmpty()) list.add(fields);
            }
            parsed.put(collection, List.copyOf(list));
        });
        return Map.copyOf(parsed);
    }
}
