package com.socialevents.eventhub.infrastructure.persistence.mongo;

import com.socialevents.eventhub.application.common.pagination.PageCursor;
import com.socialevents.eventhub.application.common.pagination.PageDirection;
import com.socialevents.eventhub.application.common.pagination.filter.FilterPredicate;
import com.socialevents.eventhub.application.common.pagination.scan.RangeHint;
import com.socialevents.eventhub.application.common.pagination.scan.SortSpec;
import org.bson.Document;
import org.springframework.data.domain.Sort;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link FilterPredicate}, {@link RangeHint}, 정렬을 MongoDB BSON({@link Document})으로 변환한다.
 *
 * <p>MongoDB 정렬에서 null/누락 필드는 가장 작은 값이므로 "null이 가장 앞" 규칙과 일치한다.
 * {@code {f: null}}은 null과 필드 누락을 모두 매칭한다.</p>
 */
final class MongoFilterRenderer {
    private MongoFilterRenderer() {}

    /**
     * 필터 조건과 범위 힌트를 하나의 쿼리 문서로 합친다.
     *
     * @param filters 필터 조건
     * @param sort    정렬 기준
     * @param hint    범위 힌트(null 가능)
     * @param binder  값 타입 변환기
     * @return 쿼리 문서(조건이 없으면 빈 문서)
     */
    static Document toQuery(List<FilterPredicate> filters, SortSpec sort, RangeHint hint, MongoValueBinder binder) {
        List<Document> parts = new ArrayList<>();
        for (FilterPredicate f : filters) parts.add(predicate(f, binder));
        if (hint != null) parts.add(rangeHint(sort, hint, binder));

        if (parts.isEmpty()) return new Document();
        if (parts.size() == 1) return parts.get(0);
        return new Document("$and", parts);
    }

    static Document predicate(FilterPredicate predicate, MongoValueBinder binder) {
        if (predicate instanceof FilterPredicate.Equals eq) {
            return new Document(eq.field(), binder.bind(eq.field(), eq.value()));
        }
        if (predicate instanceof FilterPredicate.ArrayContains ac) {
            // 배열 필드에 스칼라 동등 비교 = 원소 포함
            return new Document(ac.field(), binder.bind(ac.field(), ac.value()));
        }
        if (predicate instanceof FilterPredicate.Range range) {
            String op = (range.bound() == FilterPredicate.RangeBound.GTE) ? "$gte" : "$lte";
            return new Document(range.field(), new Document(op, binder.bind(range.field(), range.value())));
        }
        throw new IllegalArgumentException("Unsupported filter predicate: " + predicate.getClass().getName());
    }

    /**
     * 커서 위치 기준 "엄격히 이후/이전" 조건.
     *
     * @param sort 정렬 기준
     * @param hint   범위 힌트
     * @param binder 값 타입 변환기
     * @return 범위 조건 문서
     */
    static Document rangeHint(SortSpec sort, RangeHint hint, MongoValueBinder binder) {
        String f = sort.sortField();
        String id = sort.tieBreakField();
        PageCursor c = hint.cursor();
        Object k = binder.bind(f, c.sortKey());
        Object cid = binder.bind(id, c.tieBreakId());

        if (hint.direction() == PageDirection.NEXT) {
            if (k == null) {
                return or(
                        new Document(f, new Document("$ne", null)),
                        new Document(f, null).append(id, new Document("$gt", cid))
                );
            }
            return or(
                    new Document(f, new Document("$gt", k)),
                    new Document(f, k).append(id, new Document("$gt", cid))
            );
        }

        if (k == null) {
            return new Document(f, null).append(id, new Document("$lt", cid));
        }
        return or(
                new Document(f, new Document("$lt", k)),
                new Document(f, null),
                new Document(f, k).append(id, new Document("$lt", cid))
        );
    }

    /**
     * (sortField, tieBreakField) 복합 정렬. 두 필드는 항상 같은 방향이다.
     *
     * @param sort       정렬 기준
     * @param descending 내림차순 여부
     * @return 정렬
     */
    static Sort sort(SortSpec sort, boolean descending) {
        Sort.Direction dir = descending ? Sort.Direction.DESC : Sort.Direction.ASC;
        return Sort.by(dir, sort.sortField(), sort.tieBreakField());
    }

    private static Document or(Document... branches) {
        return new Document("$or", List.of(branches));
    }
}
