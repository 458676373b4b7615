package com.socialevents.eventhub.application.common.pagination.support;

import com.socialevents.eventhub.application.common.pagination.CursorOrdering;
import com.socialevents.eventhub.application.common.pagination.PageCursor;
import com.socialevents.eventhub.application.common.pagination.PageDirection;
import com.socialevents.eventhub.application.common.pagination.filter.FilterPredicate;
import com.socialevents.eventhub.application.common.pagination.scan.DocumentScanner;
import com.socialevents.eventhub.application.common.pagination.scan.RangeHint;
import com.socialevents.eventhub.application.common.pagination.scan.RangeHintSupport;
import com.socialevents.eventhub.application.common.pagination.scan.ScanRecord;
import com.socialevents.eventhub.application.common.pagination.scan.ScanRequest;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 테스트용 메모리 {@link DocumentScanner}.
 *
 * <p>APPROXIMATE 모드에서는 범위 힌트를 sortKey 단위로만 반영한다
 * (같은 sortKey를 가진 문서는 커서 자신을 포함해 모두 돌려준다).
 * 경계 보정은 페이징 엔진이 해야 한다.</p>
 */
public class InMemoryDocumentScanner implements DocumentScanner {

    private final RangeHintSupport support;
    private final Map<String, List<ScanRecord>> collections = new HashMap<>();
    private final List<ScanRequest> requests = new ArrayList<>();

    public InMemoryDocumentScanner(RangeHintSupport support) {
        this.support = support;
    }

    public InMemoryDocumentScanner add(String collection, String id, String sortKey) {
        return add(collection, id, sortKey, Map.of());
    }

    public InMemoryDocumentScanner add(String collection, String id, String sortKey, Map<String, Object> fields) {
        collections.computeIfAbsent(collection, c -> new ArrayList<>()).add(new ScanRecord(id, sortKey, fields));
        return this;
    }

    public List<ScanRequest> requests() {
        return requests;
    }

    @Override
    public Flux<ScanRecord> scan(ScanRequest request) {
        requests.add(request);

        Comparator<ScanRecord> order = CursorOrdering.INSTANCE::compare;
        if (request.descending()) order = order.reversed();

        List<ScanRecord> matched = collections.getOrDefault(request.collection(), List.of()).stream()
                .filter(r -> request.filters().stream().allMatch(f -> matches(r, f)))
                .filter(r -> request.rangeHint() == null || withinHint(r, request.rangeHint()))
                .sorted(order)
                .limit(request.limit())
                .toList();
        return Flux.fromIterable(matched);
    }

    @Override
    public RangeHintSupport rangeHintSupport() {
        return support;
    }

    private boolean withinHint(ScanRecord r, RangeHint hint) {
        PageCursor c = hint.cursor();
        int cmp = CursorOrdering.INSTANCE.compare(r, c);
        if (support == RangeHintSupport.EXACT) {
            return (hint.direction() == PageDirection.NEXT) ? cmp > 0 : cmp < 0;
        }
        if (c.sortKey() == null) {
            return (hint.direction() == PageDirection.NEXT) ? cmp >= 0 : cmp <= 0;
        }
        if (hint.direction() == PageDirection.NEXT) {
            return r.sortKey() != null && CursorOrdering.compareSortKeys(r.sortKey(), c.sortKey()) >= 0;
        }
        return CursorOrdering.compareSortKeys(r.sortKey(), c.sortKey()) <= 0;
    }

    private static boolean matches(ScanRecord r, FilterPredicate predicate) {
        Object actual = r.fields().get(predicate.field());
        if (predicate instanceof FilterPredicate.Equals eq) {
            return (eq.value() == null) ? actual == null : eq.value().equals(actual);
        }
        if (predicate instanceof FilterPredicate.ArrayContains ac) {
            return actual instanceof List<?> list && list.contains(ac.value());
        }
        if (predicate instanceof FilterPredicate.Range range) {
            if (actual == null) return false;
            int cmp = String.valueOf(actual).compareTo(String.valueOf(range.value()));
            return (range.bound() == FilterPredicate.RangeBound.GTE) ? cmp >= 0 : cmp <= 0;
        }
        return false;
    }
}
