package com.socialevents.eventhub.application.common.pagination;

import com.socialevents.eventhub.application.common.error.InvalidPageRequestException;
import com.socialevents.eventhub.application.common.pagination.scan.ScanRecord;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 모든 목록 API가 공유하는 커서 페이징 파이프라인.
 *
 * <p>요청 단위로만 동작하며 상태를 갖지 않는다. 흐름:
 * 검증 → 커서 디코딩 → 스캔 → 경계 보정 → (prev면) 오름차순 정렬 → trim/플래그/커서 발급.</p>
 *
 * <p>페이지 사이에 문서가 추가/삭제되면 경계에서 누락되거나 중복될 수 있다(스냅샷 격리 없음).</p>
 */
@Component
public class CursorPaginator {

    private final PageFetcher pageFetcher;
    private final PaginationProperties properties;

    public CursorPaginator(PageFetcher pageFetcher, PaginationProperties properties) {
        this.pageFetcher = pageFetcher;
        this.properties = properties;
    }

    /**
     * 필터/커서/방향에 맞는 한 페이지를 조회한다.
     *
     * @param request 페이지 요청
     * @return 페이지 결과(아이템은 항상 오름차순)
     */
    public Mono<PageResult<ScanRecord>> paginate(PageQuery request) {
        return Mono.defer(() -> {
            PageQuery query = withDefaults(request);
            validate(query);

            PageCursor cursor = CursorCodec.decode(query.cursor()).orElse(null);
            boolean cursorSupplied = cursor != null;

            return pageFetcher.fetch(query, cursor)
                    .map(scanned -> {
                        List<ScanRecord> corrected = CursorBoundaryFilter.retainBeyond(scanned, cursor, query.direction());
                        List<ScanRecord> ordered = toDisplayOrder(corrected, query.direction());
                        return KeysetPageAssembler.toPage(ordered, query.pageSize(), query.direction(), cursorSupplied);
                    });
        });
    }

    private PageQuery withDefaults(PageQuery query) {
        return (query.pageSize() == null) ? query.withPageSize(properties.defaultPageSize()) : query;
    }

    /**
     * 저장소 접근 전에 요청을 검증한다.
     *
     * @param query 페이지 요청
     * @throws InvalidPageRequestException 페이지 크기/방향/정렬이 잘못된 경우
     */
    void validate(PageQuery query) {
        if (query.pageSize() < 1 || query.pageSize() > properties.maxPageSize()) {
            throw InvalidPageRequestException.invalidPageSize(query.pageSize(), properties.maxPageSize());
        }
        if (query.direction() == null) {
            throw InvalidPageRequestException.invalidDirection(null);
        }
        if (query.collection() == null || query.collection().isBlank() || query.sort() == null) {
            throw new InvalidPageRequestException("collection and sort are required",
                    InvalidPageRequestException.INVALID_PAGE_REQUEST);
        }
    }

    private static List<ScanRecord> toDisplayOrder(List<ScanRecord> corrected, PageDirection direction) {
        if (direction == PageDirection.NEXT) return corrected;
        List<ScanRecord> reversed = new ArrayList<>(corrected);
        Collections.reverse(reversed);
        return reversed;
    }
}
