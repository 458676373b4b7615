package com.socialevents.eventhub.application.common.pagination;

import com.socialevents.eventhub.application.common.error.StoreUnavailableException;
import com.socialevents.eventhub.application.common.pagination.scan.DocumentScanner;
import com.socialevents.eventhub.application.common.pagination.scan.RangeHint;
import com.socialevents.eventhub.application.common.pagination.scan.RangeHintSupport;
import com.socialevents.eventhub.application.common.pagination.scan.ScanRecord;
import com.socialevents.eventhub.application.common.pagination.scan.ScanRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * 페이지 한 장을 위한 저장소 스캔(1회)을 수행한다.
 *
 * <p>커서가 없으면 처음(next) 또는 끝(prev)부터 size+1건을 읽는다.
 * 커서가 있으면 범위 힌트를 함께 넘기고, 저장소가 힌트를 근사적으로만 반영하면
 * size x 배수(상한 적용)만큼 넉넉히 읽는다. prev 스캔은 내림차순(커서에 가까운 순)이다.</p>
 */
@Component
public class PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final DocumentScanner scanner;
    private final PaginationProperties properties;

    public PageFetcher(DocumentScanner scanner, PaginationProperties properties) {
        this.scanner = scanner;
        this.properties = properties;
    }

    /**
     * 페이지 후보를 스캔한다.
     *
     * @param query  페이지 요청
     * @param cursor 디코딩된 커서(없으면 null)
     * @return 스캔 순서 그대로의 후보(prev면 내림차순)
     */
    public Mono<List<ScanRecord>> fetch(PageQuery query, PageCursor cursor) {
        RangeHint hint = (cursor == null) ? null : new RangeHint(cursor, query.direction());
        int limit = fetchLimit(query.pageSize(), cursor != null);

        ScanRequest request = new ScanRequest(
                query.collection(),
                query.filters(),
                query.sort(),
                hint,
                query.direction() == PageDirection.PREV,
                limit
        );

        Duration timeout = (query.timeout() == null) ? properties.scanTimeout() : query.timeout();
        log.debug("Scanning {} limit={} direction={} cursor={}",
                query.collection(), limit, query.direction(), cursor != null);

        return scanner.scan(request)
                .collectList()
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new StoreUnavailableException(
                        "Scan on '" + query.collection() + "' timed out after " + timeout, e));
    }

    /**
     * 조회 건수를 계산한다.
     *
     * <p>근사 힌트일 때는 max(size+1, min(size x 배수, 상한)).
     * size가 상한과 같아도 hasMore를 판별할 수 있도록 size+1 아래로 내려가지 않는다.</p>
     *
     * @param pageSize       요청 페이지 크기
     * @param cursorSupplied 커서 유무
     * @return 스캔 limit
     */
    int fetchLimit(int pageSize, boolean cursorSupplied) {
        int minimal = KeysetPageAssembler.fetchSize(pageSize);
        if (!cursorSupplied || scanner.rangeHintSupport() == RangeHintSupport.EXACT) {
            return minimal;
        }
        int widened = Math.min(pageSize * properties.overfetchMultiplier(), properties.overfetchCap());
        return Math.max(minimal, widened);
    }
}
