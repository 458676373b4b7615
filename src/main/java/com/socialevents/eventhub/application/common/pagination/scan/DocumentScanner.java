package com.socialevents.eventhub.application.common.pagination.scan;

import reactor.core.publisher.Flux;

/**
 * 문서 저장소의 "필터 + 정렬 + 범위 + limit" 스캔 계약.
 */
public interface DocumentScanner {

    /**
     * 요청 조건으로 최대 limit 건을 정렬 순서대로 반환한다.
     *
     * <p>필터/정렬 조합을 실행할 수 없으면
     * {@link com.socialevents.eventhub.application.common.error.UnsupportedFilterCombinationException},
     * 일시적 장애면
     * {@link com.socialevents.eventhub.application.common.error.StoreUnavailableException}으로 종료한다.</p>
     *
     * @param request 스캔 요청
     * @return 스캔 결과
     */
    Flux<ScanRecord> scan(ScanRequest request);

    /**
     * @return 이 저장소의 범위 힌트 반영 수준
     */
    RangeHintSupport rangeHintSupport();
}
