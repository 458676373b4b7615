package com.socialevents.eventhub.infrastructure.persistence.mongo;

import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.socialevents.eventhub.application.common.error.StoreUnavailableException;
import com.socialevents.eventhub.application.common.error.UnsupportedFilterCombinationException;
import com.socialevents.eventhub.application.common.pagination.scan.DocumentScanner;
import com.socialevents.eventhub.application.common.pagination.scan.RangeHintSupport;
import com.socialevents.eventhub.application.common.pagination.scan.ScanRecord;
import com.socialevents.eventhub.application.common.pagination.scan.ScanRequest;
import com.socialevents.eventhub.application.common.pagination.scan.SortSpec;
import com.socialevents.eventhub.infrastructure.persistence.mongo.config.MongoStoreProperties;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB 컬렉션에 대한 {@link DocumentScanner} 구현.
 *
 * <p>필터/범위 힌트는 {@link MongoFilterRenderer}로 BSON 변환하고,
 * (sortField, _id) 순으로 정렬해 limit 건만 읽는다.
 * 선언된 인덱스로 커버되지 않는 조합은 스캔 전에 거부한다(strict 모드).</p>
 */
@Component
public class MongoDocumentScanner implements DocumentScanner {

    private static final Logger log = LoggerFactory.getLogger(MongoDocumentScanner.class);

    /** NoQueryExecutionPlans (notablescan 등으로 실행 계획이 없을 때) */
    static final int NO_QUERY_EXECUTION_PLANS = 291;
    /** BadValue (존재하지 않는 인덱스 hint 등) */
    static final int BAD_VALUE = 2;

    private final ReactiveMongoOperations mongo;
    private final MongoIndexCatalog indexCatalog;
    private final RangeHintSupport rangeHintSupport;
    private final MongoValueBinder binder;

    public MongoDocumentScanner(ReactiveMongoOperations mongo,
                                MongoIndexCatalog indexCatalog,
                                MongoStoreProperties properties) {
        this.mongo = mongo;
        this.indexCatalog = indexCatalog;
        this.rangeHintSupport = properties.rangeHintSupport();
        this.binder = new MongoValueBinder(properties.dateFields());
    }

    @Override
    public Flux<ScanRecord> scan(ScanRequest request) {
        return Flux.defer(() -> {
            Optional<List<String>> missing =
                    indexCatalog.missingIndex(request.collection(), request.filters(), request.sort());
            if (missing.isPresent()) {
                return Flux.error(new UnsupportedFilterCombinationException(request.collection(), missing.get()));
            }

            Document filter = MongoFilterRenderer.toQuery(request.filters(), request.sort(), request.rangeHint(), binder);
            BasicQuery query = new BasicQuery(filter);
            query.with(MongoFilterRenderer.sort(request.sort(), request.descending()));
            query.limit(request.limit());

            log.debug("find {} filter={} limit={}", request.collection(), filter.toJson(), request.limit());

            return mongo.find(query, Document.class, request.collection())
                    .map(doc -> toRecord(doc, request.sort()))
                    .onErrorMap(e -> translate(e, request));
        });
    }

    @Override
    public RangeHintSupport rangeHintSupport() {
        return rangeHintSupport;
    }

    /**
     * 문서를 {@link ScanRecord}로 변환한다.
     * Date/Instant는 고정 폭 ISO-8601 UTC 문자열로, ObjectId는 hex 문자열로 바꾼다.
     *
     * @param doc  원본 문서
     * @param sort 정렬 기준
     * @return 스캔 레코드
     */
    static ScanRecord toRecord(Document doc, SortSpec sort) {
        Object id = doc.get(sort.tieBreakField());
        if (id == null) {
            throw new IllegalStateException("Document without " + sort.tieBreakField() + " in scan result");
        }
        Object raw = doc.getEmbedded(Arrays.asList(sort.sortField().split("\\.")), Object.class);
        return new ScanRecord(MongoValueBinder.toKey(id), MongoValueBinder.toKey(raw), doc);
    }

    /**
     * 드라이버/스프링 예외를 페이징 엔진의 예외로 변환한다.
     */
    Throwable translate(Throwable e, ScanRequest request) {
        if (e instanceof UnsupportedFilterCombinationException || e instanceof StoreUnavailableException) {
            return e;
        }

        MongoException mongoError = findCause(e, MongoException.class);
        if (mongoError != null && isUnsupportedPlan(mongoError)) {
            return new UnsupportedFilterCombinationException(
                    request.collection(),
                    MongoIndexCatalog.requiredFields(request.filters(), request.sort()),
                    e);
        }

        if (e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessException
                || findCause(e, MongoTimeoutException.class) != null
                || findCause(e, MongoExecutionTimeoutException.class) != null
                || findCause(e, MongoSocketException.class) != null) {
            log.warn("Scan on {} failed: {}", request.collection(), e.getMessage());
            return new StoreUnavailableException("Store unavailable while scanning '" + request.collection() + "'", e);
        }
        return e;
    }

    private static boolean isUnsupportedPlan(MongoException e) {
        if (e.getCode() == NO_QUERY_EXECUTION_PLANS) return true;
        String msg = e.getMessage();
        return e.getCode() == BAD_VALUE && msg != null
                && (msg.contains("hint") || msg.contains("index"));
    }

    private static <T extends Throwable> T findCause(Throwable e, Class<T> type) {
        Throwable current = e;
        while (current != null) {
            if (type.isInstance(current)) return type.cast(current);
            if (current.getCause() == current) break;
            current = current.getCause();
        }
        return null;
    }
}
