package com.socialevents.eventhub.bootstrap;

import com.socialevents.eventhub.infrastructure.persistence.mongo.MongoIndexCatalog;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 애플리케이션 시작 시점에 선언된 복합 인덱스를 생성하는 설정 클래스입니다.
 *
 * <p>{@link ApplicationRunner}를 Bean으로 등록해, 컨텍스트 초기화 직후
 * {@code eventhub.store.indexes.*}에 선언된 인덱스를 {@code {필드...: 1, _id: 1}} 형태로 만듭니다.
 * 이미 존재하는 인덱스는 MongoDB가 그대로 둡니다.</p>
 */
@Configuration
@Profile("local")
public class MongoIndexRunner {

    private static final Logger log = LoggerFactory.getLogger(MongoIndexRunner.class);

    /**
     * 선언된 인덱스를 생성하는 Runner Bean을 만듭니다.
     *
     * @param mongo        reactive MongoDB 템플릿
     * @param indexCatalog 선언된 인덱스 목록
     * @return 인덱스를 생성하는 {@link ApplicationRunner}
     */
    @Bean
    ApplicationRunner createDeclaredIndexes(ReactiveMongoOperations mongo, MongoIndexCatalog indexCatalog) {
        return args -> Flux.fromIterable(indexCatalog.collections())
                .concatMap(collection -> Flux.fromIterable(indexCatalog.declared(collection))
                        .concatMap(fields -> createIndex(mongo, collection, fields)))
                .then()
                .block();
    }

    private static Mono<String> createIndex(ReactiveMongoOperations mongo, String collection, List<String> fields) {
        Document keys = indexKeys(fields);
        return mongo.getCollection(collection)
                .flatMap(c -> Mono.from(c.createIndex(keys)))
                .doOnNext(name -> log.info("Index ready on {}: {}", collection, name));
    }

    static Document indexKeys(List<String> fields) {
        Document keys = new Document();
        for (String field : fields) keys.append(field, 1);
        if (!keys.containsKey("_id")) keys.append("_id", 1);
        return keys;
    }
}
