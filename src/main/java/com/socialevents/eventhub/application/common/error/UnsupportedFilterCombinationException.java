package com.socialevents.eventhub.application.common.error;

import java.util.List;

/**
 * 저장소가 요청된 필터/정렬 조합을 실행할 수 없을 때(인덱스 부재 등) 발생한다.
 *
 * <p>빈 페이지로 숨기지 않고 그대로 노출하며, 재시도하지 않는다.
 * 운영자가 필요한 인덱스를 추가할 수 있도록 컬렉션과 필드 목록을 담는다.</p>
 */
public class UnsupportedFilterCombinationException extends RuntimeException {

    public static final String CODE = "UNSUPPORTED_FILTER_COMBINATION";

    private final String collection;
    private final List<String> fields;

    public UnsupportedFilterCombinationException(String collection, List<String> fields) {
        super("No index supports collection '" + collection + "' with fields " + fields);
        this.collection = collection;
        this.fields = List.copyOf(fields);
    }

    public UnsupportedFilterCombinationException(String collection, List<String> fields, Throwable cause) {
        super("Store rejected query on collection '" + collection + "' with fields " + fields
                + ": " + cause.getMessage(), cause);
        this.collection = collection;
        this.fields = List.copyOf(fields);
    }

    public String collection() {
        return collection;
    }

    /** 누락된 인덱스가 포함해야 하는 필드 */
    public List<String> fields() {
        return fields;
    }

    public String code() {
        return CODE;
    }
}
