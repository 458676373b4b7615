package com.socialevents.eventhub.infrastructure.persistence.mongo;

import com.socialevents.eventhub.application.common.error.BadRequestException;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Set;

/**
 * 문자열로 전달된 커서/필터 값을 저장된 BSON 타입으로 되돌리고, 읽은 값을 문자열 키로 바꾼다.
 *
 * <p>MongoDB는 같은 타입끼리만 범위 비교하므로 {@code _id}의 ObjectId hex는 {@link ObjectId}로,
 * 날짜 필드의 ISO-8601 문자열은 {@link Date}로 바인딩해야 한다.
 * 읽을 때는 Date를 고정 폭(밀리초 3자리) UTC 문자열로 만들어 문자열 순서와 시간 순서를 맞춘다.</p>
 */
final class MongoValueBinder {

    static final String ID_FIELD = "_id";

    private static final DateTimeFormatter SORTABLE_INSTANT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Set<String> dateFields;

    MongoValueBinder(Set<String> dateFields) {
        this.dateFields = Set.copyOf(dateFields);
    }

    /**
     * 쿼리에 넣을 값을 필드 타입에 맞게 변환한다.
     *
     * @param path  필드 경로
     * @param value 요청/커서 값
     * @return BSON 값
     * @throws BadRequestException 날짜 필드에 ISO-8601이 아닌 문자열이 온 경우
     */
    Object bind(String path, Object value) {
        if (!(value instanceof String s)) return value;
        if (ID_FIELD.equals(path)) {
            return ObjectId.isValid(s) ? new ObjectId(s) : s;
        }
        if (dateFields.contains(path)) {
            return toDate(path, s);
        }
        return s;
    }

    /**
     * 읽은 정렬/ID 값을 커서용 문자열로 바꾼다.
     *
     * @param raw 문서 값(null 가능)
     * @return 문자열 키(없으면 null)
     */
    static String toKey(Object raw) {
        if (raw == null) return null;
        if (raw instanceof String s) return s;
        if (raw instanceof Date d) return SORTABLE_INSTANT.format(d.toInstant());
        if (raw instanceof Instant i) return SORTABLE_INSTANT.format(i);
        if (raw instanceof ObjectId id) return id.toHexString();
        return String.valueOf(raw);
    }

    private static Date toDate(String path, String s) {
        try {
            return Date.from(Instant.parse(s));
        } catch (DateTimeParseException notInstant) {
            try {
                return Date.from(LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());
            } catch (DateTimeParseException e) {
                throw new BadRequestException(path + " must be an ISO-8601 date or timestamp (was '" + s + "')",
                        "VALIDATION_ERROR");
            }
        }
    }
}
