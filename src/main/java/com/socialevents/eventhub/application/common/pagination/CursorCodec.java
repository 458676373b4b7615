package com.socialevents.eventhub.application.common.pagination;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.JsonNodeType;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;


/**
 * 커서 기반 페이징을 위한 인코딩/디코딩 유틸리티.
 *
 * <p>{@link PageCursor}를 JSON으로 직렬화한 뒤 Base64(URL-safe, padding 없음)로 변환한다.
 * 토큰에는 (sortKey, tieBreakId) 외의 정보를 담지 않는다.</p>
 *
 * <p>디코딩은 절대 예외를 던지지 않는다. 깨졌거나 조작된 토큰은 "커서 없음"으로 취급되어
 * 첫 페이지 조회로 대체된다. 서명 검증이 필요해지면 이 클래스 안에서만 추가한다.</p>
 */
public final class CursorCodec {

    private static final Logger log = LoggerFactory.getLogger(CursorCodec.class);

    /** 커서 직렬화/역직렬화용 ObjectMapper */
    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private CursorCodec() {}

    /**
     * 커서를 Base64 문자열로 인코딩한다.
     *
     * @param cursor 커서
     * @return 인코딩된 커서 문자열
     * @throws IllegalArgumentException 커서가 null이거나 tieBreakId가 비어 있는 경우
     */
    public static String encode(PageCursor cursor) {
        if (cursor == null || cursor.tieBreakId() == null || cursor.tieBreakId().isBlank()) {
            throw new IllegalArgumentException("cursor requires a tieBreakId");
        }
        try {
            String json = MAPPER.writeValueAsString(cursor);
            return Base64.getUrlEncoder().withoutPadding()
                    .encodeToString(json.getBytes(StandardCharsets.UTF_8));
        } catch (JacksonException e) {
            throw new IllegalArgumentException("Failed to encode cursor", e);
        }
    }

    /**
     * Base64 문자열을 커서로 디코딩한다.
     *
     * @param encoded 인코딩된 커서 문자열(null 가능)
     * @return 디코딩된 커서, 비어 있거나 형식이 잘못되었으면 empty
     */
    public static Optional<PageCursor> decode(String encoded) {
        if (encoded == null || encoded.isBlank()) return Optional.empty();
        try {
            byte[] decoded = Base64.getUrlDecoder().decode(encoded.trim());
            String json = new String(decoded, StandardCharsets.UTF_8);
            JsonNode node = MAPPER.readTree(json);
            if (!hasStringFields(node)) {
                log.debug("Ignoring cursor with non-string fields");
                return Optional.empty();
            }
            PageCursor cursor = MAPPER.treeToValue(node, PageCursor.class);
            if (cursor == null || cursor.tieBreakId() == null || cursor.tieBreakId().isBlank()) {
                log.debug("Ignoring cursor without tieBreakId");
                return Optional.empty();
            }
            return Optional.of(cursor);
        } catch (IllegalArgumentException | JacksonException e) {
            log.debug("Ignoring malformed cursor: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 토큰 JSON이 객체이고 {@code id}는 문자열, {@code k}는 문자열 또는 null인지 확인한다.
     * 숫자나 불리언이 문자열로 강제 변환되어 다른 위치를 가리키는 것을 막는다.
     */
    private static boolean hasStringFields(JsonNode node) {
        if (node == null || !node.isObject()) return false;
        JsonNode id = node.get("id");
        if (id == null || id.getNodeType() != JsonNodeType.STRING) return false;
        JsonNode k = node.get("k");
        return k == null || k.isNull() || k.getNodeType() == JsonNodeType.STRING;
    }
}
