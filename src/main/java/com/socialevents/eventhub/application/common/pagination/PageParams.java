package com.socialevents.eventhub.application.common.pagination;

/**
 * 목록 API 공통 페이지 파라미터.
 *
 * @param cursor    불투명 커서(없으면 null)
 * @param size      페이지 크기(null이면 기본값)
 * @param direction 이동 방향
 */
public record PageParams(String cursor, Integer size, PageDirection direction) {

    /**
     * 요청 파라미터 문자열로 생성한다.
     *
     * @throws com.socialevents.eventhub.application.common.error.InvalidPageRequestException direction이 잘못된 경우
     */
    public static PageParams of(String cursor, Integer size, String direction) {
        return new PageParams(cursor, size, PageDirection.from(direction));
    }
}
