package com.socialevents.eventhub.application.common.pagination;

import java.util.List;

/**
 * 경계 보정이 끝난 후보 목록을 {@link PageResult}로 조립하는 유틸리티.
 *
 * <p>over-fetch한 결과 건수로 hasMore를 판단하고, 커서에 가까운 size건만 남긴 뒤
 * 방향에 따라 hasNext/hasPrevious와 커서를 만든다.</p>
 */
public final class KeysetPageAssembler {

    private KeysetPageAssembler() {}

    /**
     * @param corrected      경계 보정 후 오름차순(표시 순서) 후보
     * @param size           클라이언트가 요청한 page size
     * @param direction      이동 방향
     * @param cursorSupplied 요청에 유효한 커서가 있었는지
     * @param <T>            아이템 타입
     * @return 페이지 결과
     */
    public static <T extends CursorKeyed> PageResult<T> toPage(List<T> corrected,
                                                               int size,
                                                               PageDirection direction,
                                                               boolean cursorSupplied) {
        boolean hasMore = corrected.size() > size;

        List<T> items;
        if (!hasMore) {
            items = corrected;
        } else if (direction == PageDirection.NEXT) {
            items = corrected.subList(0, size);
        } else {
            // prev: 커서에 가장 가까운 마지막 size건
            items = corrected.subList(corrected.size() - size, corrected.size());
        }

        boolean hasNext = (direction == PageDirection.NEXT) ? hasMore : cursorSupplied;
        boolean hasPrevious = (direction == PageDirection.NEXT) ? cursorSupplied : hasMore;

        String nextCursor = null;
        String prevCursor = null;
        if (!items.isEmpty()) {
            if (hasNext) nextCursor = CursorCodec.encode(PageCursor.of(items.get(items.size() - 1)));
            if (hasPrevious) prevCursor = CursorCodec.encode(PageCursor.of(items.get(0)));
        }

        return new PageResult<>(items, new PaginationInfo(nextCursor, prevCursor, hasNext, hasPrevious, size));
    }

    /**
     * 다음 페이지 유무 판별을 위해 최소로 조회해야 하는 건수.
     *
     * @param size 요청 페이지 크기
     * @return size + 1
     */
    public static int fetchSize(int size) {
        return size + 1;
    }
}
