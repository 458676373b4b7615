package com.socialevents.eventhub.application.event.service;

import com.socialevents.eventhub.application.common.pagination.PageParams;
import com.socialevents.eventhub.application.common.pagination.PageResult;
import com.socialevents.eventhub.application.event.dto.request.EventFilters;
import com.socialevents.eventhub.application.event.dto.response.EventItemResponse;
import reactor.core.publisher.Mono;

/**
 * 이벤트 목록(커서 페이징) 조회 서비스
 */
public interface EventListService {

    /**
     * 보관되지 않은 전체 이벤트를 선택 필터와 함께 조회한다.
     *
     * @param filters 선택 필터
     * @param page    페이지 파라미터
     * @return 이벤트 페이지
     */
    Mono<PageResult<EventItemResponse>> listEvents(EventFilters filters, PageParams page);

    /**
     * 특정 도시(선택: 주)의 이벤트를 조회한다.
     *
     * @param city  도시
     * @param state 주(없으면 도시만)
     * @param page  페이지 파라미터
     * @return 이벤트 페이지
     */
    Mono<PageResult<EventItemResponse>> listNearby(String city, String state, PageParams page);

    /**
     * 외부에서 수집된(origin=external) 도시별 이벤트를 조회한다.
     *
     * @param city  도시
     * @param state 주(없으면 도시만)
     * @param page  페이지 파라미터
     * @return 이벤트 페이지
     */
    Mono<PageResult<EventItemResponse>> listExternal(String city, String state, PageParams page);

    /**
     * 보관된 이벤트를 조회한다.
     *
     * @param creatorEmail 생성자 이메일(없으면 전체)
     * @param page         페이지 파라미터
     * @return 이벤트 페이지
     */
    Mono<PageResult<EventItemResponse>> listArchived(String creatorEmail, PageParams page);

    /** 사용자가 만든 이벤트 */
    Mono<PageResult<EventItemResponse>> listCreatedBy(String email, PageParams page);

    /** 사용자가 organizer인 이벤트 */
    Mono<PageResult<EventItemResponse>> listOrganizedBy(String email, PageParams page);

    /** 사용자가 moderator인 이벤트 */
    Mono<PageResult<EventItemResponse>> listModeratedBy(String email, PageParams page);

    /** 사용자가 RSVP한 이벤트 */
    Mono<PageResult<EventItemResponse>> listRsvpedBy(String email, PageParams page);
}
