package com.socialevents.eventhub.application.event.controller;

import com.socialevents.eventhub.application.common.pagination.PageParams;
import com.socialevents.eventhub.application.common.pagination.PageResult;
import com.socialevents.eventhub.application.event.dto.request.EventFilters;
import com.socialevents.eventhub.application.event.dto.response.EventItemResponse;
import com.socialevents.eventhub.application.event.service.EventListService;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * 이벤트 목록 조회 REST 컨트롤러.
 *
 * <p>모든 엔드포인트는 {@code cursor}, {@code size}(없으면 설정 기본값), {@code direction}(next|prev)을 받는다.
 * 페이지 크기 범위와 방향 값은 페이징 엔진이 검증한다.</p>
 */
@RestController
@RequestMapping("/api")
@Validated
public class EventListController {
    private final EventListService service;

    public EventListController(EventListService service) {
        this.service = service;
    }

    /**
     * 보관되지 않은 이벤트 목록을 조회한다.
     *
     * @param city         도시
     * @param state        주
     * @param category     카테고리
     * @param isOnline     온라인 여부
     * @param creatorEmail 생성자 이메일
     * @param startDate    시작 시각 하한(ISO-8601)
     * @param endDate      시작 시각 상한(ISO-8601)
     * @param cursor       커서
     * @param size         페이지 크기
     * @param direction    next | prev
     * @return 이벤트 페이지
     */
    @GetMapping("/events")
    public Mono<PageResult<EventItemResponse>> listEvents(
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Boolean isOnline,
            @RequestParam(required = false) String creatorEmail,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer size,
            @RequestParam(defaultValue = "next") String direction
    ) {
        EventFilters filters = new EventFilters(city, state, category, isOnline, creatorEmail, startDate, endDate);
        return service.listEvents(filters, PageParams.of(cursor, size, direction));
    }

    /**
     * 도시(선택: 주) 기준 이벤트를 조회한다.
     */
    @GetMapping("/events/nearby")
    public Mono<PageResult<EventItemResponse>> listNearby(
            @RequestParam @NotBlank String city,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer size,
            @RequestParam(defaultValue = "next") String direction
    ) {
        return service.listNearby(city, state, PageParams.of(cursor, size, direction));
    }

    /**
     * 외부 수집 이벤트를 도시 기준으로 조회한다.
     */
    @GetMapping("/events/external")
    public Mono<PageResult<EventItemResponse>> listExternal(
            @RequestParam @NotBlank String city,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer size,
            @RequestParam(defaultValue = "next") String direction
    ) {
        return service.listExternal(city, state, PageParams.of(cursor, size, direction));
    }

    @GetMapping("/events/archived")
    public Mono<PageResult<EventItemResponse>> listArchived(
            @RequestParam(required = false) String creatorEmail,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer size,
            @RequestParam(defaultValue = "next") String direction
    ) {
        return service.listArchived(creatorEmail, PageParams.of(cursor, size, direction));
    }

    @GetMapping("/users/{email}/events/created")
    public Mono<PageResult<EventItemResponse>> listCreated(
            @PathVariable @NotBlank String email,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer size,
            @RequestParam(defaultValue = "next") String direction
    ) {
        return service.listCreatedBy(email, PageParams.of(cursor, size, direction));
    }

    @GetMapping("/users/{email}/events/organized")
    public Mono<PageResult<EventItemResponse>> listOrganized(
            @PathVariable @NotBlank String email,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer size,
            @RequestParam(defaultValue = "next") String direction
    ) {
        return service.listOrganizedBy(email, PageParams.of(cursor, size, direction));
    }

    @GetMapping("/users/{email}/events/moderated")
    public Mono<PageResult<EventItemResponse>> listModerated(
            @PathVariable @NotBlank String email,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer size,
            @RequestParam(defaultValue = "next") String direction
    ) {
        return service.listModeratedBy(email, PageParams.of(cursor, size, direction));
    }

    @GetMapping("/users/{email}/events/rsvped")
    public Mono<PageResult<EventItemResponse>> listRsvped(
            @PathVariable @NotBlank String email,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer size,
            @RequestParam(defaultValue = "next") String direction
    ) {
        return service.listRsvpedBy(email, PageParams.of(cursor, size, direction));
    }
}
