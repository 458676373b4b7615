package com.socialevents.eventhub.application.event.service;

import com.socialevents.eventhub.application.common.pagination.CursorPaginator;
import com.socialevents.eventhub.application.common.pagination.PageParams;
import com.socialevents.eventhub.application.common.pagination.PageQuery;
import com.socialevents.eventhub.application.common.pagination.PageResult;
import com.socialevents.eventhub.application.common.pagination.filter.FilterPredicate;
import com.socialevents.eventhub.application.common.pagination.scan.SortSpec;
import com.socialevents.eventhub.application.event.dto.request.EventFilters;
import com.socialevents.eventhub.application.event.dto.response.EventItemResponse;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * 이벤트 목록 조회 서비스 구현체.
 *
 * <p>각 목록은 필터 조건만 다르며, 페이징은 모두 {@link CursorPaginator}에 위임한다.
 * 정렬은 (startTime, _id) 오름차순이다.</p>
 */
@Service
public class EventListServiceImpl implements EventListService {

    static final String COLLECTION = "events";
    static final SortSpec SORT = SortSpec.byField("startTime");

    private final CursorPaginator paginator;

    public EventListServiceImpl(CursorPaginator paginator) {
        this.paginator = paginator;
    }

    @Override
    public Mono<PageResult<EventItemResponse>> listEvents(EventFilters filters, PageParams page) {
        List<FilterPredicate> predicates = new ArrayList<>();
        predicates.add(notArchived());

        EventFilters f = (filters == null) ? EventFilters.none() : filters;
        if (hasText(f.city())) predicates.add(FilterPredicate.eq("location.city", f.city()));
        if (hasText(f.state())) predicates.add(FilterPredicate.eq("location.state", f.state()));
        if (f.isOnline() != null) predicates.add(FilterPredicate.eq("isOnline", f.isOnline()));
        if (hasText(f.creatorEmail())) predicates.add(FilterPredicate.eq("createdByEmail", f.creatorEmail()));
        if (hasText(f.category())) predicates.add(FilterPredicate.arrayContains("categories", f.category()));
        if (hasText(f.startDate())) predicates.add(FilterPredicate.gte("startTime", f.startDate()));
        if (hasText(f.endDate())) predicates.add(FilterPredicate.lte("startTime", f.endDate()));

        return page(predicates, page);
    }

    @Override
    public Mono<PageResult<EventItemResponse>> listNearby(String city, String state, PageParams page) {
        return page(locationFilters(city, state), page);
    }

    @Override
    public Mono<PageResult<EventItemResponse>> listExternal(String city, String state, PageParams page) {
        List<FilterPredicate> predicates = locationFilters(city, state);
        predicates.add(FilterPredicate.eq("origin", "external"));
        return page(predicates, page);
    }

    @Override
    public Mono<PageResult<EventItemResponse>> listArchived(String creatorEmail, PageParams page) {
        List<FilterPredicate> predicates = new ArrayList<>();
        predicates.add(FilterPredicate.eq("isArchived", true));
        if (hasText(creatorEmail)) predicates.add(FilterPredicate.eq("createdByEmail", creatorEmail));
        return page(predicates, page);
    }

    @Override
    public Mono<PageResult<EventItemResponse>> listCreatedBy(String email, PageParams page) {
        return page(List.of(FilterPredicate.eq("createdByEmail", email), notArchived()), page);
    }

    @Override
    public Mono<PageResult<EventItemResponse>> listOrganizedBy(String email, PageParams page) {
        return page(List.of(FilterPredicate.arrayContains("organizers", email), notArchived()), page);
    }

    @Override
    public Mono<PageResult<EventItemResponse>> listModeratedBy(String email, PageParams page) {
        return page(List.of(FilterPredicate.arrayContains("moderators", email), notArchived()), page);
    }

    @Override
    public Mono<PageResult<EventItemResponse>> listRsvpedBy(String email, PageParams page) {
        return page(List.of(FilterPredicate.arrayContains("rsvpList", email), notArchived()), page);
    }

    private Mono<PageResult<EventItemResponse>> page(List<FilterPredicate> predicates, PageParams page) {
        PageQuery query = PageQuery.of(COLLECTION, predicates, SORT, page.cursor(), page.size(), page.direction());
        return paginator.paginate(query).map(result -> result.map(EventItemResponse::from));
    }

    private static List<FilterPredicate> locationFilters(String city, String state) {
        List<FilterPredicate> predicates = new ArrayList<>();
        predicates.add(notArchived());
        predicates.add(FilterPredicate.eq("location.city", city));
        if (hasText(state)) predicates.add(FilterPredicate.eq("location.state", state));
        return predicates;
    }

    private static FilterPredicate notArchived() {
        return FilterPredicate.eq("isArchived", false);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
