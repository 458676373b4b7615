package com.socialevents.eventhub.application.user.service;

import com.socialevents.eventhub.application.common.pagination.CursorPaginator;
import com.socialevents.eventhub.application.common.pagination.PageParams;
import com.socialevents.eventhub.application.common.pagination.PageQuery;
import com.socialevents.eventhub.application.common.pagination.PageResult;
import com.socialevents.eventhub.application.common.pagination.filter.FilterPredicate;
import com.socialevents.eventhub.application.common.pagination.scan.SortSpec;
import com.socialevents.eventhub.application.user.dto.request.UserFilters;
import com.socialevents.eventhub.application.user.dto.response.UserItemResponse;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * 사용자 디렉터리 조회 서비스 구현체. (name, _id) 오름차순.
 */
@Service
public class UserDirectoryServiceImpl implements UserDirectoryService {

    static final String COLLECTION = "users";
    static final SortSpec SORT = SortSpec.byField("name");

    private final CursorPaginator paginator;

    public UserDirectoryServiceImpl(CursorPaginator paginator) {
        this.paginator = paginator;
    }

    @Override
    public Mono<PageResult<UserItemResponse>> listUsers(UserFilters filters, PageParams page) {
        PageQuery query = PageQuery.of(COLLECTION, predicates(filters), SORT,
                page.cursor(), page.size(), page.direction());
        return paginator.paginate(query).map(result -> result.map(UserItemResponse::from));
    }

    private static List<FilterPredicate> predicates(UserFilters f) {
        List<FilterPredicate> list = new ArrayList<>();
        if (f == null) return list;
        if (hasText(f.interest())) list.add(FilterPredicate.arrayContains("interests", f.interest()));
        if (hasText(f.role())) list.add(FilterPredicate.eq("role", f.role()));
        if (hasText(f.profession())) list.add(FilterPredicate.eq("profession", f.profession()));
        return list;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
