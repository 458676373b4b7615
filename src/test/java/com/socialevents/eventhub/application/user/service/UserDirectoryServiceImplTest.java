package com.socialevents.eventhub.application.user.service;

import com.socialevents.eventhub.application.common.pagination.CursorPaginator;
import com.socialevents.eventhub.application.common.pagination.PageDirection;
import com.socialevents.eventhub.application.common.pagination.PageParams;
import com.socialevents.eventhub.application.common.pagination.PageQuery;
import com.socialevents.eventhub.application.common.pagination.PageResult;
import com.socialevents.eventhub.application.common.pagination.PaginationInfo;
import com.socialevents.eventhub.application.common.pagination.filter.FilterPredicate;
import com.socialevents.eventhub.application.common.pagination.scan.ScanRecord;
import com.socialevents.eventhub.application.user.dto.request.UserFilters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("user directory service 테스트")
class UserDirectoryServiceImplTest {

    private CursorPaginator paginator;
    private UserDirectoryServiceImpl service;

    @BeforeEach
    void setUp() {
        this.paginator = mock(CursorPaginator.class);
        this.service = new UserDirectoryServiceImpl(paginator);
    }

    @Test
    @DisplayName("관심사 필터와 이름 정렬로 조회하고 사용자 아이템으로 변환하는지 검증")
    void listUsers_byInterest() {
        // given
        var record = new ScanRecord("u1", "Ada", Map.of(
                "email", "ada@example.com",
                "interests", List.of("hiking")));
        when(paginator.paginate(any())).thenReturn(Mono.just(new PageResult<>(
                List.of(record), new PaginationInfo(null, null, false, false, 10))));

        // when
        StepVerifier.create(service.listUsers(new UserFilters("hiking", null, " "), new PageParams(null, 10, PageDirection.NEXT)))
                .assertNext(page -> {
                    var item = page.items().get(0);
                    assertThat(item.userId()).isEqualTo("u1");
                    assertThat(item.name()).isEqualTo("Ada");
                    assertThat(item.email()).isEqualTo("ada@example.com");
                    assertThat(item.bio()).isNull();
                    assertThat(item.interests()).containsExactly("hiking");
                })
                .verifyComplete();

        // then
        ArgumentCaptor<PageQuery> captor = ArgumentCaptor.forClass(PageQuery.class);
        verify(paginator).paginate(captor.capture());
        assertThat(captor.getValue().collection()).isEqualTo("users");
        assertThat(captor.getValue().sort().sortField()).isEqualTo("name");
        assertThat(captor.getValue().filters()).containsExactly(FilterPredicate.arrayContains("interests", "hiking"));
    }

    @Test
    @DisplayName("관심사가 없으면 필터 없이 조회하는지 검증")
    void listUsers_withoutInterest() {
        when(paginator.paginate(any())).thenReturn(Mono.just(new PageResult<>(
                List.of(), new PaginationInfo(null, null, false, false, 12))));

        service.listUsers(UserFilters.none(), new PageParams(null, null, PageDirection.NEXT)).block();

        ArgumentCaptor<PageQuery> captor = ArgumentCaptor.forClass(PageQuery.class);
        verify(paginator).paginate(captor.capture());
        assertThat(captor.getValue().filters()).isEmpty();
        assertThat(captor.getValue().pageSize()).isNull();
    }

    @Test
    @DisplayName("역할/직업 필터가 일치 조건으로 전달되는지 검증")
    void listUsers_byRoleAndProfession() {
        // given
        when(paginator.paginate(any())).thenReturn(Mono.just(new PageResult<>(
                List.of(), new PaginationInfo(null, null, false, false, 12))));

        // when
        service.listUsers(new UserFilters(null, "admin", "engineer"),
                new PageParams(null, null, PageDirection.NEXT)).block();

        // then
        ArgumentCaptor<PageQuery> captor = ArgumentCaptor.forClass(PageQuery.class);
        verify(paginator).paginate(captor.capture());
        assertThat(captor.getValue().filters()).containsExactly(
                FilterPredicate.eq("role", "admin"),
                FilterPredicate.eq("profession", "engineer"));
    }
}
