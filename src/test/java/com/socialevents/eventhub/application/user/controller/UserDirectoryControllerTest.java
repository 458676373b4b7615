package com.socialevents.eventhub.application.user.controller;

import com.socialevents.eventhub.application.common.error.GlobalExceptionHandler;
import com.socialevents.eventhub.application.common.pagination.PageDirection;
import com.socialevents.eventhub.application.common.pagination.PageParams;
import com.socialevents.eventhub.application.common.pagination.PageResult;
import com.socialevents.eventhub.application.common.pagination.PaginationInfo;
import com.socialevents.eventhub.application.user.dto.request.UserFilters;
import com.socialevents.eventhub.application.user.dto.response.UserItemResponse;
import com.socialevents.eventhub.application.user.service.UserDirectoryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webflux.test.autoconfigure.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("user directory controller 테스트")
@WebFluxTest(controllers = UserDirectoryController.class)
@Import(GlobalExceptionHandler.class)
class UserDirectoryControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockitoBean
    UserDirectoryService service;

    @Test
    @DisplayName("관심사/역할/직업/커서/방향이 서비스로 전달되고 페이지가 반환되는지 검증")
    void ok_delegatesToService() {
        // given
        var page = new PageResult<>(
                List.of(new UserItemResponse("u1", "Ada", "ada@example.com", null, List.of("hiking"))),
                new PaginationInfo(null, "prev-token", false, true, 12));
        when(service.listUsers(any(), any())).thenReturn(Mono.just(page));

        // when / then
        webTestClient.get()
                .uri("/api/users?interest=hiking&role=admin&profession=engineer&cursor=abc&direction=prev")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.items[0].name").isEqualTo("Ada")
                .jsonPath("$.pagination.prev_cursor").isEqualTo("prev-token")
                .jsonPath("$.pagination.has_previous").isEqualTo(true);

        verify(service).listUsers(new UserFilters("hiking", "admin", "engineer"), new PageParams("abc", null, PageDirection.PREV));
        verifyNoMoreInteractions(service);
    }
}
