package com.socialevents.eventhub.application.user.controller;

import com.socialevents.eventhub.application.common.pagination.PageParams;
import com.socialevents.eventhub.application.common.pagination.PageResult;
import com.socialevents.eventhub.application.user.dto.request.UserFilters;
import com.socialevents.eventhub.application.user.dto.response.UserItemResponse;
import com.socialevents.eventhub.application.user.service.UserDirectoryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 사용자 디렉터리 REST 컨트롤러.
 */
@RestController
@RequestMapping("/api/users")
public class UserDirectoryController {
    private final UserDirectoryService service;

    public UserDirectoryController(UserDirectoryService service) {
        this.service = service;
    }

    /**
     * 사용자 목록을 이름순으로 조회한다.
     *
     * @param interest   관심사 필터
     * @param role       역할 필터
     * @param profession 직업 필터
     * @param cursor    커서
     * @param size      페이지 크기(없으면 설정 기본값)
     * @param direction next | prev
     * @return 사용자 페이지
     */
    @GetMapping
    public Mono<PageResult<UserItemResponse>> listUsers(
            @RequestParam(required = false) String interest,
            @RequestParam(required = false) String role,
            @RequestParam(required = false) String profession,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer size,
            @RequestParam(defaultValue = "next") String direction
    ) {
        return service.listUsers(new UserFilters(interest, role, profession), PageParams.of(cursor, size, direction));
    }
}
