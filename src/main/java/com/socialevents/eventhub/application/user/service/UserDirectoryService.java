package com.socialevents.eventhub.application.user.service;

import com.socialevents.eventhub.application.common.pagination.PageParams;
import com.socialevents.eventhub.application.common.pagination.PageResult;
import com.socialevents.eventhub.application.user.dto.request.UserFilters;
import com.socialevents.eventhub.application.user.dto.response.UserItemResponse;
import reactor.core.publisher.Mono;

/**
 * 사용자 디렉터리 조회 서비스
 */
public interface UserDirectoryService {

    /**
     * 사용자를 이름순으로 조회한다.
     *
     * @param filters 관심사/역할/직업 필터
     * @param page    페이지 파라미터
     * @return 사용자 페이지
     */
    Mono<PageResult<UserItemResponse>> listUsers(UserFilters filters, PageParams page);
}
