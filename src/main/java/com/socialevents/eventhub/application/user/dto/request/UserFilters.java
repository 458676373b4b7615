package com.socialevents.eventhub.application.user.dto.request;

/**
 * 사용자 목록 선택 필터. null 또는 공백이면 적용하지 않는다.
 *
 * @param interest   관심사(interests 배열 포함)
 * @param role       역할 일치
 * @param profession 직업 일치
 */
public record UserFilters(
        String interest,
        String role,
        String profession
) {
    public static UserFilters none() {
        return new UserFilters(null, null, null);
    }
}
