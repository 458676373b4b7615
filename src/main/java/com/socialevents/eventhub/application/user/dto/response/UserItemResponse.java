package com.socialevents.eventhub.application.user.dto.response;

import com.socialevents.eventhub.application.common.pagination.scan.ScanRecord;

import java.util.List;
import java.util.Map;

/**
 * 사용자 디렉터리 아이템.
 *
 * @param userId    사용자 ID
 * @param name      이름(정렬 키)
 * @param email     이메일
 * @param bio       소개
 * @param interests 관심사
 */
public record UserItemResponse(
        String userId,
        String name,
        String email,
        String bio,
        List<String> interests
) {
    public static UserItemResponse from(ScanRecord record) {
        Map<String, Object> f = record.fields();
        Object interests = f.get("interests");
        return new UserItemResponse(
                record.tieBreakId(),
                record.sortKey(),
                (f.get("email") == null) ? null : String.valueOf(f.get("email")),
                (f.get("bio") == null) ? null : String.valueOf(f.get("bio")),
                (interests instanceof List<?> list) ? list.stream().map(String::valueOf).toList() : List.of()
        );
    }
}
