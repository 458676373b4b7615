package com.socialevents.eventhub.application.common.pagination;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 커서 페이징 설정({@code eventhub.pagination.*}).
 *
 * @param defaultPageSize     size 파라미터가 없을 때의 페이지 크기
 * @param maxPageSize         허용 최대 페이지 크기
 * @param overfetchMultiplier 범위 힌트가 근사치일 때 size에 곱하는 배수
 * @param overfetchCap        over-fetch 상한
 * @param scanTimeout         요청에 타임아웃이 없을 때 적용하는 스캔 타임아웃
 */
@ConfigurationProperties(prefix = "eventhub.pagination")
public record PaginationProperties(
        @DefaultValue("12") int defaultPageSize,
        @DefaultValue("100") int maxPageSize,
        @DefaultValue("3") int overfetchMultiplier,
        @DefaultValue("100") int overfetchCap,
        @DefaultValue("5s") Duration scanTimeout
) {
    public PaginationProperties {
        if (maxPageSize <= 0) throw new IllegalArgumentException("maxPageSize must be > 0");
        if (defaultPageSize <= 0 || defaultPageSize > maxPageSize) {
            throw new IllegalArgumentException("defaultPageSize must be between 1 and maxPageSize");
        }
        if (overfetchMultiplier < 1) throw new IllegalArgumentException("overfetchMultiplier must be >= 1");
        if (scanTimeout == null || scanTimeout.isNegative() || scanTimeout.isZero()) {
            throw new IllegalArgumentException("scanTimeout must be positive");
        }
    }

    /** 테스트/기본 구성용 */
    public static PaginationProperties defaults() {
        return new PaginationProperties(12, 100, 3, 100, Duration.ofSeconds(5));
    }
}
