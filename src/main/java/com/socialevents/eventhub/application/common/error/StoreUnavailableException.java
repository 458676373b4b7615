package com.socialevents.eventhub.application.common.error;

/**
 * 저장소 일시 장애 또는 스캔 타임아웃.
 *
 * <p>재시도 가능한 실패이며, 재시도 정책은 호출자가 정한다.</p>
 */
public class StoreUnavailableException extends RuntimeException {

    public static final String CODE = "STORE_UNAVAILABLE";

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean retryable() {
        return true;
    }

    public String code() {
        return CODE;
    }
}
