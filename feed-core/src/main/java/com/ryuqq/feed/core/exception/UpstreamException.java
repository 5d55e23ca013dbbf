package com.ryuqq.feed.core.exception;

/**
 * 외부 제공자 호출 실패.
 *
 * <p>비정상 HTTP 상태 코드 또는 전송 계층 오류를 나타냅니다.
 * 오케스트레이터는 이 예외를 Circuit Breaker 실패로 기록하고 재시도합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UpstreamException extends Exception {

    /** 상태 코드가 없는 실패 (전송 오류 등). */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public UpstreamException(String message) {
        this(message, NO_STATUS, null);
    }

    public UpstreamException(String message, Throwable cause) {
        this(message, NO_STATUS, cause);
    }

    public UpstreamException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public UpstreamException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP 상태 코드.
     *
     * @return 상태 코드 (없으면 {@link #NO_STATUS})
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatusCode() {
        return statusCode != NO_STATUS;
    }
}
