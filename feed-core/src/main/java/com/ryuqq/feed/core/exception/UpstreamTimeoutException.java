package com.ryuqq.feed.core.exception;

import java.time.Duration;

/**
 * 외부 제공자 호출 타임아웃.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UpstreamTimeoutException extends UpstreamException {

    private final Duration timeout;

    public UpstreamTimeoutException(String message, Duration timeout) {
        super(message);
        this.timeout = timeout;
    }

    public UpstreamTimeoutException(String message, Duration timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
