package com.ryuqq.feed.core.exception;

import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.Degradation;

/**
 * 반환할 데이터가 전혀 없음.
 *
 * <p>키에 대한 캐시/이력이 한 번도 없고 실시간 호출도 성공하지 못했을 때만 발생합니다.
 * 호출자에게 노출되는 유일한 실패입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NoDataAvailableException extends RuntimeException {

    private final CacheKey key;
    private final Degradation reason;

    public NoDataAvailableException(CacheKey key, Degradation reason) {
        super("No data available for " + key.getValue() + " (reason: " + reason + ")");
        this.key = key;
        this.reason = reason;
    }

    public CacheKey getKey() {
        return key;
    }

    /**
     * 실시간 호출을 하지 못했거나 실패한 사유.
     *
     * @return 사유
     */
    public Degradation getReason() {
        return reason;
    }
}
