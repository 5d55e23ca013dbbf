package com.ryuqq.feed.core.exception;

/**
 * 저장된 캐시 레코드를 해석할 수 없음.
 *
 * <p>계층 내부에서 발생하며, 캐시 저장소는 이를 로그로 남기고 해당 계층을 miss 로 취급합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CacheCorruptException extends RuntimeException {

    private final String location;

    public CacheCorruptException(String location, Throwable cause) {
        super("Corrupt cache record: " + location, cause);
        this.location = location;
    }

    /**
     * 손상된 레코드 위치 (파일 경로 등).
     *
     * @return 위치
     */
    public String getLocation() {
        return location;
    }
}
