package com.ryuqq.feed.core.model;

/**
 * 외부 데이터 제공자(provider)의 엔드포인트 식별자.
 *
 * <p>형식은 {@code provider/path} 이며, 첫 번째 경로 세그먼트가 provider 이름입니다.
 * Rate Limiter 버킷은 provider 단위로, Circuit Breaker 상태는 엔드포인트 단위로 관리됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>{@code odds_api/americanfootball_nfl/odds} → provider: {@code odds_api}</li>
 *   <li>{@code espn_api/scoreboard} → provider: {@code espn_api}</li>
 *   <li>{@code noaa_api} → provider: {@code noaa_api}, path: 빈 문자열</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>공백 문자 불가</li>
 *   <li>'/'로 시작 불가 (provider 세그먼트 필수)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Endpoint {

    private final String value;
    private final String provider;
    private final String path;

    private Endpoint(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Endpoint cannot be null or blank");
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Endpoint cannot contain whitespace: " + value);
        }
        if (value.startsWith("/")) {
            throw new IllegalArgumentException("Endpoint must start with a provider segment: " + value);
        }
        int slash = value.indexOf('/');
        this.value = value;
        this.provider = slash < 0 ? value : value.substring(0, slash);
        this.path = slash < 0 ? "" : value.substring(slash + 1);
    }

    /**
     * Endpoint 생성.
     *
     * @param value {@code provider/path} 형식의 엔드포인트 문자열
     * @return Endpoint 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Endpoint of(String value) {
        return new Endpoint(value);
    }

    /**
     * 전체 엔드포인트 문자열.
     *
     * @return 엔드포인트 값
     */
    public String getValue() {
        return value;
    }

    /**
     * Rate Limit 버킷을 결정하는 provider 이름.
     *
     * @return provider 이름 (첫 번째 경로 세그먼트)
     */
    public String provider() {
        return provider;
    }

    /**
     * provider 이후의 경로.
     *
     * @return 경로 (provider 만 있는 경우 빈 문자열)
     */
    public String path() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Endpoint endpoint = (Endpoint) o;
        return value.equals(endpoint.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
