package com.ryuqq.feed.core.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * 캐시 및 중복 제거(dedup)에 사용되는 불투명 키.
 *
 * <p>엔드포인트와 정규화된 파라미터로부터 파생됩니다. 파라미터는 이름 순으로 정렬되므로
 * 입력 순서와 무관하게 동일한 파라미터 집합은 항상 동일한 키를 생성합니다.</p>
 *
 * <p><strong>형식:</strong> {@code endpoint?a=1&b=2} (파라미터가 없으면 {@code endpoint})</p>
 *
 * <p>파라미터 이름과 값은 UTF-8 로 퍼센트 인코딩되므로, 값에 {@code &} 나 {@code =} 가 포함되어도
 * 서로 다른 파라미터 집합이 같은 키를 만들지 않습니다.</p>
 *
 * <p>진행 중인 요청 테이블의 dedupe key 로도 그대로 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CacheKey {

    private final String value;

    private CacheKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CacheKey cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * 엔드포인트와 파라미터로부터 CacheKey 파생.
     *
     * @param endpoint 엔드포인트
     * @param params 요청 파라미터 (null 이면 빈 파라미터로 간주)
     * @return 정규화된 CacheKey
     * @throws IllegalArgumentException endpoint 가 null 이거나 파라미터 이름/값이 null 인 경우
     */
    public static CacheKey of(Endpoint endpoint, Map<String, String> params) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (params == null || params.isEmpty()) {
            return new CacheKey(endpoint.getValue());
        }

        StringJoiner query = new StringJoiner("&", endpoint.getValue() + "?", "");
        for (Map.Entry<String, String> param : sorted(params).entrySet()) {
            query.add(encode(param.getKey()) + "=" + encode(param.getValue()));
        }
        return new CacheKey(query.toString());
    }

    /**
     * 이미 정규화된 문자열로부터 CacheKey 복원 (저장소 역직렬화용).
     *
     * @param value 키 문자열
     * @return CacheKey
     */
    public static CacheKey of(String value) {
        return new CacheKey(value);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static TreeMap<String, String> sorted(Map<String, String> params) {
        TreeMap<String, String> sorted = new TreeMap<>();
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (param.getKey() == null || param.getValue() == null) {
                throw new IllegalArgumentException("params cannot contain null names or values");
            }
            sorted.put(param.getKey(), param.getValue());
        }
        return sorted;
    }

    /**
     * 키 문자열 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheKey cacheKey = (CacheKey) o;
        return value.equals(cacheKey.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CacheKey{" + value + '}';
    }
}
