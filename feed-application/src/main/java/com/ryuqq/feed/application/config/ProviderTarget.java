package com.ryuqq.feed.application.config;

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 외부 제공자 접속 정보.
 *
 * <p>Endpoint 의 path 는 {@code baseUri} 뒤에 이어 붙고, {@code defaultParams} 는 모든 요청의
 * query string 에 추가됩니다 (API key 등). 요청 파라미터와 이름이 겹치면 요청 파라미터가 우선합니다.</p>
 *
 * @param baseUri 기본 URI
 * @param defaultParams 모든 요청에 추가할 query 파라미터
 * @param headers 모든 요청에 추가할 헤더
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProviderTarget(URI baseUri, Map<String, String> defaultParams, Map<String, String> headers) {

    public ProviderTarget {
        if (baseUri == null) {
            throw new IllegalArgumentException("baseUri cannot be null");
        }
        if (!baseUri.isAbsolute()) {
            throw new IllegalArgumentException("baseUri must be absolute (current: " + baseUri + ")");
        }
        defaultParams = defaultParams == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(defaultParams));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(headers));
    }

    public static ProviderTarget of(String baseUri) {
        return new ProviderTarget(URI.create(baseUri), Map.of(), Map.of());
    }
}
