package com.ryuqq.feed.adapter.runner;

import com.ryuqq.feed.core.model.CacheEntry;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.FetchResult;
import com.ryuqq.feed.core.model.Priority;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 키 하나에 대한 진행 중인 조회 요청.
 *
 * <p>같은 키를 요청한 모든 호출자는 하나의 PendingRequest 를 공유하고,
 * {@link #future()} 완료 시 같은 결과를 받습니다.</p>
 *
 * <p>{@code fallback} 은 등록 시점에 캐시에 있던 항목으로, 갱신이 실패했을 때 stale 응답으로 사용됩니다.
 * 키당 진행 중 요청은 하나이므로 등록 이후 이 키의 캐시를 바꾸는 것은 이 요청뿐입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class PendingRequest {

    private final CacheKey key;
    private final Endpoint endpoint;
    private final Map<String, String> params;
    private final Priority priority;
    private final Instant enqueuedAt;
    private final CacheEntry fallback;
    private final CompletableFuture<FetchResult> future = new CompletableFuture<>();
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger callers = new AtomicInteger(1);

    PendingRequest(
        CacheKey key,
        Endpoint endpoint,
        Map<String, String> params,
        Priority priority,
        Instant enqueuedAt,
        CacheEntry fallback
    ) {
        this.key = key;
        this.endpoint = endpoint;
        this.params = params == null ? Map.of() : Map.copyOf(params);
        this.priority = priority;
        this.enqueuedAt = enqueuedAt;
        this.fallback = fallback;
    }

    CacheKey key() {
        return key;
    }

    Endpoint endpoint() {
        return endpoint;
    }

    Map<String, String> params() {
        return params;
    }

    Priority priority() {
        return priority;
    }

    Instant enqueuedAt() {
        return enqueuedAt;
    }

    Optional<CacheEntry> fallback() {
        return Optional.ofNullable(fallback);
    }

    CompletableFuture<FetchResult> future() {
        return future;
    }

    int attempts() {
        return attempts.get();
    }

    int recordAttempt() {
        return attempts.incrementAndGet();
    }

    int attach() {
        return callers.incrementAndGet();
    }

    int callers() {
        return callers.get();
    }

    @Override
    public String toString() {
        return "PendingRequest{key=" + key.getValue() + ", priority=" + priority
            + ", attempts=" + attempts.get() + ", callers=" + callers.get() + '}';
    }
}
