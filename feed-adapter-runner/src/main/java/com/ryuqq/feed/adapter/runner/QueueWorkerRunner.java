package com.ryuqq.feed.adapter.runner;

import com.ryuqq.feed.application.orchestrator.OrchestratorStats;
import com.ryuqq.feed.application.orchestrator.ProviderCallStats;
import com.ryuqq.feed.application.orchestrator.RequestOrchestrator;
import com.ryuqq.feed.application.runtime.Runtime;
import com.ryuqq.feed.core.exception.NoDataAvailableException;
import com.ryuqq.feed.core.exception.UpstreamException;
import com.ryuqq.feed.core.exception.UpstreamTimeoutException;
import com.ryuqq.feed.core.model.CacheEntry;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.Degradation;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.FetchResult;
import com.ryuqq.feed.core.model.Priority;
import com.ryuqq.feed.core.model.UpstreamResponse;
import com.ryuqq.feed.core.protection.CircuitBreaker;
import com.ryuqq.feed.core.protection.RateLimiter;
import com.ryuqq.feed.core.spi.CacheStore;
import com.ryuqq.feed.core.spi.UpstreamFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Queue Worker 기반 {@link RequestOrchestrator} 구현체.
 *
 * <p>진행 중 요청 테이블, 우선순위 작업 큐, 고정 크기 워커 풀로 외부 호출을 조정합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>캐시 조회 및 freshness 판단 (TTL + 호출자 maxAge)</li>
 *   <li>키 단위 중복 제거: 키당 진행 중 요청은 최대 1개</li>
 *   <li>등록 전 예산 확인(비차감)과 Circuit Breaker 확인</li>
 *   <li>워커에서 예산 차감, 제한 시간 내 외부 호출, 캐시 기록, Breaker 기록</li>
 *   <li>실패 시 지수 백오프 재시도, 소진 시 stale 응답</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * fetch(endpoint, params, priority, maxAge)
 *   ↓
 * cache.get(key) → fresh 이고 age ≤ maxAge → 즉시 반환
 *   ↓
 * pending.compute(key):
 *   - 진행 중 요청 있음 → 합류 (dedup)
 *   - 조회 이후 다른 요청이 완료됨 → 캐시 재조회, fresh 면 즉시 반환
 *   - limiter.check(provider, 1) 실패 → stale (RATE_LIMITED)
 *   - LOW 우선순위 + 예산 CRITICAL 이하 + 캐시 있음 → stale (RATE_LIMITED)
 *   - breaker.allow(endpoint) 실패 → stale (BREAKER_OPEN)
 *   - 통과 → PendingRequest 생성 후 큐 등록
 *   ↓
 * 워커:
 *   1. (재시도인 경우) breaker.allow 재확인
 *   2. limiter.consume(provider, 1)
 *   3. fetcher.fetch → upstreamTimeout 제한
 *   4. 성공 → cache.put → breaker.recordSuccess → LIVE 결과
 *      실패 → breaker.recordFailure → 백오프 후 재등록 or stale (UPSTREAM_FAILED)
 *   5. pending 에서 제거 → 모든 대기자에게 결과 전달
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>진행 중 요청 등록은 {@link ConcurrentHashMap#compute} 로 키 단위 원자성 보장</li>
 *   <li>완료된 요청은 캐시 기록 후 완료 세대를 올리고 나서 테이블에서 제거되므로, 캐시 조회와 등록 사이에
 *       완료된 요청의 결과를 놓치지 않음</li>
 *   <li>재시도 대기는 스케줄러가 담당하며 워커를 점유하지 않음</li>
 *   <li>외부 호출은 별도 Executor 에서 실행되어 제한 시간 초과 시 취소됨</li>
 *   <li>외부 호출 중에는 어떤 lock 도 잡지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QueueWorkerRunner implements RequestOrchestrator, Runtime {

    private static final Logger log = LoggerFactory.getLogger(QueueWorkerRunner.class);

    private static final long POLL_INTERVAL_MS = 100;
    private static final long SHUTDOWN_WAIT_SECONDS = 60;

    private final CacheStore cache;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final UpstreamFetcher fetcher;
    private final QueueWorkerConfig config;
    private final BackoffCalculator backoffCalculator;

    private final ConcurrentMap<CacheKey, PendingRequest> pending = new ConcurrentHashMap<>();
    private final PriorityBlockingQueue<QueueTicket> queue = new PriorityBlockingQueue<>();
    private final AtomicLong sequence = new AtomicLong();

    private final LongAdder requests = new LongAdder();
    private final LongAdder dedupAttaches = new LongAdder();
    private final LongAdder upstreamCalls = new LongAdder();
    private final LongAdder degradedResponses = new LongAdder();
    private final ConcurrentMap<String, ProviderCallMetrics> providerMetrics = new ConcurrentHashMap<>();
    private final AtomicLong liveResolutions = new AtomicLong();

    private final Object lifecycleLock = new Object();
    private volatile boolean running;
    private volatile boolean terminated;
    private ExecutorService workerExecutor;
    private ExecutorService callExecutor;
    private ScheduledExecutorService retryScheduler;

    /**
     * 생성자 (설정값으로 BackoffCalculator 생성).
     *
     * @param cache 캐시 저장소
     * @param rateLimiter Rate Limiter
     * @param circuitBreaker Circuit Breaker
     * @param fetcher 외부 호출
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueWorkerRunner(
        CacheStore cache,
        RateLimiter rateLimiter,
        CircuitBreaker circuitBreaker,
        UpstreamFetcher fetcher,
        QueueWorkerConfig config
    ) {
        this(cache, rateLimiter, circuitBreaker, fetcher, config,
            config == null ? null : config.newBackoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param cache 캐시 저장소
     * @param rateLimiter Rate Limiter
     * @param circuitBreaker Circuit Breaker
     * @param fetcher 외부 호출
     * @param config 설정
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueWorkerRunner(
        CacheStore cache,
        RateLimiter rateLimiter,
        CircuitBreaker circuitBreaker,
        UpstreamFetcher fetcher,
        QueueWorkerConfig config,
        BackoffCalculator backoffCalculator
    ) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }

        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.fetcher = fetcher;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
    }

    // ------------------------------------------------------------------ lifecycle

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (terminated) {
                throw new IllegalStateException("QueueWorkerRunner cannot be restarted after shutdown");
            }
            if (running) {
                return;
            }
            workerExecutor = Executors.newFixedThreadPool(config.workerCount(), namedThreads("feed-worker"));
            callExecutor = Executors.newCachedThreadPool(namedThreads("feed-upstream"));
            retryScheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("feed-retry"));
            running = true;
            for (int i = 0; i < config.workerCount(); i++) {
                workerExecutor.submit(this::workerLoop);
            }
        }
        log.info("QueueWorkerRunner started with {} workers (maxAttempts={}, upstreamTimeout={})",
            config.workerCount(), config.maxAttempts(), config.upstreamTimeout());
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>새 요청 수락을 멈추고, 워커가 현재 호출을 마칠 때까지 최대 60초 대기한 뒤 인터럽트합니다.
     * 아직 처리되지 않은 요청은 stale 응답 또는 {@link NoDataAvailableException} 으로 종결합니다.</p>
     */
    @Override
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (terminated) {
                return;
            }
            terminated = true;
            if (!running) {
                return;
            }
            running = false;
        }

        retryScheduler.shutdownNow();
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Workers did not finish within {}s, interrupting", SHUTDOWN_WAIT_SECONDS);
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        callExecutor.shutdownNow();

        queue.clear();
        List<PendingRequest> unresolved = new ArrayList<>(pending.values());
        for (PendingRequest request : unresolved) {
            resolveWithFallback(request, Degradation.UPSTREAM_FAILED);
        }
        log.info("QueueWorkerRunner stopped ({} unresolved requests served from fallback)", unresolved.size());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ------------------------------------------------------------------ fetch

    @Override
    public FetchResult fetch(Endpoint endpoint, Map<String, String> params, Priority priority, Duration maxAge) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (maxAge != null && maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge cannot be negative (current: " + maxAge + ")");
        }
        if (!running) {
            throw new IllegalStateException("QueueWorkerRunner is not running");
        }
        requests.increment();

        CacheKey key = CacheKey.of(endpoint, params);
        long seenResolutions = liveResolutions.get();
        Optional<CacheEntry> cached = cache.get(key);
        Instant now = cache.now();
        if (cached.isPresent() && satisfies(cached.get(), now, maxAge)) {
            CacheEntry entry = cached.get();
            return FetchResult.fromCache(entry, entry.ageAt(now), false, Degradation.NONE);
        }

        Admission admission = admit(key, endpoint, params, priority, maxAge, cached.orElse(null), seenResolutions);
        if (admission.hit != null) {
            CacheEntry entry = admission.hit;
            return FetchResult.fromCache(entry, entry.ageAt(cache.now()), false, Degradation.NONE);
        }
        cached = Optional.ofNullable(admission.fallback);

        FetchResult result = admission.rejection != null
            ? fallback(key, cached, admission.rejection)
            : join(admission, cached);

        if (result.isDegraded()) {
            degradedResponses.increment();
            metricsFor(endpoint.provider()).recordFallback();
        }
        return result;
    }

    private FetchResult join(Admission admission, Optional<CacheEntry> cached) {
        if (admission.created) {
            enqueue(admission.request);
        } else {
            dedupAttaches.increment();
            log.debug("Attached to in-flight request key={} callers={}",
                admission.request.key().getValue(), admission.request.callers());
        }
        return await(admission.request, cached);
    }

    private static boolean satisfies(CacheEntry entry, Instant now, Duration maxAge) {
        if (entry.isStaleAt(now)) {
            return false;
        }
        return maxAge == null || entry.ageAt(now).compareTo(maxAge) <= 0;
    }

    /**
     * 키 단위 원자적 등록.
     *
     * <p>예산 확인을 Breaker 확인보다 먼저 수행하여, 예산 부족으로 버려질 요청이
     * HALF_OPEN 시험 호출 권한을 가져가지 않도록 합니다.</p>
     *
     * <p>호출자의 캐시 조회 이후 다른 요청이 LIVE 로 완료되었다면 캐시를 다시 읽습니다.
     * 그 요청이 이 키를 방금 기록했을 수 있으며, 그 경우 새 외부 호출 없이 응답합니다.</p>
     */
    private Admission admit(
        CacheKey key,
        Endpoint endpoint,
        Map<String, String> params,
        Priority priority,
        Duration maxAge,
        CacheEntry cached,
        long seenResolutions
    ) {
        Admission admission = new Admission();
        admission.fallback = cached;
        String provider = endpoint.provider();
        pending.compute(key, (k, existing) -> {
            if (existing != null) {
                existing.attach();
                admission.request = existing;
                return existing;
            }
            if (liveResolutions.get() != seenResolutions) {
                Optional<CacheEntry> latest = cache.get(k);
                if (latest.isPresent()) {
                    if (satisfies(latest.get(), cache.now(), maxAge)) {
                        log.debug("Key={} was refreshed by a request that just completed", k.getValue());
                        admission.hit = latest.get();
                        return null;
                    }
                    admission.fallback = latest.get();
                }
            }
            if (!rateLimiter.check(provider, 1)) {
                admission.rejection = Degradation.RATE_LIMITED;
                return null;
            }
            if (config.conserveBudgetForLowPriority() && priority == Priority.LOW && admission.fallback != null
                && rateLimiter.status(provider).isConserving()) {
                log.debug("Conserving {} budget, LOW priority refresh of key={} skipped", provider, k.getValue());
                admission.rejection = Degradation.RATE_LIMITED;
                return null;
            }
            if (!circuitBreaker.allow(endpoint)) {
                admission.rejection = Degradation.BREAKER_OPEN;
                return null;
            }
            admission.request = new PendingRequest(k, endpoint, params, priority, cache.now(), admission.fallback);
            admission.created = true;
            return admission.request;
        });
        return admission;
    }

    private FetchResult await(PendingRequest request, Optional<CacheEntry> cached) {
        try {
            return request.future().get(config.maxCallerWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Gave up waiting {} for key={}, serving fallback",
                config.maxCallerWait(), request.key().getValue());
            return fallback(request.key(), cached, Degradation.UPSTREAM_FAILED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback(request.key(), cached, Degradation.UPSTREAM_FAILED);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof NoDataAvailableException noData) {
                throw new NoDataAvailableException(noData.getKey(), noData.getReason());
            }
            log.error("Request for key={} completed exceptionally", request.key().getValue(), e.getCause());
            return fallback(request.key(), cached, Degradation.UPSTREAM_FAILED);
        }
    }

    private FetchResult fallback(CacheKey key, Optional<CacheEntry> cached, Degradation reason) {
        if (cached.isEmpty()) {
            log.warn("No data available for key={} ({})", key.getValue(), reason);
            throw new NoDataAvailableException(key, reason);
        }
        CacheEntry entry = cached.get();
        Duration age = entry.ageAt(cache.now());
        log.warn("Serving stale data for key={} from {} (age={}, reason={})",
            key.getValue(), entry.tier(), age, reason);
        return FetchResult.fromCache(entry, age, true, reason);
    }

    // ------------------------------------------------------------------ worker

    private void enqueue(PendingRequest request) {
        QueueTicket ticket = new QueueTicket(request, sequence.incrementAndGet());
        queue.offer(ticket);
        if (!running && queue.remove(ticket)) {
            resolveWithFallback(request, Degradation.UPSTREAM_FAILED);
        }
    }

    private void workerLoop() {
        while (running) {
            QueueTicket ticket;
            try {
                ticket = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (ticket == null) {
                continue;
            }
            try {
                process(ticket.request());
            } catch (RuntimeException e) {
                log.error("Unexpected failure processing {}", ticket.request(), e);
                resolveWithFallback(ticket.request(), Degradation.UPSTREAM_FAILED);
            }
        }
    }

    private void process(PendingRequest request) {
        Endpoint endpoint = request.endpoint();
        String provider = endpoint.provider();

        if (request.attempts() > 0 && !circuitBreaker.allow(endpoint)) {
            log.warn("Breaker for {} opened during retries of key={}", endpoint, request.key().getValue());
            resolveWithFallback(request, Degradation.BREAKER_OPEN);
            return;
        }
        if (!rateLimiter.consume(provider, 1)) {
            log.warn("Budget for {} exhausted before key={} could be fetched", provider, request.key().getValue());
            resolveWithFallback(request, Degradation.RATE_LIMITED);
            return;
        }

        upstreamCalls.increment();
        Future<UpstreamResponse> call;
        try {
            call = callExecutor.submit(() -> fetcher.fetch(endpoint, request.params()));
        } catch (RejectedExecutionException e) {
            log.warn("Upstream executor rejected key={}", request.key().getValue(), e);
            resolveWithFallback(request, Degradation.UPSTREAM_FAILED);
            return;
        }

        ProviderCallMetrics metrics = metricsFor(provider);
        long startedAt = System.nanoTime();
        UpstreamResponse response;
        try {
            response = call.get(config.upstreamTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            metrics.recordCall(System.nanoTime() - startedAt, false);
            onFailure(request, new UpstreamTimeoutException(
                "Upstream call for " + request.key().getValue() + " timed out", config.upstreamTimeout(), e));
            return;
        } catch (ExecutionException e) {
            metrics.recordCall(System.nanoTime() - startedAt, false);
            onFailure(request, e.getCause());
            return;
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            resolveWithFallback(request, Degradation.UPSTREAM_FAILED);
            return;
        }

        metrics.recordCall(System.nanoTime() - startedAt, response != null);
        if (response == null) {
            onFailure(request, new UpstreamException("Fetcher returned no response for " + endpoint));
            return;
        }

        cache.put(request.key(), endpoint, response.payload(), response.eventTime());
        circuitBreaker.recordSuccess(endpoint);
        log.debug("Fetched key={} live (attempt {}, callers={}, queued for {})",
            request.key().getValue(), request.attempts() + 1, request.callers(),
            Duration.between(request.enqueuedAt(), cache.now()));
        resolve(request, FetchResult.live(request.key(), response.payload()));
    }

    private void onFailure(PendingRequest request, Throwable cause) {
        Endpoint endpoint = request.endpoint();
        circuitBreaker.recordFailure(endpoint, cause);
        int attempts = request.recordAttempt();

        if (attempts < config.maxAttempts() && running && isRetryable(cause)) {
            Duration delay = backoffCalculator.calculate(attempts);
            log.warn("Upstream call for key={} failed (attempt {}/{}), retrying in {}ms: {}",
                request.key().getValue(), attempts, config.maxAttempts(), delay.toMillis(), cause.toString());
            try {
                retryScheduler.schedule(() -> enqueue(request), delay.toMillis(), TimeUnit.MILLISECONDS);
                metricsFor(endpoint.provider()).recordRetry();
                return;
            } catch (RejectedExecutionException e) {
                log.warn("Retry scheduler rejected key={}", request.key().getValue(), e);
            }
        } else {
            log.warn("Upstream call for key={} failed after {} attempt(s): {}",
                request.key().getValue(), attempts, cause.toString());
        }
        resolveWithFallback(request, Degradation.UPSTREAM_FAILED);
    }

    /**
     * 재시도해도 결과가 달라지지 않는 4xx 응답은 재시도하지 않습니다 (408, 429 제외).
     */
    static boolean isRetryable(Throwable cause) {
        if (cause instanceof UpstreamException upstream && upstream.hasStatusCode()) {
            int status = upstream.getStatusCode();
            return status < 400 || status >= 500 || status == 408 || status == 429;
        }
        return true;
    }

    private void resolve(PendingRequest request, FetchResult result) {
        liveResolutions.incrementAndGet();
        pending.remove(request.key(), request);
        request.future().complete(result);
    }

    private void resolveWithFallback(PendingRequest request, Degradation reason) {
        pending.remove(request.key(), request);
        try {
            request.future().complete(fallback(request.key(), request.fallback(), reason));
        } catch (NoDataAvailableException e) {
            request.future().completeExceptionally(e);
        }
    }

    // ------------------------------------------------------------------ stats

    @Override
    public OrchestratorStats stats() {
        return new OrchestratorStats(
            cache.stats(),
            rateLimiter.snapshot(),
            circuitBreaker.snapshot(),
            queue.size(),
            pending.size(),
            requests.sum(),
            dedupAttaches.sum(),
            upstreamCalls.sum(),
            degradedResponses.sum(),
            providerStats()
        );
    }

    private Map<String, ProviderCallStats> providerStats() {
        Map<String, ProviderCallStats> snapshot = new TreeMap<>();
        providerMetrics.forEach((provider, metrics) -> snapshot.put(provider, metrics.snapshot()));
        return snapshot;
    }

    private ProviderCallMetrics metricsFor(String provider) {
        return providerMetrics.computeIfAbsent(provider, p -> new ProviderCallMetrics());
    }

    public QueueWorkerConfig getConfig() {
        return config;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Admission {
        private PendingRequest request;
        private CacheEntry hit;
        private CacheEntry fallback;
        private Degradation rejection;
        private boolean created;
    }
}
