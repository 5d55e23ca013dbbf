package com.ryuqq.feed.testkit.contract;

import com.ryuqq.feed.core.exception.UpstreamException;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.Payload;
import com.ryuqq.feed.core.model.UpstreamResponse;
import com.ryuqq.feed.core.spi.UpstreamFetcher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Upstream fake driven by a per-endpoint script.
 *
 * <p>Each call first consumes the next one-shot step queued for its endpoint and otherwise falls
 * back to the endpoint's standing behaviour. Calls are recorded in arrival order before any step
 * runs, so tests can assert both how many network calls happened and in which order the workers
 * issued them.</p>
 *
 * <p><strong>Gate:</strong> {@link #hold()} makes every subsequent call block until
 * {@link #release()}, which lets a test pile requests up behind a busy worker.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedUpstreamFetcher implements UpstreamFetcher {

    /**
     * One scripted reaction to an upstream call.
     */
    @FunctionalInterface
    public interface Step {
        UpstreamResponse run(Endpoint endpoint, Map<String, String> params) throws UpstreamException;
    }

    /**
     * A recorded upstream call.
     *
     * @param endpoint called endpoint
     * @param params query parameters
     */
    public record Call(Endpoint endpoint, Map<String, String> params) {
    }

    private final Map<Endpoint, Deque<Step>> queued = new HashMap<>();
    private final Map<Endpoint, Step> standing = new HashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch gate;

    /**
     * Answers every call to the endpoint with the given body and no event time.
     */
    public ScriptedUpstreamFetcher respond(String endpoint, String body) {
        return respond(endpoint, body, null);
    }

    /**
     * Answers every call to the endpoint with the given body and event time.
     */
    public ScriptedUpstreamFetcher respond(String endpoint, String body, Instant eventTime) {
        return always(endpoint, (e, p) -> UpstreamResponse.of(Payload.ofUtf8(body), eventTime));
    }

    /**
     * Fails every call to the endpoint with the given HTTP status.
     */
    public ScriptedUpstreamFetcher failWith(String endpoint, int status) {
        return always(endpoint, (e, p) -> {
            throw new UpstreamException("Scripted failure for " + e, status);
        });
    }

    /**
     * Fails the next {@code times} calls to the endpoint before its standing behaviour applies.
     */
    public ScriptedUpstreamFetcher failNext(String endpoint, int times, int status) {
        if (times <= 0) {
            throw new IllegalArgumentException("times must be positive (current: " + times + ")");
        }
        for (int i = 0; i < times; i++) {
            then(endpoint, (e, p) -> {
                throw new UpstreamException("Scripted failure for " + e, status);
            });
        }
        return this;
    }

    /**
     * Replaces the standing behaviour of an endpoint.
     */
    public synchronized ScriptedUpstreamFetcher always(String endpoint, Step step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        standing.put(Endpoint.of(endpoint), step);
        return this;
    }

    /**
     * Queues a one-shot step for the endpoint.
     */
    public synchronized ScriptedUpstreamFetcher then(String endpoint, Step step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        queued.computeIfAbsent(Endpoint.of(endpoint), k -> new ArrayDeque<>()).add(step);
        return this;
    }

    /**
     * Blocks every call issued from now on until {@link #release()}.
     */
    public void hold() {
        gate = new CountDownLatch(1);
    }

    /**
     * Lets held and future calls through.
     */
    public void release() {
        CountDownLatch current = gate;
        gate = null;
        if (current != null) {
            current.countDown();
        }
    }

    @Override
    public UpstreamResponse fetch(Endpoint endpoint, Map<String, String> params)
        throws UpstreamException, InterruptedException {
        calls.add(new Call(endpoint, params == null ? Map.of() : Map.copyOf(params)));
        CountDownLatch current = gate;
        if (current != null) {
            current.await();
        }
        return nextStep(endpoint).run(endpoint, params);
    }

    private synchronized Step nextStep(Endpoint endpoint) {
        Deque<Step> steps = queued.get(endpoint);
        if (steps != null && !steps.isEmpty()) {
            return steps.poll();
        }
        Step step = standing.get(endpoint);
        if (step == null) {
            return (e, p) -> {
                throw new UpstreamException("No scripted response for " + e, 404);
            };
        }
        return step;
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public int callCount() {
        return calls.size();
    }

    public long callCount(String endpoint) {
        Endpoint target = Endpoint.of(endpoint);
        return calls.stream().filter(call -> call.endpoint().equals(target)).count();
    }

    /**
     * Waits until at least {@code expected} calls were recorded.
     *
     * @return true if the count was reached before the timeout
     */
    public boolean awaitCalls(int expected, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (calls.size() < expected) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            TimeUnit.MILLISECONDS.sleep(5);
        }
        return true;
    }
}
