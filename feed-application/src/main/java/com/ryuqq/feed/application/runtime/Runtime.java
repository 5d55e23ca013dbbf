package com.ryuqq.feed.application.runtime;

/**
 * Lifecycle of the request orchestration runtime.
 *
 * <p>This interface defines how the worker pool behind a
 * {@link com.ryuqq.feed.application.orchestrator.RequestOrchestrator} is started and stopped.</p>
 *
 * <p><strong>Runtime Flow:</strong></p>
 * <pre>
 * start()
 *   ↓
 * N workers loop:
 *   1. poll() the highest-priority PendingRequest (FIFO within a priority)
 *   2. re-check breaker on retries, consume one budget token
 *   3. call the upstream under a timeout
 *   4. success → cache put → breaker success → complete all attached callers
 *      failure → breaker failure → schedule retry with backoff, or stale fallback
 *   ↓
 * shutdown()
 *   1. stop accepting new fetches
 *   2. stop workers and the retry scheduler
 *   3. resolve still-queued requests through the fallback path
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>{@code fetch} before {@link #start()} throws {@link IllegalStateException}</li>
 *   <li>{@link #start()} and {@link #shutdown()} are idempotent</li>
 *   <li>A runtime is not restartable after {@link #shutdown()}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Starts the worker pool.
     *
     * @throws IllegalStateException if the runtime was already shut down
     */
    void start();

    /**
     * Stops the worker pool and resolves queued requests.
     *
     * <p>Waits up to 60 seconds for workers to finish their current call, then interrupts them.</p>
     */
    void shutdown();

    /**
     * Returns whether the runtime accepts fetches.
     *
     * @return true between {@link #start()} and {@link #shutdown()}
     */
    boolean isRunning();
}
