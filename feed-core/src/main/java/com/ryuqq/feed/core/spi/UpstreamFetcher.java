package com.ryuqq.feed.core.spi;

import com.ryuqq.feed.core.exception.UpstreamException;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.UpstreamResponse;

import java.util.Map;

/**
 * Pluggable upstream call SPI.
 *
 * <p>The orchestrator never talks to a provider directly; it calls an implementation of this
 * interface from a worker thread, under a per-call timeout. Implementations should be
 * interruptible so a timed-out call can be cancelled.</p>
 *
 * <p><strong>Implementations:</strong></p>
 * <ul>
 *   <li>{@code HttpUpstreamFetcher} (feed-adapter-http) - production HTTP client</li>
 *   <li>{@code ScriptedUpstreamFetcher} (feed-testkit) - scripted responses for tests</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UpstreamFetcher {

    /**
     * Performs one live call.
     *
     * @param endpoint the provider endpoint
     * @param params request parameters (never null)
     * @return the response body and, when known, its event time
     * @throws UpstreamException if the provider returned an error or the transport failed
     * @throws InterruptedException if the call was cancelled
     */
    UpstreamResponse fetch(Endpoint endpoint, Map<String, String> params)
        throws UpstreamException, InterruptedException;
}
