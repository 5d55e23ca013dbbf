/**
 * HTTP access to third-party data providers.
 *
 * <p>{@link com.ryuqq.feed.adapter.http.HttpUpstreamFetcher} is the live tier behind the orchestrator.
 * It makes one call per fetch and reports failures as
 * {@link com.ryuqq.feed.core.exception.UpstreamException}.</p>
 */
package com.ryuqq.feed.adapter.http;
