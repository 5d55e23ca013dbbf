/**
 * Core value objects of the feed orchestration layer.
 *
 * <p>This package defines the immutable types that flow between the cache tiers,
 * the protection components and the request orchestrator:</p>
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.feed.core.model.Endpoint} - Provider endpoint ({@code provider/path})</li>
 *   <li>{@link com.ryuqq.feed.core.model.CacheKey} - Endpoint plus sorted parameters, also the dedupe key</li>
 * </ul>
 *
 * <h2>Data</h2>
 * <ul>
 *   <li>{@link com.ryuqq.feed.core.model.Payload} - Opaque response bytes</li>
 *   <li>{@link com.ryuqq.feed.core.model.CacheEntry} - Stored response with its TTL</li>
 *   <li>{@link com.ryuqq.feed.core.model.HistoricalSnapshot} - One row of the append-only record</li>
 *   <li>{@link com.ryuqq.feed.core.model.UpstreamResponse} - Live response plus optional event time</li>
 *   <li>{@link com.ryuqq.feed.core.model.FetchResult} - What a caller of {@code fetch} receives</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.feed.core.model;
