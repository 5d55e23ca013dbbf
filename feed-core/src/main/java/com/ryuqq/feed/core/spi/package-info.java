/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that infrastructure adapters implement to plug
 * storage and upstream access into the orchestrator.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.feed.core.spi.CacheStore} - Tiered cache as seen by the orchestrator</li>
 *   <li>{@link com.ryuqq.feed.core.spi.CacheTierStore} - One tier (memory, file)</li>
 *   <li>{@link com.ryuqq.feed.core.spi.HistoryStore} - Append-only historical record</li>
 *   <li>{@link com.ryuqq.feed.core.spi.UpstreamFetcher} - Live provider call</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> In-memory tiers for tests, file tiers for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.feed.core.spi;
