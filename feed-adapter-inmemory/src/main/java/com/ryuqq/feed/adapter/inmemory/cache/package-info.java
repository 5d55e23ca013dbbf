/**
 * In-memory cache tier.
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Unbounded: one entry per key ever fetched</li>
 * </ul>
 *
 * @see com.ryuqq.feed.core.spi.CacheTierStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.adapter.inmemory.cache;
