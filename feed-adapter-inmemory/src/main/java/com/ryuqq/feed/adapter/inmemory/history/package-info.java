/**
 * In-memory historical record.
 *
 * @see com.ryuqq.feed.core.spi.HistoryStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.adapter.inmemory.history;
