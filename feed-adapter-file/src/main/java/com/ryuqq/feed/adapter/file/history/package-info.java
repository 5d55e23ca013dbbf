/**
 * Append-only historical record on disk.
 *
 * <p>Used by external collaborators for line-movement and closing-line-value queries, and by the
 * tiered cache as the last-resort read tier.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.adapter.file.history;
