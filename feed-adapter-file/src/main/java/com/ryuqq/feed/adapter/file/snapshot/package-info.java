/**
 * On-disk snapshot cache tier.
 *
 * <p>Survives process restarts: after a restart the memory tier is empty and
 * {@link com.ryuqq.feed.adapter.file.snapshot.FileSnapshotTier} answers until the memory tier
 * is repopulated by promotion.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.adapter.file.snapshot;
