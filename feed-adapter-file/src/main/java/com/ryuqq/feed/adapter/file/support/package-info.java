/**
 * File helpers shared by the snapshot and history stores.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.feed.adapter.file.support;
