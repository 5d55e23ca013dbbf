package com.ryuqq.feed.adapter.file.history;

import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.HistoricalSnapshot;
import com.ryuqq.feed.core.model.Payload;

import java.time.Instant;

/**
 * One JSON Lines row of the historical record.
 *
 * @param fetchTimestamp fetch instant
 * @param key cache key
 * @param providerEndpoint source endpoint
 * @param payload response body (base64 in JSON)
 * @param eventTime related event time, may be null
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HistoryRecord(
    Instant fetchTimestamp,
    String key,
    String providerEndpoint,
    byte[] payload,
    Instant eventTime
) {

    static HistoryRecord from(HistoricalSnapshot snapshot) {
        return new HistoryRecord(
            snapshot.fetchTimestamp(),
            snapshot.key().getValue(),
            snapshot.providerEndpoint().getValue(),
            snapshot.payload().toByteArray(),
            snapshot.eventTime()
        );
    }

    HistoricalSnapshot toSnapshot() {
        return new HistoricalSnapshot(
            fetchTimestamp,
            CacheKey.of(key),
            Endpoint.of(providerEndpoint),
            Payload.of(payload),
            eventTime
        );
    }
}
