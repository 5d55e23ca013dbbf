package com.ryuqq.feed.adapter.file.history;

import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.HistoricalSnapshot;
import com.ryuqq.feed.core.model.Payload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JsonLinesHistoryStore 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("JsonLinesHistoryStore 테스트")
class JsonLinesHistoryStoreTest {

    private static final Endpoint ENDPOINT = Endpoint.of("odds_api/americanfootball_nfl/odds");
    private static final CacheKey SPREADS = CacheKey.of(ENDPOINT, Map.of("markets", "spreads"));
    private static final CacheKey TOTALS = CacheKey.of(ENDPOINT, Map.of("markets", "totals"));
    private static final Instant SATURDAY = Instant.parse("2025-09-06T22:00:00Z");
    private static final Instant SUNDAY = Instant.parse("2025-09-07T12:00:00Z");

    @TempDir
    Path directory;

    private JsonLinesHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new JsonLinesHistoryStore(directory);
    }

    private HistoricalSnapshot snapshot(CacheKey key, Instant at, String body) {
        return new HistoricalSnapshot(at, key, ENDPOINT, Payload.ofUtf8(body),
            Instant.parse("2025-09-07T17:00:00Z"));
    }

    @Test
    @DisplayName("fetch 날짜별 파일에 한 줄씩 추가된다")
    void 날짜별_파일_추가() throws IOException {
        // when
        store.append(snapshot(SPREADS, SATURDAY, "-2.5"));
        store.append(snapshot(SPREADS, SUNDAY, "-3.0"));
        store.append(snapshot(TOTALS, SUNDAY, "44.5"));

        // then
        assertThat(Files.readAllLines(directory.resolve("history-2025-09-06.jsonl"))).hasSize(1);
        assertThat(Files.readAllLines(directory.resolve("history-2025-09-07.jsonl"))).hasSize(2);
    }

    @Test
    @DisplayName("snapshots() 는 키와 시작 시각으로 걸러 시간순으로 반환한다")
    void snapshots_시간순() {
        // given
        store.append(snapshot(SPREADS, SUNDAY, "-3.0"));
        store.append(snapshot(SPREADS, SATURDAY, "-2.5"));
        store.append(snapshot(TOTALS, SUNDAY, "44.5"));
        store.append(snapshot(SPREADS, SUNDAY.plusSeconds(900), "-3.5"));

        // when
        List<HistoricalSnapshot> all = store.snapshots(SPREADS, SATURDAY);
        List<HistoricalSnapshot> sundayOnly = store.snapshots(SPREADS, SUNDAY);

        // then
        assertThat(all).extracting(s -> s.payload().asUtf8()).containsExactly("-2.5", "-3.0", "-3.5");
        assertThat(sundayOnly).extracting(s -> s.payload().asUtf8()).containsExactly("-3.0", "-3.5");
        assertThat(all.get(0).eventTime()).isEqualTo(Instant.parse("2025-09-07T17:00:00Z"));
    }

    @Test
    @DisplayName("latest() 는 가장 최근 스냅샷을 반환한다")
    void latest_최신() {
        // given
        store.append(snapshot(SPREADS, SATURDAY, "-2.5"));
        store.append(snapshot(SPREADS, SUNDAY, "-3.0"));

        // when & then
        assertThat(store.latest(SPREADS).map(s -> s.payload().asUtf8())).contains("-3.0");
        assertThat(store.latest(CacheKey.of(ENDPOINT, Map.of("markets", "h2h")))).isEmpty();
    }

    @Test
    @DisplayName("손상된 줄은 건너뛰고 나머지 이력을 반환한다")
    void 손상된_줄_건너뜀() throws IOException {
        // given
        store.append(snapshot(SPREADS, SUNDAY, "-3.0"));
        Files.writeString(directory.resolve("history-2025-09-07.jsonl"), "{\"key\":\"torn\n",
            StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        store.append(snapshot(SPREADS, SUNDAY.plusSeconds(60), "-3.5"));

        // when
        List<HistoricalSnapshot> snapshots = store.snapshots(SPREADS, SUNDAY);

        // then
        assertThat(snapshots).extracting(s -> s.payload().asUtf8()).containsExactly("-3.0", "-3.5");
    }

    @Test
    @DisplayName("재시작 후에도 이력이 유지된다")
    void 재시작_후_유지() {
        // given
        store.append(snapshot(SPREADS, SUNDAY, "-3.0"));

        // when
        JsonLinesHistoryStore restarted = new JsonLinesHistoryStore(directory);

        // then
        assertThat(restarted.latest(SPREADS)).isPresent();
    }
}
