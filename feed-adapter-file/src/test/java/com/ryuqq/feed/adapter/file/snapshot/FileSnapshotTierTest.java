package com.ryuqq.feed.adapter.file.snapshot;

import com.ryuqq.feed.core.exception.CacheCorruptException;
import com.ryuqq.feed.core.model.CacheEntry;
import com.ryuqq.feed.core.model.CacheKey;
import com.ryuqq.feed.core.model.CacheTier;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.Payload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileSnapshotTier 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("FileSnapshotTier 테스트")
class FileSnapshotTierTest {

    private static final Endpoint ENDPOINT = Endpoint.of("odds_api/americanfootball_nfl/odds");
    private static final CacheKey KEY = CacheKey.of(ENDPOINT, Map.of("markets", "spreads", "regions", "us"));
    private static final Instant T0 = Instant.parse("2025-09-07T12:00:00.123Z");

    @TempDir
    Path directory;

    private FileSnapshotTier tier;

    @BeforeEach
    void setUp() {
        tier = new FileSnapshotTier(directory);
    }

    private CacheEntry entry(Instant fetchedAt, String body) {
        return new CacheEntry(KEY, ENDPOINT, Payload.ofUtf8(body), fetchedAt, Duration.ofMinutes(15),
            CacheTier.LIVE, Instant.parse("2025-09-07T17:00:00Z"));
    }

    private List<String> fileNames() throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Test
    @DisplayName("저장한 엔트리를 FILE 계층으로 다시 읽는다")
    void 저장_후_조회() {
        // given
        tier.write(entry(T0, "[{\"id\":\"g1\"}]"));

        // when
        CacheEntry read = tier.read(KEY).orElseThrow();

        // then
        assertThat(read.tier()).isEqualTo(CacheTier.FILE);
        assertThat(read.payload().asUtf8()).isEqualTo("[{\"id\":\"g1\"}]");
        assertThat(read.fetchedAt()).isEqualTo(T0);
        assertThat(read.ttl()).isEqualTo(Duration.ofMinutes(15));
        assertThat(read.eventTime()).isEqualTo(Instant.parse("2025-09-07T17:00:00Z"));
        assertThat(read.key()).isEqualTo(KEY);
        assertThat(read.endpoint()).isEqualTo(ENDPOINT);
    }

    @Test
    @DisplayName("쓰기마다 타임스탬프 파일이 생기고 latest 포인터는 최신 파일을 가리킨다")
    void 타임스탬프_파일과_latest_포인터() throws IOException {
        // when
        tier.write(entry(T0, "v1"));
        tier.write(entry(T0.plusSeconds(60), "v2"));

        // then
        List<String> names = fileNames();
        String base = "odds_api_americanfootball_nfl_odds_markets_spreads_regions_us";
        assertThat(names).containsExactly(
            base + ".latest",
            base + "__20250907T120000123Z.json",
            base + "__20250907T120100123Z.json"
        );
        assertThat(Files.readString(directory.resolve(base + ".latest")))
            .isEqualTo(base + "__20250907T120100123Z.json");
        assertThat(tier.read(KEY).map(e -> e.payload().asUtf8())).contains("v2");
    }

    @Test
    @DisplayName("재시작 후 새 인스턴스도 같은 데이터를 읽는다")
    void 재시작_후_조회() {
        // given
        tier.write(entry(T0, "persisted"));

        // when
        FileSnapshotTier restarted = new FileSnapshotTier(directory);

        // then
        assertThat(restarted.read(KEY).map(e -> e.payload().asUtf8())).contains("persisted");
    }

    @Test
    @DisplayName("손상된 파일은 CacheCorruptException 을 던진다")
    void 손상된_파일() throws IOException {
        // given
        tier.write(entry(T0, "v1"));
        String latest = Files.readString(directory.resolve(
            "odds_api_americanfootball_nfl_odds_markets_spreads_regions_us.latest"));
        Files.writeString(directory.resolve(latest), "{not json", StandardCharsets.UTF_8);

        // when & then
        assertThatThrownBy(() -> tier.read(KEY))
            .isInstanceOf(CacheCorruptException.class)
            .hasMessageContaining(latest);
    }

    @Test
    @DisplayName("포인터가 가리키는 파일이 없으면 CacheCorruptException 을 던진다")
    void 포인터_대상_없음() throws IOException {
        // given
        tier.write(entry(T0, "v1"));
        String latest = Files.readString(directory.resolve(
            "odds_api_americanfootball_nfl_odds_markets_spreads_regions_us.latest"));
        Files.delete(directory.resolve(latest));

        // when & then
        assertThatThrownBy(() -> tier.read(KEY)).isInstanceOf(CacheCorruptException.class);
    }

    @Test
    @DisplayName("invalidate() 는 포인터만 삭제한다")
    void invalidate_포인터만_삭제() throws IOException {
        // given
        tier.write(entry(T0, "v1"));

        // when
        tier.invalidate(KEY);

        // then
        assertThat(tier.read(KEY)).isEmpty();
        assertThat(fileNames()).hasSize(1).allMatch(name -> name.endsWith(".json"));
    }

    @Test
    @DisplayName("purgeOlderThan() 은 오래된 과거 스냅샷만 삭제하고 최신 파일은 유지한다")
    void purge_최신_유지() throws IOException {
        // given
        tier.write(entry(T0, "v1"));
        tier.write(entry(T0.plusSeconds(3600), "v2"));
        tier.write(entry(T0.plusSeconds(7200), "v3"));

        // when
        int deleted = tier.purgeOlderThan(T0.plusSeconds(86_400));

        // then
        assertThat(deleted).isEqualTo(2);
        assertThat(fileNames()).hasSize(2);
        assertThat(tier.read(KEY).map(e -> e.payload().asUtf8())).contains("v3");
    }

    @Test
    @DisplayName("clear() 는 모든 스냅샷과 포인터를 삭제한다")
    void clear_전체_삭제() throws IOException {
        // given
        tier.write(entry(T0, "v1"));

        // when
        tier.clear();

        // then
        assertThat(fileNames()).isEmpty();
        assertThat(tier.read(KEY)).isEmpty();
    }

    @Test
    @DisplayName("파일 이름에서 타임스탬프를 해석한다")
    void 타임스탬프_해석() {
        assertThat(FileSnapshotTier.timestampOf("a_b__20250907T120000123Z.json")).contains(T0);
        assertThat(FileSnapshotTier.timestampOf("a_b.latest")).isEmpty();
        assertThat(FileSnapshotTier.timestampOf("a_b__garbage.json")).isEmpty();
    }
}
