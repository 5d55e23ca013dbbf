package com.ryuqq.feed.application.config;

import com.ryuqq.feed.core.cache.TtlPolicy;
import com.ryuqq.feed.core.protection.CircuitBreakerConfig;
import com.ryuqq.feed.core.protection.RateLimiterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * GatewayProperties 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("GatewayProperties 테스트")
class GatewayPropertiesTest {

    private static Properties props(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    @DisplayName("기본값은 provider 별 할당량을 기간에 걸쳐 나눈다")
    void 기본_provider_할당량() {
        // when
        GatewayProperties properties = GatewayProperties.defaults();
        Map<String, RateLimiterConfig> limits = properties.rateLimits();

        // then
        assertThat(limits).containsOnlyKeys("espn_api", "noaa_api", "odds_api");
        RateLimiterConfig odds = limits.get("odds_api");
        assertThat(odds.capacity()).isEqualTo(500);
        assertThat(odds.refillRatePerSecond()).isCloseTo(500.0 / Duration.ofDays(30).getSeconds(), within(1e-12));
        assertThat(properties.fallbackRateLimit().capacity()).isEqualTo(100);
    }

    @Test
    @DisplayName("capacity 와 refill-per-second 로 직접 지정할 수 있다")
    void 직접_지정_rate_limit() {
        // given
        GatewayProperties properties = GatewayProperties.of(props(
            "feed.provider.test_api.capacity", "10",
            "feed.provider.test_api.refill-per-second", "1.0"));

        // when
        RateLimiterConfig config = properties.rateLimits().get("test_api");

        // then
        assertThat(config).isEqualTo(new RateLimiterConfig(10, 1.0));
    }

    @Test
    @DisplayName("할당량도 용량도 없으면 키 이름과 함께 거부된다")
    void 불완전한_rate_limit_거부() {
        // given
        GatewayProperties properties = GatewayProperties.of(props(
            "feed.provider.broken_api.refill-per-second", "1.0"));

        // when & then
        assertThatThrownBy(properties::rateLimits)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("feed.provider.broken_api.");
    }

    @Test
    @DisplayName("잘못된 Circuit Breaker 값은 해당 속성 이름으로 한 번만 감싸서 거부된다")
    void 잘못된_breaker_값_거부() {
        // given
        GatewayProperties badNumber = GatewayProperties.of(props(
            "feed.endpoint.espn_api.failure-threshold", "three"));
        GatewayProperties badRange = GatewayProperties.of(props(
            "feed.endpoint.espn_api.failure-threshold", "0"));

        // when & then
        assertThatThrownBy(badNumber::breakerOverrides)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Invalid value for feed.endpoint.espn_api.failure-threshold: ")
            .satisfies(e -> assertThat(e.getMessage().split("Invalid value for", -1)).hasSize(2));
        assertThatThrownBy(badRange::breakerOverrides)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Invalid value for feed.endpoint.espn_api.*: ");
    }

    @Test
    @DisplayName("Circuit Breaker 재정의는 지정하지 않은 속성을 기본값에서 가져온다")
    void breaker_재정의_부분_지정() {
        // given
        GatewayProperties properties = GatewayProperties.of(props(
            "feed.endpoint.espn_api/scoreboard.failure-threshold", "2",
            "feed.endpoint.odds_api.cooldown-multiplier", "2.0",
            "feed.endpoint.odds_api.max-cooldown-seconds", "600"));

        // when
        Map<String, CircuitBreakerConfig> overrides = properties.breakerOverrides();

        // then
        assertThat(properties.defaultBreaker()).isEqualTo(CircuitBreakerConfig.defaults());
        assertThat(overrides.get("espn_api/scoreboard"))
            .isEqualTo(CircuitBreakerConfig.of(2, Duration.ofSeconds(60)));
        assertThat(overrides.get("odds_api"))
            .isEqualTo(new CircuitBreakerConfig(3, Duration.ofSeconds(120), 2.0, Duration.ofSeconds(600)));
    }

    @Test
    @DisplayName("TTL 구간을 파싱한다")
    void ttl_구간_파싱() {
        // when
        TtlPolicy policy = GatewayProperties.defaults().ttlPolicy();

        // then
        assertThat(policy).isEqualTo(TtlPolicy.defaults());
        Instant now = Instant.parse("2025-09-07T12:00:00Z");
        assertThat(policy.ttlFor(now.plus(Duration.ofMinutes(30)), now)).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    @DisplayName("형식이 잘못된 TTL 구간은 거부된다")
    void ttl_형식_오류() {
        // given
        GatewayProperties properties = GatewayProperties.of(props("feed.ttl.tiers", "PT1H-PT2M"));

        // when & then
        assertThatThrownBy(properties::ttlPolicy)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("feed.ttl.tiers");
    }

    @Test
    @DisplayName("잘못된 Duration 은 키 이름과 함께 거부된다")
    void duration_형식_오류() {
        // given
        GatewayProperties properties = GatewayProperties.of(props("feed.worker.upstream-timeout", "10s"));

        // when & then
        assertThatThrownBy(properties::upstreamTimeout)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("feed.worker.upstream-timeout");
    }

    @Test
    @DisplayName("작업자와 캐시 설정 기본값")
    void 작업자_캐시_기본값() {
        // when
        GatewayProperties properties = GatewayProperties.defaults();

        // then
        assertThat(properties.workerCount()).isEqualTo(4);
        assertThat(properties.maxAttempts()).isEqualTo(3);
        assertThat(properties.upstreamTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(properties.backoffBase()).isEqualTo(Duration.ofSeconds(1));
        assertThat(properties.backoffMax()).isEqualTo(Duration.ofSeconds(30));
        assertThat(properties.jitterFactor()).isEqualTo(0.1);
        assertThat(properties.maxCallerWait()).isEqualTo(Duration.ofSeconds(60));
        assertThat(properties.conserveBudgetForLowPriority()).isTrue();
        assertThat(properties.snapshotDir()).isEqualTo(Path.of("data/cache/snapshots"));
        assertThat(properties.historyDir()).isEqualTo(Path.of("data/cache/history"));
        assertThat(properties.snapshotRetention()).isEqualTo(Duration.ofHours(24));
        assertThat(properties.eventTimeFields()).containsExactly("commence_time");
    }

    @Test
    @DisplayName("HTTP 접속 정보는 환경 변수를 치환하고 빈 파라미터는 생략한다")
    void http_접속_정보_치환() {
        // given
        GatewayProperties withKey = GatewayProperties.of(new Properties(),
            name -> "ODDS_API_KEY".equals(name) ? "secret" : null);
        GatewayProperties withoutKey = GatewayProperties.of(new Properties(), name -> null);

        // when
        ProviderTarget odds = withKey.providerTargets().get("odds_api");
        ProviderTarget oddsWithoutKey = withoutKey.providerTargets().get("odds_api");
        ProviderTarget noaa = withKey.providerTargets().get("noaa_api");

        // then
        assertThat(odds.baseUri()).isEqualTo(URI.create("https://api.the-odds-api.com/v4/sports"));
        assertThat(odds.defaultParams()).containsEntry("apiKey", "secret");
        assertThat(oddsWithoutKey.defaultParams()).isEmpty();
        assertThat(noaa.headers()).containsKey("User-Agent");
        assertThat(withKey.toString()).doesNotContain("apiKey");
    }

    @Test
    @DisplayName("placeholder 기본값을 사용한다")
    void placeholder_기본값() {
        // given
        GatewayProperties properties = GatewayProperties.of(
            props("feed.cache.snapshot-dir", "${FEED_HOME:/var/feed}/snapshots"), name -> null);

        // when & then
        assertThat(properties.snapshotDir()).isEqualTo(Path.of("/var/feed/snapshots"));
    }

    @Test
    @DisplayName("없는 리소스는 거부된다")
    void 없는_리소스_거부() {
        assertThatThrownBy(() -> GatewayProperties.load("does-not-exist.properties"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does-not-exist.properties");
    }
}
