package com.ryuqq.feed.adapter.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.feed.application.config.ProviderTarget;
import com.ryuqq.feed.core.exception.UpstreamException;
import com.ryuqq.feed.core.exception.UpstreamTimeoutException;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.UpstreamResponse;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HttpUpstreamFetcher 테스트")
class HttpUpstreamFetcherTest {

    private static final Instant NOW = Instant.parse("2025-09-07T12:00:00Z");

    private ExecutorService serverExecutor;
    private HttpServer server;
    private String baseUrl;

    private final AtomicReference<URI> lastRequestUri = new AtomicReference<>();
    private final AtomicReference<String> lastUserAgent = new AtomicReference<>();
    private final AtomicReference<String> lastAccept = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        serverExecutor = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(serverExecutor);
        server.start();
        baseUrl = "http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    private HttpUpstreamFetcher fetcher(Map<String, ProviderTarget> targets, Duration timeout) {
        return new HttpUpstreamFetcher(
            HttpUpstreamFetcher.restClient(Duration.ofSeconds(2), timeout),
            targets,
            "FeedOrchestrator/test",
            timeout,
            new JsonEventTimeExtractor(new ObjectMapper(), Set.of("commence_time")),
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            lastRequestUri.set(exchange.getRequestURI());
            lastUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            lastAccept.set(exchange.getRequestHeaders().getFirst("Accept"));
            respondJson(exchange, status, body);
        });
    }

    private static void respondJson(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void 성공_응답은_본문과_이벤트_시각을_반환한다() throws Exception {
        // given
        respond("/v4/sports/americanfootball_nfl/odds", 200,
            "[{\"id\":\"g1\",\"commence_time\":\"2025-09-07T17:00:00Z\"}]");
        HttpUpstreamFetcher fetcher = fetcher(Map.of("odds_api",
            new ProviderTarget(URI.create(baseUrl + "/v4/sports"), Map.of("apiKey", "k"), Map.of())),
            Duration.ofSeconds(5));

        // when
        UpstreamResponse response = fetcher.fetch(
            Endpoint.of("odds_api/americanfootball_nfl/odds"), Map.of("regions", "us", "markets", "h2h,spreads"));

        // then
        assertThat(response.payload().asUtf8()).contains("\"g1\"");
        assertThat(response.eventTime()).isEqualTo(Instant.parse("2025-09-07T17:00:00Z"));
        assertThat(lastRequestUri.get().getPath()).isEqualTo("/v4/sports/americanfootball_nfl/odds");
        assertThat(lastRequestUri.get().getRawQuery()).isEqualTo("apiKey=k&markets=h2h%2Cspreads&regions=us");
        assertThat(lastUserAgent.get()).isEqualTo("FeedOrchestrator/test");
        assertThat(lastAccept.get()).isEqualTo("application/json");
    }

    @Test
    void provider_헤더가_기본_User_Agent_를_덮어쓴다() throws Exception {
        // given
        respond("/points/39.7,-104.9", 200, "{\"properties\":{}}");
        HttpUpstreamFetcher fetcher = fetcher(Map.of("noaa_api",
            new ProviderTarget(URI.create(baseUrl + "/"), Map.of(), Map.of("User-Agent", "(FeedOrchestrator, ops@example.com)"))),
            Duration.ofSeconds(5));

        // when
        UpstreamResponse response = fetcher.fetch(Endpoint.of("noaa_api/points/39.7,-104.9"), Map.of());

        // then
        assertThat(response.eventTime()).isNull();
        assertThat(lastUserAgent.get()).isEqualTo("(FeedOrchestrator, ops@example.com)");
    }

    @Test
    void 비정상_상태코드는_상태코드를_담은_UpstreamException() {
        // given
        respond("/scoreboard", 503, "{\"error\":\"unavailable\"}");
        HttpUpstreamFetcher fetcher = fetcher(Map.of("espn_api", ProviderTarget.of(baseUrl)), Duration.ofSeconds(5));

        // when & then
        assertThatThrownBy(() -> fetcher.fetch(Endpoint.of("espn_api/scoreboard"), Map.of()))
            .isInstanceOf(UpstreamException.class)
            .isNotInstanceOf(UpstreamTimeoutException.class)
            .satisfies(e -> assertThat(((UpstreamException) e).getStatusCode()).isEqualTo(503));
    }

    @Test
    void 응답_지연은_UpstreamTimeoutException() {
        // given
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respondJson(exchange, 200, "{}");
        });
        HttpUpstreamFetcher fetcher = fetcher(Map.of("espn_api", ProviderTarget.of(baseUrl)), Duration.ofMillis(200));

        // when & then
        assertThatThrownBy(() -> fetcher.fetch(Endpoint.of("espn_api/slow"), Map.of()))
            .isInstanceOf(UpstreamTimeoutException.class)
            .satisfies(e -> assertThat(((UpstreamTimeoutException) e).getTimeout()).isEqualTo(Duration.ofMillis(200)));
    }

    @Test
    void 클라이언트_오류_상태코드도_상태코드를_담은_UpstreamException() {
        // given
        respond("/scoreboard", 401, "{\"error\":\"bad key\"}");
        HttpUpstreamFetcher fetcher = fetcher(Map.of("espn_api", ProviderTarget.of(baseUrl)), Duration.ofSeconds(5));

        // when & then
        assertThatThrownBy(() -> fetcher.fetch(Endpoint.of("espn_api/scoreboard"), Map.of()))
            .isInstanceOf(UpstreamException.class)
            .satisfies(e -> assertThat(((UpstreamException) e).getStatusCode()).isEqualTo(401));
    }

    @Test
    void 응답_헤더의_남은_할당량은_응답을_막지_않는다() throws Exception {
        // given
        server.createContext("/quota", exchange -> {
            exchange.getResponseHeaders().add(HttpUpstreamFetcher.REMAINING_QUOTA_HEADER, "487");
            respondJson(exchange, 200, "{\"ok\":true}");
        });
        HttpUpstreamFetcher fetcher = fetcher(Map.of("odds_api", ProviderTarget.of(baseUrl)), Duration.ofSeconds(5));

        // when
        UpstreamResponse response = fetcher.fetch(Endpoint.of("odds_api/quota"), Map.of());

        // then
        assertThat(response.payload().asUtf8()).isEqualTo("{\"ok\":true}");
    }

    @Test
    void 연결_실패는_상태코드_없는_UpstreamException() throws IOException {
        // given: a port nothing listens on
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = socket.getLocalPort();
        }
        HttpUpstreamFetcher fetcher = fetcher(
            Map.of("espn_api", ProviderTarget.of("http://127.0.0.1:" + closedPort)), Duration.ofSeconds(5));

        // when & then
        assertThatThrownBy(() -> fetcher.fetch(Endpoint.of("espn_api/scoreboard"), Map.of()))
            .isInstanceOf(UpstreamException.class)
            .isNotInstanceOf(UpstreamTimeoutException.class)
            .satisfies(e -> assertThat(((UpstreamException) e).hasStatusCode()).isFalse());
    }

    @Test
    void 설정되지_않은_provider_는_상태코드_없는_UpstreamException() {
        // given
        HttpUpstreamFetcher fetcher = fetcher(Map.of(), Duration.ofSeconds(5));

        // when & then
        assertThatThrownBy(() -> fetcher.fetch(Endpoint.of("unknown_api/x"), Map.of()))
            .isInstanceOf(UpstreamException.class)
            .hasMessageContaining("unknown_api")
            .satisfies(e -> assertThat(((UpstreamException) e).hasStatusCode()).isFalse());
    }

    @Test
    void 요청_파라미터가_기본_파라미터보다_우선한다() {
        // given
        ProviderTarget target = new ProviderTarget(URI.create("https://example.com/api/"), Map.of("format", "json"), Map.of());

        // when
        URI uri = HttpUpstreamFetcher.resolve(target, Endpoint.of("x_api/items"), Map.of("format", "csv", "q", "a b"));

        // then
        assertThat(uri.toString()).isEqualTo("https://example.com/api/items?format=csv&q=a%20b");
    }
}
