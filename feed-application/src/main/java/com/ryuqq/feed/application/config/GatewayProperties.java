package com.ryuqq.feed.application.config;

import com.ryuqq.feed.core.cache.TtlPolicy;
import com.ryuqq.feed.core.protection.CircuitBreakerConfig;
import com.ryuqq.feed.core.protection.RateLimiterConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code feed.*} 설정 로더.
 *
 * <p>클래스패스의 {@code feed-gateway-defaults.properties} 를 기본값으로 읽고,
 * 그 위에 호출자가 준 설정을 덮어씁니다. 모든 설정 객체는 이 클래스에서 생성되며,
 * 잘못된 값은 키 이름을 포함한 {@link IllegalArgumentException} 으로 보고됩니다.</p>
 *
 * <p><strong>키 구성:</strong></p>
 * <pre>
 * feed.provider.&lt;name|default&gt;.quota / .period               (기간당 할당량)
 * feed.provider.&lt;name|default&gt;.capacity / .refill-per-second (직접 지정)
 * feed.endpoint.&lt;endpoint|provider|default&gt;.failure-threshold / .cooldown-seconds
 *                                        / .cooldown-multiplier / .max-cooldown-seconds
 * feed.ttl.tiers=PT1H=PT2M,PT6H=PT15M,PT24H=PT30M
 * feed.ttl.default=PT60M
 * feed.worker.*  feed.cache.*  feed.http.*  feed.event-time.fields
 * </pre>
 *
 * <p><strong>치환:</strong> 값의 {@code ${NAME}} 또는 {@code ${NAME:default}} 는 환경 변수,
 * 시스템 프로퍼티 순으로 치환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GatewayProperties {

    public static final String DEFAULTS_RESOURCE = "feed-gateway-defaults.properties";

    static final String PROVIDER_PREFIX = "feed.provider.";
    static final String ENDPOINT_PREFIX = "feed.endpoint.";
    static final String HTTP_PREFIX = "feed.http.";
    static final String DEFAULT_NAME = "default";

    private static final List<String> PROVIDER_ATTRIBUTES =
        List.of("quota", "period", "capacity", "refill-per-second");
    private static final List<String> ENDPOINT_ATTRIBUTES =
        List.of("failure-threshold", "cooldown-seconds", "cooldown-multiplier", "max-cooldown-seconds");
    private static final Set<String> HTTP_GLOBAL_KEYS = Set.of("user-agent", "connect-timeout");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}:]+)(?::([^}]*))?}");

    private final Properties properties;
    private final UnaryOperator<String> environment;

    private GatewayProperties(Properties properties, UnaryOperator<String> environment) {
        this.properties = properties;
        this.environment = environment;
    }

    /**
     * 기본값만으로 생성.
     *
     * @return 기본 설정
     */
    public static GatewayProperties defaults() {
        return of(new Properties());
    }

    /**
     * 기본값 위에 주어진 설정을 덮어써 생성.
     *
     * @param overrides 덮어쓸 설정
     * @return 설정
     */
    public static GatewayProperties of(Properties overrides) {
        return of(overrides, GatewayProperties::lookupEnvironment);
    }

    static GatewayProperties of(Properties overrides, UnaryOperator<String> environment) {
        if (overrides == null) {
            throw new IllegalArgumentException("overrides cannot be null");
        }
        Properties merged = loadResource(DEFAULTS_RESOURCE);
        merged.putAll(overrides);
        return new GatewayProperties(merged, environment);
    }

    /**
     * 기본값 위에 클래스패스 리소스를 덮어써 생성.
     *
     * @param resource 클래스패스 리소스 이름
     * @return 설정
     * @throws IllegalArgumentException 리소스가 없는 경우
     */
    public static GatewayProperties load(String resource) {
        return of(loadResource(resource));
    }

    private static Properties loadResource(String resource) {
        Properties loaded = new Properties();
        try (InputStream in = GatewayProperties.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Configuration resource not found: " + resource);
            }
            loaded.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration resource " + resource, e);
        }
        return loaded;
    }

    private static String lookupEnvironment(String name) {
        String value = System.getenv(name);
        return value != null ? value : System.getProperty(name);
    }

    // ---------------------------------------------------------------- rate limits

    /**
     * provider 별 Rate Limit 설정 ({@code default} 제외).
     *
     * @return provider → 설정
     */
    public Map<String, RateLimiterConfig> rateLimits() {
        Map<String, RateLimiterConfig> limits = new TreeMap<>();
        for (String name : sectionNames(PROVIDER_PREFIX, PROVIDER_ATTRIBUTES)) {
            if (!DEFAULT_NAME.equals(name)) {
                limits.put(name, rateLimit(name));
            }
        }
        return Collections.unmodifiableMap(limits);
    }

    /**
     * 설정이 없는 provider 에 적용할 Rate Limit.
     *
     * @return {@code feed.provider.default.*}
     */
    public RateLimiterConfig fallbackRateLimit() {
        return rateLimit(DEFAULT_NAME);
    }

    private RateLimiterConfig rateLimit(String name) {
        String prefix = PROVIDER_PREFIX + name + ".";
        String quota = value(prefix + "quota");
        if (quota != null) {
            return guard(prefix + "quota", () ->
                RateLimiterConfig.perPeriod(Long.parseLong(quota), requiredDuration(prefix + "period")));
        }
        String capacity = value(prefix + "capacity");
        if (capacity == null) {
            throw new IllegalArgumentException(
                prefix + "quota or " + prefix + "capacity must be set");
        }
        return guard(prefix + "capacity", () -> new RateLimiterConfig(
            Long.parseLong(capacity),
            Double.parseDouble(required(prefix + "refill-per-second"))));
    }

    // ---------------------------------------------------------------- circuit breakers

    /**
     * 엔드포인트 또는 provider 별 Circuit Breaker 설정 ({@code default} 제외).
     *
     * <p>지정하지 않은 속성은 기본 설정 값을 따릅니다.</p>
     *
     * @return 엔드포인트/provider → 설정
     */
    public Map<String, CircuitBreakerConfig> breakerOverrides() {
        CircuitBreakerConfig base = defaultBreaker();
        Map<String, CircuitBreakerConfig> overrides = new TreeMap<>();
        for (String name : sectionNames(ENDPOINT_PREFIX, ENDPOINT_ATTRIBUTES)) {
            if (!DEFAULT_NAME.equals(name)) {
                overrides.put(name, breaker(name, base));
            }
        }
        return Collections.unmodifiableMap(overrides);
    }

    /**
     * 기본 Circuit Breaker 설정.
     *
     * @return {@code feed.endpoint.default.*} (없으면 5회 / 60초)
     */
    public CircuitBreakerConfig defaultBreaker() {
        return breaker(DEFAULT_NAME, CircuitBreakerConfig.defaults());
    }

    private CircuitBreakerConfig breaker(String name, CircuitBreakerConfig base) {
        String prefix = ENDPOINT_PREFIX + name + ".";
        return guard(prefix + "*", () -> {
            int threshold = intValue(prefix + "failure-threshold", base.failureThreshold());
            Duration cooldown = Duration.ofSeconds(
                longValue(prefix + "cooldown-seconds", base.cooldown().getSeconds()));
            double multiplier = doubleValue(prefix + "cooldown-multiplier", base.cooldownMultiplier());
            Duration maxCooldown = Duration.ofSeconds(longValue(prefix + "max-cooldown-seconds",
                Math.max(base.maxCooldown().getSeconds(), cooldown.getSeconds())));
            return new CircuitBreakerConfig(threshold, cooldown, multiplier, maxCooldown);
        });
    }

    // ---------------------------------------------------------------- ttl

    /**
     * TTL 정책.
     *
     * @return {@code feed.ttl.tiers} 와 {@code feed.ttl.default} 로 구성한 정책
     */
    public TtlPolicy ttlPolicy() {
        String tiers = required("feed.ttl.tiers");
        List<TtlPolicy.Threshold> thresholds = new ArrayList<>();
        for (String pair : tiers.split(",")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split("=");
            if (parts.length != 2) {
                throw new IllegalArgumentException(
                    "feed.ttl.tiers entries must look like PT1H=PT2M (current: " + trimmed + ")");
            }
            thresholds.add(guard("feed.ttl.tiers", () ->
                new TtlPolicy.Threshold(Duration.parse(parts[0].trim()), Duration.parse(parts[1].trim()))));
        }
        return guard("feed.ttl.default", () -> new TtlPolicy(thresholds, requiredDuration("feed.ttl.default")));
    }

    // ---------------------------------------------------------------- worker

    public int workerCount() {
        return intValue("feed.worker.count", 4);
    }

    public int maxAttempts() {
        return intValue("feed.worker.max-attempts", 3);
    }

    public Duration upstreamTimeout() {
        return durationValue("feed.worker.upstream-timeout", Duration.ofSeconds(10));
    }

    public Duration backoffBase() {
        return durationValue("feed.worker.backoff-base", Duration.ofSeconds(1));
    }

    public Duration backoffMax() {
        return durationValue("feed.worker.backoff-max", Duration.ofSeconds(30));
    }

    public double jitterFactor() {
        return doubleValue("feed.worker.jitter-factor", 0.1);
    }

    public Duration maxCallerWait() {
        return durationValue("feed.worker.max-caller-wait", Duration.ofSeconds(60));
    }

    public boolean conserveBudgetForLowPriority() {
        return Boolean.parseBoolean(valueOrDefault("feed.worker.conserve-budget-for-low-priority", "true"));
    }

    // ---------------------------------------------------------------- cache

    public Path snapshotDir() {
        return Path.of(required("feed.cache.snapshot-dir"));
    }

    public Path historyDir() {
        return Path.of(required("feed.cache.history-dir"));
    }

    public Duration snapshotRetention() {
        return durationValue("feed.cache.snapshot-retention", Duration.ofHours(24));
    }

    // ---------------------------------------------------------------- http

    /**
     * provider 별 HTTP 접속 정보.
     *
     * <p>{@code feed.http.<provider>.base-uri} 가 있는 provider 만 포함됩니다.
     * {@code .param.<name>} 은 기본 query 파라미터, {@code .header.<name>} 은 기본 헤더입니다.
     * 값이 비어 있는 파라미터와 헤더는 생략됩니다.</p>
     *
     * @return provider → 접속 정보
     */
    public Map<String, ProviderTarget> providerTargets() {
        Map<String, ProviderTarget> targets = new TreeMap<>();
        for (String key : new TreeSet<>(properties.stringPropertyNames())) {
            if (!key.startsWith(HTTP_PREFIX) || !key.endsWith(".base-uri")) {
                continue;
            }
            String provider = key.substring(HTTP_PREFIX.length(), key.length() - ".base-uri".length());
            String prefix = HTTP_PREFIX + provider + ".";
            URI baseUri = guard(key, () -> URI.create(required(key)));
            targets.put(provider, guard(key, () -> new ProviderTarget(
                baseUri, subsection(prefix + "param."), subsection(prefix + "header."))));
        }
        return Collections.unmodifiableMap(targets);
    }

    public String userAgent() {
        return valueOrDefault(HTTP_PREFIX + "user-agent", "FeedOrchestrator/1.0");
    }

    public Duration connectTimeout() {
        return durationValue(HTTP_PREFIX + "connect-timeout", Duration.ofSeconds(5));
    }

    /**
     * 이벤트 시각을 담은 JSON 필드 이름 목록.
     *
     * @return {@code feed.event-time.fields} 의 쉼표 구분 값
     */
    public Set<String> eventTimeFields() {
        Set<String> fields = new LinkedHashSet<>();
        for (String field : valueOrDefault("feed.event-time.fields", "commence_time").split(",")) {
            if (!field.isBlank()) {
                fields.add(field.trim());
            }
        }
        return Collections.unmodifiableSet(fields);
    }

    // ---------------------------------------------------------------- raw access

    /**
     * 치환이 적용된 원시 값.
     *
     * @param key 키
     * @return 값 (없으면 null)
     */
    public String value(String key) {
        String raw = properties.getProperty(key);
        return raw == null ? null : resolvePlaceholders(raw.trim());
    }

    private String required(String key) {
        String value = value(key);
        if (value == null || value.isEmpty()) {
            throw new InvalidPropertyException(key + " must be set", null);
        }
        return value;
    }

    private String valueOrDefault(String key, String defaultValue) {
        String value = value(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private int intValue(String key, int defaultValue) {
        String value = value(key);
        return value == null || value.isEmpty() ? defaultValue : guard(key, () -> Integer.parseInt(value));
    }

    private long longValue(String key, long defaultValue) {
        String value = value(key);
        return value == null || value.isEmpty() ? defaultValue : guard(key, () -> Long.parseLong(value));
    }

    private double doubleValue(String key, double defaultValue) {
        String value = value(key);
        return value == null || value.isEmpty() ? defaultValue : guard(key, () -> Double.parseDouble(value));
    }

    private Duration durationValue(String key, Duration defaultValue) {
        String value = value(key);
        return value == null || value.isEmpty() ? defaultValue : guard(key, () -> Duration.parse(value));
    }

    private Duration requiredDuration(String key) {
        String value = required(key);
        return guard(key, () -> Duration.parse(value));
    }

    private Set<String> sectionNames(String prefix, List<String> attributes) {
        Set<String> names = new TreeSet<>();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(prefix)) {
                continue;
            }
            String rest = key.substring(prefix.length());
            for (String attribute : attributes) {
                if (rest.endsWith("." + attribute)) {
                    names.add(rest.substring(0, rest.length() - attribute.length() - 1));
                }
            }
        }
        return names;
    }

    private Map<String, String> subsection(String prefix) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String key : new TreeSet<>(properties.stringPropertyNames())) {
            if (key.startsWith(prefix)) {
                String value = value(key);
                if (value != null && !value.isEmpty()) {
                    values.put(key.substring(prefix.length()), value);
                }
            }
        }
        return values;
    }

    private String resolvePlaceholders(String raw) {
        Matcher matcher = PLACEHOLDER.matcher(raw);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            String replacement = environment.apply(matcher.group(1));
            if (replacement == null) {
                replacement = matcher.group(2) != null ? matcher.group(2) : "";
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    /**
     * 파싱 실패를 속성 이름이 담긴 예외로 변환합니다. 이미 속성 이름이 담긴 예외는 그대로 전파합니다.
     */
    private static <T> T guard(String key, ValueParser<T> parser) {
        try {
            return parser.parse();
        } catch (InvalidPropertyException e) {
            throw e;
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new InvalidPropertyException("Invalid value for " + key + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new InvalidPropertyException("Invalid value for " + key + ": " + e.getMessage(), e);
        }
    }

    private static final class InvalidPropertyException extends IllegalArgumentException {
        InvalidPropertyException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    @FunctionalInterface
    private interface ValueParser<T> {
        T parse();
    }

    @Override
    public String toString() {
        Set<String> keys = new TreeSet<>(properties.stringPropertyNames());
        keys.removeIf(key -> key.startsWith(HTTP_PREFIX) && !HTTP_GLOBAL_KEYS.contains(key.substring(HTTP_PREFIX.length()))
            && (key.contains(".param.") || key.contains(".header.")));
        return "GatewayProperties" + keys;
    }
}
