package com.ryuqq.feed.adapter.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.feed.application.config.GatewayProperties;
import com.ryuqq.feed.application.config.ProviderTarget;
import com.ryuqq.feed.core.exception.UpstreamException;
import com.ryuqq.feed.core.exception.UpstreamTimeoutException;
import com.ryuqq.feed.core.model.Endpoint;
import com.ryuqq.feed.core.model.Payload;
import com.ryuqq.feed.core.model.UpstreamResponse;
import com.ryuqq.feed.core.spi.UpstreamFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;

/**
 * {@link UpstreamFetcher} over a Spring {@link RestClient}.
 *
 * <p>The endpoint's provider segment selects a {@link ProviderTarget}; the rest of the endpoint is
 * appended to the target's base URI. Request parameters are merged over the target's default
 * parameters and sent as the query string.</p>
 *
 * <p>Error mapping:</p>
 * <ul>
 *   <li>non-2xx status ({@link RestClientResponseException}): {@link UpstreamException} carrying the status code</li>
 *   <li>read timeout ({@link ResourceAccessException} caused by a timeout): {@link UpstreamTimeoutException}</li>
 *   <li>any other transport failure: {@link UpstreamException} without status</li>
 *   <li>provider with no configured target: {@link UpstreamException} without status</li>
 * </ul>
 *
 * <p>This class performs exactly one HTTP call per {@link #fetch}. Retries, rate limiting and
 * circuit breaking are the caller's concern.</p>
 */
public class HttpUpstreamFetcher implements UpstreamFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamFetcher.class);

    static final String REMAINING_QUOTA_HEADER = "x-requests-remaining";

    private final RestClient restClient;
    private final Map<String, ProviderTarget> targets;
    private final String userAgent;
    private final Duration requestTimeout;
    private final EventTimeExtractor eventTimeExtractor;
    private final Clock clock;

    /**
     * Creates a fetcher over an existing client.
     *
     * @param restClient client whose request factory enforces {@code requestTimeout}, see {@link #restClient}
     * @param requestTimeout read timeout of {@code restClient}, reported on {@link UpstreamTimeoutException}
     */
    public HttpUpstreamFetcher(
        RestClient restClient,
        Map<String, ProviderTarget> targets,
        String userAgent,
        Duration requestTimeout,
        EventTimeExtractor eventTimeExtractor,
        Clock clock
    ) {
        if (restClient == null) {
            throw new IllegalArgumentException("restClient cannot be null");
        }
        if (targets == null) {
            throw new IllegalArgumentException("targets cannot be null");
        }
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent cannot be null or blank");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
        if (eventTimeExtractor == null) {
            throw new IllegalArgumentException("eventTimeExtractor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.restClient = restClient;
        this.targets = Map.copyOf(targets);
        this.userAgent = userAgent;
        this.requestTimeout = requestTimeout;
        this.eventTimeExtractor = eventTimeExtractor;
        this.clock = clock;
    }

    /**
     * Builds a fetcher from {@code feed.http.*} and {@code feed.event-time.fields}.
     *
     * @param properties gateway configuration
     * @param clock time source used to pick the upcoming event time
     * @return a fetcher with its own {@link RestClient}
     */
    public static HttpUpstreamFetcher from(GatewayProperties properties, Clock clock) {
        return new HttpUpstreamFetcher(
            restClient(properties.connectTimeout(), properties.upstreamTimeout()),
            properties.providerTargets(),
            properties.userAgent(),
            properties.upstreamTimeout(),
            new JsonEventTimeExtractor(new ObjectMapper(), properties.eventTimeFields()),
            clock
        );
    }

    /**
     * Creates a {@link RestClient} on the JDK HTTP client that follows redirects.
     *
     * @param connectTimeout connection establishment limit
     * @param readTimeout per-request response limit
     * @return a new client
     */
    public static RestClient restClient(Duration connectTimeout, Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(readTimeout);
        return RestClient.builder()
            .requestFactory(factory)
            .build();
    }

    @Override
    public UpstreamResponse fetch(Endpoint endpoint, Map<String, String> params)
        throws UpstreamException, InterruptedException {
        ProviderTarget target = targets.get(endpoint.provider());
        if (target == null) {
            throw new UpstreamException("No HTTP target configured for provider " + endpoint.provider());
        }

        URI uri = resolve(target, endpoint, params);
        ResponseEntity<byte[]> response;
        try {
            response = restClient.get()
                .uri(uri)
                .headers(headers -> {
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                    headers.set(HttpHeaders.USER_AGENT, userAgent);
                    target.headers().forEach(headers::set);
                })
                .retrieve()
                .toEntity(byte[].class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new UpstreamException("HTTP " + status + " from " + endpoint, status);
        } catch (ResourceAccessException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Request to " + endpoint + " was interrupted");
            }
            if (isTimeout(e)) {
                throw new UpstreamTimeoutException(
                    "Request to " + endpoint + " timed out after " + requestTimeout, requestTimeout, e);
            }
            throw new UpstreamException("Request to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new UpstreamException("Request to " + endpoint + " failed: " + e.getMessage(), e);
        }

        int status = response.getStatusCode().value();
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new UpstreamException("HTTP " + status + " from " + endpoint, status);
        }

        String remaining = response.getHeaders().getFirst(REMAINING_QUOTA_HEADER);
        if (remaining != null) {
            log.info("Provider {} reports {} requests remaining", endpoint.provider(), remaining);
        }

        byte[] body = response.getBody();
        Payload payload = Payload.of(body == null ? new byte[0] : body);
        Instant eventTime = eventTimeExtractor.extract(payload, clock.instant()).orElse(null);
        log.debug("Fetched {} ({} bytes, eventTime={})", endpoint, payload.size(), eventTime);
        return UpstreamResponse.of(payload, eventTime);
    }

    private static boolean isTimeout(Throwable failure) {
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof HttpTimeoutException
                || cause instanceof SocketTimeoutException
                || cause instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    static URI resolve(ProviderTarget target, Endpoint endpoint, Map<String, String> params) {
        String base = target.baseUri().toString();
        StringBuilder uri = new StringBuilder(base.endsWith("/") ? base.substring(0, base.length() - 1) : base);
        if (!endpoint.path().isEmpty()) {
            uri.append('/').append(endpoint.path());
        }

        Map<String, String> query = new TreeMap<>(target.defaultParams());
        if (params != null) {
            query.putAll(params);
        }
        if (!query.isEmpty()) {
            StringJoiner joiner = new StringJoiner("&", "?", "");
            query.forEach((name, value) -> joiner.add(encode(name) + "=" + encode(value)));
            uri.append(joiner);
        }
        return URI.create(uri.toString());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
