package com.ryuqq.feed.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.feed.core.model.Payload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds event times in JSON payloads by field name.
 *
 * <p>The whole document is walked and every string value under one of the configured field names
 * that parses as an ISO-8601 instant is a candidate. The soonest candidate at or after {@code now}
 * wins; when every candidate is in the past the most recent one is used.</p>
 *
 * <p>Both {@code 2025-09-07T17:00:00Z} and the minute-precision {@code 2025-09-07T17:00Z} form are accepted.</p>
 */
public class JsonEventTimeExtractor implements EventTimeExtractor {

    private static final Logger log = LoggerFactory.getLogger(JsonEventTimeExtractor.class);

    private final ObjectMapper objectMapper;
    private final Set<String> fieldNames;

    public JsonEventTimeExtractor(ObjectMapper objectMapper, Set<String> fieldNames) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (fieldNames == null || fieldNames.isEmpty()) {
            throw new IllegalArgumentException("fieldNames cannot be null or empty");
        }
        this.objectMapper = objectMapper;
        this.fieldNames = Set.copyOf(fieldNames);
    }

    public JsonEventTimeExtractor(String fieldName) {
        this(new ObjectMapper(), Set.of(fieldName));
    }

    @Override
    public Optional<Instant> extract(Payload payload, Instant now) {
        if (payload == null || payload.isEmpty()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload.toByteArray());
        } catch (IOException e) {
            log.debug("Payload is not JSON, no event time derived: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null) {
            return Optional.empty();
        }

        Instant soonestUpcoming = null;
        Instant latestPast = null;
        Deque<JsonNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            JsonNode node = pending.pop();
            if (node.isArray()) {
                node.forEach(pending::push);
                continue;
            }
            if (!node.isObject()) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isContainerNode()) {
                    pending.push(value);
                } else if (fieldNames.contains(field.getKey()) && value.isTextual()) {
                    Instant candidate = parse(value.asText());
                    if (candidate == null) {
                        continue;
                    }
                    if (!candidate.isBefore(now)) {
                        if (soonestUpcoming == null || candidate.isBefore(soonestUpcoming)) {
                            soonestUpcoming = candidate;
                        }
                    } else if (latestPast == null || candidate.isAfter(latestPast)) {
                        latestPast = candidate;
                    }
                }
            }
        }
        return Optional.ofNullable(soonestUpcoming != null ? soonestUpcoming : latestPast);
    }

    private static Instant parse(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("Ignoring unparseable event time '{}'", text);
            return null;
        }
    }
}
