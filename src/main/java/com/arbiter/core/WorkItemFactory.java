package com.arbiter.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;

/**
 * Factory for creating WorkItems from JSON submission payloads.
 * <p>
 * Recognised fields: {@code id} (required), {@code priority} (tier name or level 1..5,
 * default NORMAL), {@code created_at} (ISO-8601, default now), {@code estimated_duration_ms},
 * {@code resources} (object keyed by resource key, e.g. {@code "bandwidth-kbps": 4096}),
 * {@code retry_count} and {@code max_retries}.
 */
public class WorkItemFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final Set<String> FIELDS = Set.of(
            "id", "priority", "created_at", "estimated_duration_ms", "resources", "retry_count", "max_retries");

    private final Clock clock;

    public WorkItemFactory() {
        this(Clock.systemUTC());
    }

    public WorkItemFactory(Clock clock) {
        this.clock = clock;
    }

    /**
     * Create a WorkItem from a JSON payload.
     *
     * @throws IllegalArgumentException if the payload is not valid JSON or has invalid fields
     */
    public WorkItem fromJson(String jsonPayload) {
        if (jsonPayload == null || jsonPayload.isBlank()) {
            throw new IllegalArgumentException("Work item payload cannot be empty");
        }
        Map<String, Object> fields = parseJson(jsonPayload);
        for (String field : fields.keySet()) {
            if (!FIELDS.contains(field)) {
                throw new IllegalArgumentException("Unknown work item field: " + field);
            }
        }

        Object id = fields.get("id");
        if (id == null) {
            throw new IllegalArgumentException("Work item payload has no id");
        }

        WorkItem.Builder builder = WorkItem.builder(id.toString(), parseTier(fields.get("priority")))
                .createdAt(parseInstant(fields.get("created_at")));

        Object duration = fields.get("estimated_duration_ms");
        if (duration != null) {
            builder.estimatedDuration(Duration.ofMillis(asLong("estimated_duration_ms", duration)));
        }
        Object resources = fields.get("resources");
        if (resources != null) {
            if (!(resources instanceof Map<?, ?> requirements)) {
                throw new IllegalArgumentException("Field 'resources' must be an object");
            }
            for (Map.Entry<?, ?> entry : requirements.entrySet()) {
                String key = entry.getKey().toString();
                builder.require(ResourceType.fromKey(key), asInt(key, entry.getValue()));
            }
        }
        if (fields.get("retry_count") != null) {
            builder.retryCount(asInt("retry_count", fields.get("retry_count")));
        }
        if (fields.get("max_retries") != null) {
            builder.maxRetries(asInt("max_retries", fields.get("max_retries")));
        }
        return builder.build();
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    private static Tier parseTier(Object value) {
        if (value == null) {
            return Tier.NORMAL;
        }
        if (value instanceof Number) {
            return Tier.fromLevel(asInt("priority", value));
        }
        return Tier.fromName(value.toString());
    }

    private Instant parseInstant(Object value) {
        if (value == null) {
            return clock.instant();
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Field 'created_at' is not an ISO-8601 instant: " + value, e);
        }
    }

    private static int asInt(String field, Object value) {
        try {
            return Math.toIntExact(asLong(field, value));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Field '" + field + "' is out of range: " + value, e);
        }
    }

    private static long asLong(String field, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Field '" + field + "' is out of range: " + value, e);
            }
        }
        throw new IllegalArgumentException("Field '" + field + "' must be a whole number, got: " + value);
    }
}
