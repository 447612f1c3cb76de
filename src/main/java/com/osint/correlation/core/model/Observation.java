package com.osint.correlation.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single per-source, per-query finding produced by a source adapter.
 * Immutable once constructed.
 *
 * @param id           unique observation id within a batch (defaults to {@code sourceId:queryValue})
 * @param sourceId     the source (platform, site or service) that produced the finding
 * @param queryValue   the input that was queried (username, email, ...)
 * @param status       found / not_found / error
 * @param attributes   attribute name to value (display name, bio, location, connections, last_active...)
 * @param responseTime time the source took to answer, may be null when unknown
 * @param errorReason  failure description for {@link ObservationStatus#ERROR}, null otherwise
 */
public record Observation(
        String id,
        String sourceId,
        String queryValue,
        ObservationStatus status,
        Map<String, Object> attributes,
        Duration responseTime,
        String errorReason
) {
    public Observation {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(queryValue, "queryValue is required");
        Objects.requireNonNull(status, "status is required");
        if (id == null || id.isBlank()) {
            id = defaultId(sourceId, queryValue);
        }
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
        if (responseTime != null && responseTime.isNegative()) {
            throw new IllegalArgumentException("responseTime must not be negative");
        }
        if (status == ObservationStatus.ERROR && (errorReason == null || errorReason.isBlank())) {
            throw new IllegalArgumentException("errorReason is required for ERROR observations");
        }
    }

    public static String defaultId(String sourceId, String queryValue) {
        return sourceId + ":" + queryValue;
    }

    public static Observation found(String sourceId, String queryValue, Map<String, Object> attributes) {
        return new Observation(null, sourceId, queryValue, ObservationStatus.FOUND, attributes, null, null);
    }

    public static Observation notFound(String sourceId, String queryValue) {
        return new Observation(null, sourceId, queryValue, ObservationStatus.NOT_FOUND, Map.of(), null, null);
    }

    public static Observation error(String sourceId, String queryValue, String reason) {
        return new Observation(null, sourceId, queryValue, ObservationStatus.ERROR, Map.of(), null, reason);
    }

    public boolean found() {
        return status == ObservationStatus.FOUND;
    }

    public Observation withId(String newId) {
        return new Observation(newId, sourceId, queryValue, status, attributes, responseTime, errorReason);
    }

    public Observation withResponseTime(Duration newResponseTime) {
        return new Observation(id, sourceId, queryValue, status, attributes, newResponseTime, errorReason);
    }

    /**
     * Returns the attribute as a trimmed, non-empty string, or null.
     */
    public String attributeAsString(String key) {
        Object value = attributes.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Returns the attribute as a list of strings. Collections are flattened,
     * strings are split on commas. Missing attributes yield an empty list.
     */
    public List<String> attributeAsStrings(String key) {
        Object value = attributes.get(key);
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !item.toString().isBlank()) {
                    out.add(item.toString().trim());
                }
            }
        } else if (value != null) {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
        }
        return out;
    }

    /**
     * Returns the attribute as an instant. Accepts {@link Instant}, epoch millis
     * as a {@link Number}, or an ISO-8601 string. Unparseable values yield null.
     */
    public Instant attributeAsInstant(String key) {
        Object value = attributes.get(key);
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Instant.parse(text.trim());
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }
}
