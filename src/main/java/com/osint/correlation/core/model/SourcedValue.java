package com.osint.correlation.core.model;

import java.util.Objects;

/**
 * An attribute value tagged with the source that contributed it.
 *
 * @param value         the attribute value
 * @param sourceId      the originating source (e.g. platform name)
 * @param observationId the observation the value was read from
 */
public record SourcedValue(Object value, String sourceId, String observationId) {

    public SourcedValue {
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
    }

    @Override
    public String toString() {
        return value + " (" + sourceId + ")";
    }
}
