package com.osint.correlation.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable provenance record for an entity merge.
 */
public record MergeRecord(
        String id,
        String sourceEntityId,
        String targetEntityId,
        String sourceCanonicalValue,
        String targetCanonicalValue,
        double confidence,
        String reason,
        Instant timestamp
) {
    public MergeRecord {
        Objects.requireNonNull(sourceEntityId, "sourceEntityId is required");
        Objects.requireNonNull(targetEntityId, "targetEntityId is required");
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static MergeRecord of(Entity source, Entity target, String reason) {
        return new MergeRecord(null, source.getId(), target.getId(),
                source.getCanonicalValue(), target.getCanonicalValue(),
                target.getConfidence(), reason, null);
    }
}
