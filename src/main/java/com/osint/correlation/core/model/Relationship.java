package com.osint.correlation.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Directed, typed edge between two entities.
 *
 * <p>A relationship is identified in the graph by {@link #getKey()}: the
 * (source, target, type) triple. Its confidence must be reproducible from its
 * evidence with the graph's combination rule, which the graph enforces on upsert.</p>
 */
public final class Relationship {

    private final String id;
    private final String sourceEntityId;
    private final String targetEntityId;
    private final RelationshipType type;
    private final double confidence;
    private final List<CorrelationResult> evidence;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Relationship(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.sourceEntityId = Objects.requireNonNull(builder.sourceEntityId, "sourceEntityId is required");
        this.targetEntityId = Objects.requireNonNull(builder.targetEntityId, "targetEntityId is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.confidence = builder.confidence;
        this.evidence = List.copyOf(builder.evidence);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getSourceEntityId() {
        return sourceEntityId;
    }

    public String getTargetEntityId() {
        return targetEntityId;
    }

    public RelationshipType getType() {
        return type;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<CorrelationResult> getEvidence() {
        return evidence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getKey() {
        return key(sourceEntityId, targetEntityId, type);
    }

    /**
     * Returns the endpoint opposite to {@code entityId}.
     */
    public String otherEnd(String entityId) {
        return sourceEntityId.equals(entityId) ? targetEntityId : sourceEntityId;
    }

    public boolean touches(String entityId) {
        return sourceEntityId.equals(entityId) || targetEntityId.equals(entityId);
    }

    public static String key(String sourceEntityId, String targetEntityId, RelationshipType type) {
        return sourceEntityId + "|" + targetEntityId + "|" + type.name();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "id='" + id + '\'' +
                ", sourceEntityId='" + sourceEntityId + '\'' +
                ", targetEntityId='" + targetEntityId + '\'' +
                ", type=" + type.getLabel() +
                ", confidence=" + confidence +
                ", evidence=" + evidence.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Relationship relationship) {
        return new Builder()
                .id(relationship.id)
                .sourceEntityId(relationship.sourceEntityId)
                .targetEntityId(relationship.targetEntityId)
                .type(relationship.type)
                .confidence(relationship.confidence)
                .evidence(relationship.evidence)
                .createdAt(relationship.createdAt)
                .updatedAt(relationship.updatedAt);
    }

    public static class Builder {
        private String id;
        private String sourceEntityId;
        private String targetEntityId;
        private RelationshipType type;
        private double confidence;
        private final List<CorrelationResult> evidence = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceEntityId(String sourceEntityId) {
            this.sourceEntityId = sourceEntityId;
            return this;
        }

        public Builder targetEntityId(String targetEntityId) {
            this.targetEntityId = targetEntityId;
            return this;
        }

        public Builder type(RelationshipType type) {
            this.type = type;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder evidence(List<CorrelationResult> evidence) {
            this.evidence.clear();
            this.evidence.addAll(evidence);
            return this;
        }

        public Builder addEvidence(CorrelationResult result) {
            this.evidence.add(result);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Relationship build() {
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException(
                        "confidence must be between 0.0 and 1.0, got " + confidence);
            }
            if (sourceEntityId != null && sourceEntityId.equals(targetEntityId)) {
                throw new IllegalArgumentException("relationship endpoints must differ: " + sourceEntityId);
            }
            return new Relationship(this);
        }
    }
}
