package com.osint.correlation.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * A fused identity in the relationship graph.
 *
 * <p>Instances are immutable: graph mutations build a new instance through
 * {@link #builder(Entity)} so readers holding a snapshot never observe a half-applied merge.
 * Attribute values carry their contributing source. When a cluster holds more than one
 * distinct value for an identifying attribute (see {@link #IDENTIFIER_ATTRIBUTES}) the
 * attribute is listed in {@link #getConflicts()}; both values are kept.</p>
 */
public final class Entity {

    /**
     * Attributes expected to identify a single person. Diverging values are flagged as conflicts.
     */
    public static final Set<String> IDENTIFIER_ATTRIBUTES = Set.of("email", "phone");

    private final String id;
    private final EntityType type;
    private final String canonicalValue;
    private final Map<String, List<SourcedValue>> attributes;
    private final double confidence;
    private final EntityStatus status;
    private final String mergedInto;
    private final Set<String> memberObservationIds;
    private final Set<String> conflicts;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Entity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = builder.type;
        this.canonicalValue = builder.canonicalValue;
        this.attributes = copyAttributes(builder.attributes);
        this.confidence = builder.confidence;
        this.status = builder.status != null ? builder.status : EntityStatus.ACTIVE;
        this.mergedInto = builder.mergedInto;
        this.memberObservationIds = Collections.unmodifiableSet(new TreeSet<>(builder.memberObservationIds));
        this.conflicts = detectConflicts(this.attributes);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public EntityType getType() {
        return type;
    }

    public String getCanonicalValue() {
        return canonicalValue;
    }

    /**
     * Key under which the graph deduplicates entities.
     */
    public String getCanonicalKey() {
        return canonicalKey(type, canonicalValue);
    }

    public Map<String, List<SourcedValue>> getAttributes() {
        return attributes;
    }

    public List<SourcedValue> getAttribute(String name) {
        return attributes.getOrDefault(name, List.of());
    }

    public double getConfidence() {
        return confidence;
    }

    public EntityStatus getStatus() {
        return status;
    }

    /**
     * Id of the entity that absorbed this one, or null while active.
     */
    public String getMergedInto() {
        return mergedInto;
    }

    public Set<String> getMemberObservationIds() {
        return memberObservationIds;
    }

    public Set<String> getConflicts() {
        return conflicts;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return status == EntityStatus.ACTIVE;
    }

    public boolean isMerged() {
        return status == EntityStatus.MERGED;
    }

    /**
     * Returns a builder pre-filled with this entity plus the attributes and members of
     * {@code other}. Identity fields (id, type, canonical value, confidence) stay this entity's.
     */
    public Builder absorbing(Entity other) {
        Builder builder = builder(this);
        other.attributes.forEach((name, values) -> values.forEach(v -> builder.attribute(name, v)));
        builder.memberObservationIds(other.memberObservationIds);
        return builder.updatedAt(Instant.now());
    }

    public static String canonicalKey(EntityType type, String canonicalValue) {
        return type.name() + ":" + canonicalValue.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, List<SourcedValue>> copyAttributes(Map<String, Set<SourcedValue>> source) {
        Map<String, List<SourcedValue>> copy = new TreeMap<>();
        source.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    private static Set<String> detectConflicts(Map<String, List<SourcedValue>> attributes) {
        Set<String> flagged = new TreeSet<>();
        for (String name : IDENTIFIER_ATTRIBUTES) {
            Set<String> distinct = new TreeSet<>();
            for (SourcedValue value : attributes.getOrDefault(name, List.of())) {
                distinct.add(value.value().toString().trim().toLowerCase(Locale.ROOT));
            }
            if (distinct.size() > 1) {
                flagged.add(name);
            }
        }
        return Collections.unmodifiableSet(flagged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", canonicalValue='" + canonicalValue + '\'' +
                ", status=" + status +
                ", confidence=" + confidence +
                ", members=" + memberObservationIds.size() +
                (conflicts.isEmpty() ? "" : ", conflicts=" + conflicts) +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Entity entity) {
        Builder builder = new Builder()
                .id(entity.id)
                .type(entity.type)
                .canonicalValue(entity.canonicalValue)
                .confidence(entity.confidence)
                .status(entity.status)
                .mergedInto(entity.mergedInto)
                .memberObservationIds(entity.memberObservationIds)
                .createdAt(entity.createdAt)
                .updatedAt(entity.updatedAt);
        entity.attributes.forEach((name, values) -> values.forEach(v -> builder.attribute(name, v)));
        return builder;
    }

    public static class Builder {
        private String id;
        private EntityType type;
        private String canonicalValue;
        private final Map<String, Set<SourcedValue>> attributes = new TreeMap<>();
        private double confidence = 1.0;
        private EntityStatus status;
        private String mergedInto;
        private final Set<String> memberObservationIds = new LinkedHashSet<>();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder canonicalValue(String canonicalValue) {
            this.canonicalValue = canonicalValue;
            return this;
        }

        public Builder attribute(String name, SourcedValue value) {
            attributes.computeIfAbsent(name, k -> new LinkedHashSet<>()).add(value);
            return this;
        }

        public Builder attribute(String name, Object value, String sourceId) {
            return attribute(name, new SourcedValue(value, sourceId, null));
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder status(EntityStatus status) {
            this.status = status;
            return this;
        }

        public Builder mergedInto(String mergedInto) {
            this.mergedInto = mergedInto;
            return this;
        }

        public Builder memberObservationId(String observationId) {
            this.memberObservationIds.add(observationId);
            return this;
        }

        public Builder memberObservationIds(Iterable<String> observationIds) {
            observationIds.forEach(this.memberObservationIds::add);
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

        public Entity build() {
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(canonicalValue, "canonicalValue is required");
            if (canonicalValue.isBlank()) {
                throw new IllegalArgumentException("canonicalValue must not be blank");
            }
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException(
                        "confidence must be between 0.0 and 1.0, got " + confidence);
            }
            if (status == EntityStatus.MERGED && mergedInto == null) {
                throw new IllegalArgumentException("a merged entity needs a mergedInto reference");
            }
            return new Entity(this);
        }
    }

    /**
     * Flattens the attribute values of one name into plain values, in insertion order.
     */
    public List<Object> values(String name) {
        List<Object> out = new ArrayList<>();
        for (SourcedValue value : getAttribute(name)) {
            out.add(value.value());
        }
        return out;
    }
}
