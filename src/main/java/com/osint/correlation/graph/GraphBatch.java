package com.osint.correlation.graph;

import com.osint.correlation.core.model.Entity;
import com.osint.correlation.core.model.Relationship;

import java.util.ArrayList;
import java.util.List;

/**
 * Staged entity and relationship writes committed together by
 * {@link RelationshipGraph#applyBatch(GraphBatch)}. Relationships may point at entities staged
 * in the same batch by their batch-local id; the graph remaps them to resident ids.
 */
public final class GraphBatch {

    private final List<Entity> entities;
    private final List<Relationship> relationships;

    private GraphBatch(Builder builder) {
        this.entities = List.copyOf(builder.entities);
        this.relationships = List.copyOf(builder.relationships);
    }

    public List<Entity> getEntities() {
        return entities;
    }

    public List<Relationship> getRelationships() {
        return relationships;
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relationships.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Entity> entities = new ArrayList<>();
        private final List<Relationship> relationships = new ArrayList<>();

        public Builder entity(Entity entity) {
            entities.add(entity);
            return this;
        }

        public Builder relationship(Relationship relationship) {
            relationships.add(relationship);
            return this;
        }

        public int entityCount() {
            return entities.size();
        }

        public GraphBatch build() {
            return new GraphBatch(this);
        }
    }
}
