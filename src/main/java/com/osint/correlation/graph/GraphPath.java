package com.osint.correlation.graph;

import com.osint.correlation.core.model.Relationship;

import java.util.List;

/**
 * A simple path through the graph.
 *
 * @param entityIds     visited entities, start and end included
 * @param relationships traversed relationships, one fewer than entities
 */
public record GraphPath(List<String> entityIds, List<Relationship> relationships) {

    public GraphPath {
        entityIds = List.copyOf(entityIds);
        relationships = List.copyOf(relationships);
        if (entityIds.isEmpty() || relationships.size() != entityIds.size() - 1) {
            throw new IllegalArgumentException("a path needs n entities and n-1 relationships");
        }
    }

    public int length() {
        return relationships.size();
    }

    public String start() {
        return entityIds.get(0);
    }

    public String end() {
        return entityIds.get(entityIds.size() - 1);
    }
}
