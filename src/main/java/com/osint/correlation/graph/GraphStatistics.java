package com.osint.correlation.graph;

import com.osint.correlation.core.model.EntityType;
import com.osint.correlation.core.model.RelationshipType;

import java.util.Map;

/**
 * Summary counts over active entities and their relationships.
 */
public record GraphStatistics(
        int activeEntities,
        int mergedEntities,
        int relationships,
        Map<EntityType, Integer> entitiesByType,
        Map<RelationshipType, Integer> relationshipsByType,
        double averageRelationshipConfidence,
        int connectedComponents,
        int entitiesWithConflicts
) {
    public GraphStatistics {
        entitiesByType = Map.copyOf(entitiesByType);
        relationshipsByType = Map.copyOf(relationshipsByType);
    }
}
