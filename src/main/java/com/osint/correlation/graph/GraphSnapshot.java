package com.osint.correlation.graph;

import com.osint.correlation.core.model.Entity;
import com.osint.correlation.core.model.Relationship;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time export of the whole graph. Merged entities are included so their
 * {@code mergedInto} back-references stay resolvable.
 *
 * @param nodes   entities sorted by id
 * @param edges   relationships sorted by key
 * @param version commit counter of the state the snapshot was taken from
 * @param takenAt capture time
 */
public record GraphSnapshot(List<Entity> nodes, List<Relationship> edges, long version, Instant takenAt) {

    public GraphSnapshot {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public List<Entity> activeNodes() {
        return nodes.stream().filter(Entity::isActive).toList();
    }
}
