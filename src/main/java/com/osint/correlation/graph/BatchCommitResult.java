package com.osint.correlation.graph;

import com.osint.correlation.core.model.Entity;
import com.osint.correlation.core.model.Relationship;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link RelationshipGraph#applyBatch(GraphBatch)}.
 *
 * @param entities      resident entities after the commit, in batch order
 * @param relationships resident relationships after the commit, in batch order
 * @param entityIdMap   batch entity id to resident entity id
 * @param rejected      writes dropped for breaking an invariant; the rest committed
 * @param version       graph version produced by the commit
 */
public record BatchCommitResult(
        List<Entity> entities,
        List<Relationship> relationships,
        Map<String, String> entityIdMap,
        List<RejectedWrite> rejected,
        long version
) {
    public BatchCommitResult {
        entities = List.copyOf(entities);
        relationships = List.copyOf(relationships);
        entityIdMap = Map.copyOf(entityIdMap);
        rejected = List.copyOf(rejected);
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

    /**
     * A staged write the graph refused.
     *
     * @param description what was written (entity or relationship key)
     * @param reason      invariant that would have been broken
     */
    public record RejectedWrite(String description, String reason) {
    }
}
