package com.osint.correlation.cluster;

import com.osint.correlation.core.model.CorrelationEdge;
import com.osint.correlation.core.model.Entity;
import com.osint.correlation.core.model.EntityCluster;

import java.util.List;
import java.util.Map;

/**
 * Output of one clustering pass.
 *
 * @param clusters         clusters sorted by their first member id
 * @param entities         one entity per cluster, same order
 * @param entityByObservation observation id to the id of the entity built for its cluster
 * @param refusedMerges    edges whose union would have fallen below the merge floor
 * @param skippedEdges     edges naming an observation that was not part of the pass
 */
public record ClusteringResult(
        List<EntityCluster> clusters,
        List<Entity> entities,
        Map<String, String> entityByObservation,
        List<CorrelationEdge> refusedMerges,
        int skippedEdges
) {
    public ClusteringResult {
        clusters = List.copyOf(clusters);
        entities = List.copyOf(entities);
        entityByObservation = Map.copyOf(entityByObservation);
        refusedMerges = List.copyOf(refusedMerges);
    }

    public int conflictCount() {
        return (int) entities.stream().filter(Entity::hasConflicts).count();
    }
}
