package com.osint.correlation.cluster;

import com.osint.correlation.api.CorrelationOptions;
import com.osint.correlation.core.model.CorrelationEdge;
import com.osint.correlation.core.model.Entity;
import com.osint.correlation.core.model.EntityCluster;
import com.osint.correlation.core.model.EntityType;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.core.model.SourcedValue;
import com.osint.correlation.similarity.TextNormalizer;
import com.osint.correlation.tracing.NoOpTracingService;
import com.osint.correlation.tracing.PipelineStage;
import com.osint.correlation.tracing.Span;
import com.osint.correlation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Groups correlated observations into entities.
 *
 * <p>Edges are applied strongest first to a disjoint set over the observation ids. Merging two
 * clusters through an edge of confidence {@code e} gives the union
 * {@code min(e, confA * e, confB * e)}; a singleton starts at 1.0. A union whose result would fall
 * below the configured merge floor is refused and reported in
 * {@link ClusteringResult#refusedMerges()} instead. Edges inside one cluster change nothing, so
 * re-applying the same edges to the clusters of an earlier pass is a no-op.</p>
 *
 * <p>Each final cluster becomes one {@link Entity}: attributes are the union of the member
 * observations' attributes tagged with their source, and diverging identifiers are flagged on the
 * entity rather than resolved.</p>
 */
public class EntityClusterBuilder {
    private static final Logger log = LoggerFactory.getLogger(EntityClusterBuilder.class);

    private final double minClusterConfidence;
    private final TracingService tracingService;

    public EntityClusterBuilder(CorrelationOptions options) {
        this(options.getMinClusterConfidence(), new NoOpTracingService());
    }

    public EntityClusterBuilder(double minClusterConfidence, TracingService tracingService) {
        if (Double.isNaN(minClusterConfidence) || minClusterConfidence < 0.0 || minClusterConfidence > 1.0) {
            throw new IllegalArgumentException("minClusterConfidence must be between 0.0 and 1.0");
        }
        this.minClusterConfidence = minClusterConfidence;
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    public ClusteringResult build(Collection<Observation> observations, Collection<CorrelationEdge> edges) {
        return build(observations, edges, List.of());
    }

    /**
     * Clusters the found observations.
     *
     * @param observations observations of the pass; only {@code found} ones become entity members
     * @param edges        correlation edges between them
     * @param seeds        clusters of an earlier pass, restored with their confidence before any edge
     * @throws IllegalArgumentException when two observations share an id
     */
    public ClusteringResult build(Collection<Observation> observations, Collection<CorrelationEdge> edges,
                                  List<EntityCluster> seeds) {
        List<Observation> members = observations.stream()
                .filter(Observation::found)
                .sorted(Comparator.comparing(Observation::id))
                .toList();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < members.size(); i++) {
            if (index.put(members.get(i).id(), i) != null) {
                throw new IllegalArgumentException("Duplicate observation id: " + members.get(i).id());
            }
        }

        try (Span span = tracingService.startSpan(PipelineStage.CLUSTER,
                Map.of("observations", (long) members.size(), "edges", (long) edges.size()))) {
            DisjointSet sets = new DisjointSet(members.size());
            restoreSeeds(sets, index, seeds);

            List<CorrelationEdge> ordered = new ArrayList<>(edges);
            ordered.sort(CorrelationEdge.STRONGEST_FIRST);
            List<CorrelationEdge> refused = new ArrayList<>();
            int skipped = 0;
            for (CorrelationEdge edge : ordered) {
                Integer a = index.get(edge.sourceObservationId());
                Integer b = index.get(edge.targetObservationId());
                if (a == null || b == null) {
                    skipped++;
                    log.debug("cluster.edge.skipped source={} target={} reason=unknown-observation",
                            edge.sourceObservationId(), edge.targetObservationId());
                    continue;
                }
                if (sets.union(a, b, edge.confidence(), minClusterConfidence) == DisjointSet.UnionOutcome.BELOW_FLOOR) {
                    log.info("cluster.merge.refused source={} target={} edge={} decayed={} floor={}",
                            edge.sourceObservationId(), edge.targetObservationId(), edge.confidence(),
                            sets.mergedConfidence(a, b, edge.confidence()), minClusterConfidence);
                    refused.add(edge);
                }
            }

            Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
            for (int i = 0; i < members.size(); i++) {
                groups.computeIfAbsent(sets.find(i), k -> new ArrayList<>()).add(i);
            }

            List<EntityCluster> clusters = new ArrayList<>();
            List<Entity> entities = new ArrayList<>();
            Map<String, String> entityByObservation = new HashMap<>();
            Map<String, Integer> canonicalKeysUsed = new HashMap<>();
            for (Map.Entry<Integer, List<Integer>> group : groups.entrySet()) {
                List<Observation> clusterMembers = group.getValue().stream().map(members::get).toList();
                EntityCluster cluster = new EntityCluster(
                        clusterMembers.stream().map(Observation::id).toList(),
                        sets.confidenceOf(group.getKey()));
                Entity entity = toEntity(cluster, clusterMembers, canonicalKeysUsed);
                clusters.add(cluster);
                entities.add(entity);
                cluster.memberObservationIds().forEach(id -> entityByObservation.put(id, entity.getId()));
                if (entity.hasConflicts()) {
                    log.info("cluster.conflict canonical={} attributes={} members={}",
                            entity.getCanonicalValue(), entity.getConflicts(), cluster.size());
                }
            }

            List<CorrelationEdge> stillSeparate = refused.stream()
                    .filter(edge -> sets.find(index.get(edge.sourceObservationId()))
                            != sets.find(index.get(edge.targetObservationId())))
                    .toList();

            span.setAttribute("clusters", clusters.size());
            span.setAttribute("refused", stillSeparate.size());
            span.setStatus(Span.SpanStatus.OK);
            log.info("cluster.completed observations={} clusters={} refused={} skipped={}",
                    members.size(), clusters.size(), stillSeparate.size(), skipped);
            return new ClusteringResult(clusters, entities, entityByObservation, stillSeparate, skipped);
        }
    }

    private static void restoreSeeds(DisjointSet sets, Map<String, Integer> index, List<EntityCluster> seeds) {
        for (EntityCluster seed : seeds) {
            List<Integer> present = seed.memberObservationIds().stream()
                    .map(index::get)
                    .filter(Objects::nonNull)
                    .toList();
            if (present.isEmpty()) {
                continue;
            }
            int first = present.get(0);
            for (int member : present) {
                sets.seed(first, member, seed.confidence());
            }
        }
    }

    private static Entity toEntity(EntityCluster cluster, List<Observation> members,
                                   Map<String, Integer> canonicalKeysUsed) {
        EntityType type = cluster.size() > 1 ? EntityType.PERSON : singletonType(members.get(0));
        String canonical = canonicalValue(type, members);
        String key = Entity.canonicalKey(type, canonical);
        int seen = canonicalKeysUsed.merge(key, 1, Integer::sum);
        if (seen > 1) {
            // a refused merge left two clusters with the same handle
            canonical = canonical + "#" + seen;
        }

        Entity.Builder builder = Entity.builder()
                .type(type)
                .canonicalValue(canonical)
                .confidence(cluster.confidence())
                .memberObservationIds(cluster.memberObservationIds());
        for (Observation observation : members) {
            observation.attributes().forEach((name, value) -> {
                if (value != null) {
                    builder.attribute(name, new SourcedValue(value, observation.sourceId(), observation.id()));
                }
            });
            String queried = observation.queryValue();
            String identifier = TextNormalizer.normalizeEmail(queried) != null ? "email" : "username";
            if (!observation.attributes().containsKey(identifier)) {
                builder.attribute(identifier, new SourcedValue(queried, observation.sourceId(), observation.id()));
            }
        }
        return builder.build();
    }

    private static EntityType singletonType(Observation observation) {
        boolean emailQuery = TextNormalizer.normalizeEmail(observation.queryValue()) != null;
        return emailQuery && observation.attributeAsString("username") == null ? EntityType.EMAIL : EntityType.USERNAME;
    }

    /**
     * Most frequent normalised identifier among the members, ties to the lexicographically smallest.
     */
    static String canonicalValue(EntityType type, List<Observation> members) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Observation observation : members) {
            counts.merge(identifierOf(type, observation), 1, Integer::sum);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static String identifierOf(EntityType type, Observation observation) {
        String email = TextNormalizer.normalizeEmail(observation.attributeAsString("email"));
        if (email == null) {
            email = TextNormalizer.normalizeEmail(observation.queryValue());
        }
        if (type == EntityType.EMAIL && email != null) {
            return email;
        }
        String username = observation.attributeAsString("username");
        if (username == null && TextNormalizer.normalizeEmail(observation.queryValue()) == null) {
            username = observation.queryValue();
        }
        String handle = TextNormalizer.normalizeHandle(username);
        if (!handle.isEmpty()) {
            return handle;
        }
        if (email != null) {
            return email;
        }
        String queried = observation.queryValue().trim().toLowerCase(Locale.ROOT);
        return queried.isEmpty() ? observation.id() : queried;
    }
}
