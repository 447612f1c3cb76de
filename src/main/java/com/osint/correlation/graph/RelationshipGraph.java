package com.osint.correlation.graph;

import com.osint.correlation.api.CorrelationOptions;
import com.osint.correlation.core.model.CorrelationResult;
import com.osint.correlation.core.model.Entity;
import com.osint.correlation.core.model.EntityStatus;
import com.osint.correlation.core.model.EntityType;
import com.osint.correlation.core.model.MergeRecord;
import com.osint.correlation.core.model.Relationship;
import com.osint.correlation.core.model.RelationshipType;
import com.osint.correlation.correlation.ConfidenceCombiner;
import com.osint.correlation.logging.LogContext;
import com.osint.correlation.metrics.MetricsService;
import com.osint.correlation.metrics.NoOpMetricsService;
import com.osint.correlation.tracing.NoOpTracingService;
import com.osint.correlation.tracing.PipelineStage;
import com.osint.correlation.tracing.Span;
import com.osint.correlation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory store of fused entities and typed relationships.
 *
 * <p>Reads run lock-free against the last committed state, an immutable value swapped in by
 * every write. Writes are serialised by a single lock, build the next state from a private draft
 * and publish it in one volatile store, so readers never observe a half-applied batch or merge.</p>
 *
 * <p>Every write copies the committed maps into its draft, so a single {@link #upsertEntity} or
 * {@link #upsertRelationship} costs time proportional to the whole graph. Bulk loads go through
 * {@link #applyBatch}, which pays that copy once for all of its writes.</p>
 *
 * <p>Entities are deduplicated by canonical key and relationships by (source, target, type). An
 * observation belongs to at most one live entity: an upsert whose members overlap another live
 * entity folds that entity into the resident, as a recorded merge. A relationship's confidence is always the {@link ConfidenceCombiner} result over its evidence,
 * the same rule the correlation engine uses for edges. Neighbour and path queries ignore
 * relationship direction.</p>
 */
public class RelationshipGraph {
    private static final Logger log = LoggerFactory.getLogger(RelationshipGraph.class);

    static final int MAX_PATHS = 1000;

    private final ConfidenceCombiner combiner;
    private final int maxTraversalDepth;
    private final MergeLedger mergeLedger;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile GraphState state = GraphState.EMPTY;

    public RelationshipGraph(CorrelationOptions options) {
        this(new ConfidenceCombiner(options.getAlgorithmWeights()), options.getMaxTraversalDepth(),
                new MergeLedger(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public RelationshipGraph(ConfidenceCombiner combiner, int maxTraversalDepth, MergeLedger mergeLedger,
                             MetricsService metricsService, TracingService tracingService) {
        if (maxTraversalDepth <= 0) {
            throw new IllegalArgumentException("maxTraversalDepth must be positive");
        }
        this.combiner = Objects.requireNonNull(combiner, "combiner is required");
        this.maxTraversalDepth = maxTraversalDepth;
        this.mergeLedger = Objects.requireNonNull(mergeLedger, "mergeLedger is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    /**
     * Inserts the entity, or merges it into the resident entity with the same canonical key
     * (attribute union, higher confidence wins). Live entities sharing a member observation with
     * the resident are folded into it. Copies the whole committed state; prefer
     * {@link #applyBatch} for many writes.
     *
     * @return the resident entity after the write
     * @throws GraphInvariantException for a merged entity or a reused id
     */
    public Entity upsertEntity(Entity entity) {
        return write(draft -> draft.upsertEntity(entity));
    }

    /**
     * Inserts the relationship, or merges its evidence into the resident one with the same
     * (source, target, type) key and recomputes confidence from the combined evidence. Copies the
     * whole committed state; prefer {@link #applyBatch} for many writes.
     *
     * @return the resident relationship after the write
     * @throws GraphInvariantException when an endpoint is missing or merged
     */
    public Relationship upsertRelationship(Relationship relationship) {
        return write(draft -> draft.upsertRelationship(relationship));
    }

    /**
     * Commits all staged writes as one atomic unit. Writes that break an invariant are dropped and
     * reported; the others commit together.
     */
    public BatchCommitResult applyBatch(GraphBatch batch) {
        try (Span span = tracingService.startSpan(PipelineStage.GRAPH_COMMIT,
                Map.of("entities", (long) batch.getEntities().size(),
                        "relationships", (long) batch.getRelationships().size()))) {
            writeLock.lock();
            try {
                Draft draft = new Draft(state);
                Map<String, String> idMap = new LinkedHashMap<>();
                Map<String, Entity> committedEntities = new LinkedHashMap<>();
                List<BatchCommitResult.RejectedWrite> rejected = new ArrayList<>();

                for (Entity entity : batch.getEntities()) {
                    try {
                        Entity resident = draft.upsertEntity(entity);
                        idMap.put(entity.getId(), resident.getId());
                        committedEntities.put(resident.getId(), resident);
                    } catch (GraphInvariantException e) {
                        rejected.add(reject("entity " + entity.getCanonicalKey(), e));
                    }
                }
                // a later entity of the batch may have folded an earlier resident
                idMap.replaceAll((stagedId, residentId) -> draft.liveEntity(residentId).getId());

                Map<String, Relationship> committedRelationships = new LinkedHashMap<>();
                for (Relationship staged : batch.getRelationships()) {
                    String sourceId = idMap.getOrDefault(staged.getSourceEntityId(), staged.getSourceEntityId());
                    String targetId = idMap.getOrDefault(staged.getTargetEntityId(), staged.getTargetEntityId());
                    String description = "relationship " + Relationship.key(sourceId, targetId, staged.getType());
                    if (sourceId.equals(targetId)) {
                        rejected.add(reject(description, new GraphInvariantException(
                                "both endpoints resolve to entity " + sourceId)));
                        continue;
                    }
                    try {
                        Relationship resident = draft.upsertRelationship(Relationship.builder(staged)
                                .sourceEntityId(sourceId)
                                .targetEntityId(targetId)
                                .build());
                        committedRelationships.put(resident.getKey(), resident);
                    } catch (GraphInvariantException e) {
                        rejected.add(reject(description, e));
                    }
                }

                GraphState committed = draft.commit();
                state = committed;
                draft.merges.forEach(mergeLedger::record);
                // entities may have absorbed later writes of the same batch
                List<Entity> finalEntities = committedEntities.keySet().stream()
                        .map(id -> follow(committed.entities, id))
                        .filter(Objects::nonNull)
                        .distinct()
                        .toList();
                List<Relationship> finalRelationships = committedRelationships.keySet().stream()
                        .map(committed.relationships::get)
                        .filter(Objects::nonNull)
                        .toList();

                span.setAttribute("rejected", rejected.size());
                span.setAttribute("folded", draft.merges.size());
                span.setStatus(Span.SpanStatus.OK);
                log.info("graph.batch.committed entities={} relationships={} rejected={} folded={} version={}",
                        finalEntities.size(), finalRelationships.size(), rejected.size(), draft.merges.size(),
                        committed.version);
                return new BatchCommitResult(finalEntities, finalRelationships, idMap, rejected, committed.version);
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            } finally {
                writeLock.unlock();
            }
        }
    }

    /**
     * Merges {@code sourceId} into {@code targetId}: the target absorbs the source's attributes and
     * members, relationships are re-pointed to the target, and the source is kept as MERGED with a
     * back-reference.
     *
     * @throws GraphInvariantException when either entity is missing or merged, or both are the same
     */
    public MergeRecord mergeEntities(String sourceId, String targetId, String reason) {
        try (LogContext ctx = LogContext.forMerge(sourceId, targetId)) {
            return write(draft -> draft.merge(sourceId, targetId, reason));
        }
    }

    private <T> T write(Function<Draft, T> operation) {
        writeLock.lock();
        try {
            Draft draft = new Draft(state);
            T result = operation.apply(draft);
            state = draft.commit();
            draft.merges.forEach(mergeLedger::record);
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    private BatchCommitResult.RejectedWrite reject(String description, GraphInvariantException e) {
        metricsService.incrementWriteRejected();
        log.warn("graph.write.rejected write={} reason={}", description, e.getMessage());
        return new BatchCommitResult.RejectedWrite(description, e.getMessage());
    }

    public Optional<Entity> getEntity(String entityId) {
        return Optional.ofNullable(state.entities.get(entityId));
    }

    /**
     * Follows {@code mergedInto} references to the live entity.
     */
    public Optional<Entity> resolve(String entityId) {
        return Optional.ofNullable(follow(state.entities, entityId));
    }

    private static Entity follow(Map<String, Entity> entities, String entityId) {
        Entity entity = entityId == null ? null : entities.get(entityId);
        Set<String> visited = new HashSet<>();
        while (entity != null && entity.isMerged() && visited.add(entity.getId())) {
            entity = entities.get(entity.getMergedInto());
        }
        return entity != null && entity.isActive() ? entity : null;
    }

    public Optional<Entity> findByCanonicalKey(EntityType type, String canonicalValue) {
        GraphState current = state;
        String id = current.canonicalIndex.get(Entity.canonicalKey(type, canonicalValue));
        return id == null ? Optional.empty() : resolve(id);
    }

    public Optional<Relationship> getRelationship(String sourceId, String targetId, RelationshipType type) {
        return Optional.ofNullable(state.relationships.get(Relationship.key(sourceId, targetId, type)));
    }

    public List<Entity> neighbors(String entityId) {
        return neighbors(entityId, null);
    }

    /**
     * Entities directly connected to {@code entityId} in either direction.
     *
     * @param type relationship type filter, or null for all types
     */
    public List<Entity> neighbors(String entityId, RelationshipType type) {
        GraphState current = state;
        Map<String, Entity> found = new LinkedHashMap<>();
        for (String key : current.incidence.getOrDefault(entityId, Set.of())) {
            Relationship relationship = current.relationships.get(key);
            if (type == null || relationship.getType() == type) {
                String other = relationship.otherEnd(entityId);
                found.putIfAbsent(other, current.entities.get(other));
            }
        }
        return List.copyOf(found.values());
    }

    /**
     * Simple paths from {@code fromId} to {@code toId}, shortest first, found breadth-first.
     * The depth is clamped to the configured maximum traversal depth and at most
     * {@value #MAX_PATHS} paths are returned.
     *
     * @return the paths, empty when none exists within the depth
     */
    public List<GraphPath> pathsWithinDepth(String fromId, String toId, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative");
        }
        GraphState current = state;
        if (!current.isActive(fromId) || !current.isActive(toId)) {
            return List.of();
        }
        if (fromId.equals(toId)) {
            return List.of(new GraphPath(List.of(fromId), List.of()));
        }
        int depth = Math.min(maxDepth, maxTraversalDepth);

        List<GraphPath> paths = new ArrayList<>();
        Deque<GraphPath> queue = new ArrayDeque<>();
        queue.add(new GraphPath(List.of(fromId), List.of()));
        while (!queue.isEmpty()) {
            GraphPath partial = queue.poll();
            if (partial.length() >= depth) {
                continue;
            }
            String last = partial.end();
            for (String key : current.incidence.getOrDefault(last, Set.of())) {
                Relationship relationship = current.relationships.get(key);
                String next = relationship.otherEnd(last);
                if (partial.entityIds().contains(next)) {
                    continue;
                }
                GraphPath extended = extend(partial, next, relationship);
                if (next.equals(toId)) {
                    paths.add(extended);
                    if (paths.size() >= MAX_PATHS) {
                        log.debug("graph.paths.capped from={} to={} cap={}", fromId, toId, MAX_PATHS);
                        return paths;
                    }
                } else {
                    queue.add(extended);
                }
            }
        }
        return paths;
    }

    private static GraphPath extend(GraphPath path, String next, Relationship via) {
        List<String> ids = new ArrayList<>(path.entityIds());
        ids.add(next);
        List<Relationship> relationships = new ArrayList<>(path.relationships());
        relationships.add(via);
        return new GraphPath(ids, relationships);
    }

    /**
     * Relationships matching every given filter.
     *
     * @param entityId      endpoint filter, or null
     * @param type          type filter, or null
     * @param minConfidence inclusive confidence floor
     */
    public List<Relationship> findRelationships(String entityId, RelationshipType type, double minConfidence) {
        GraphState current = state;
        Iterable<String> keys = entityId != null
                ? current.incidence.getOrDefault(entityId, Set.of())
                : current.relationships.keySet();
        List<Relationship> matches = new ArrayList<>();
        for (String key : keys) {
            Relationship relationship = current.relationships.get(key);
            if ((type == null || relationship.getType() == type) && relationship.getConfidence() >= minConfidence) {
                matches.add(relationship);
            }
        }
        return matches;
    }

    /**
     * Full, consistent snapshot: every node and edge comes from the same committed state.
     */
    public GraphSnapshot exportGraph() {
        GraphState current = state;
        return new GraphSnapshot(new ArrayList<>(current.entities.values()),
                new ArrayList<>(current.relationships.values()), current.version, Instant.now());
    }

    public GraphStatistics statistics() {
        GraphState current = state;
        Map<EntityType, Integer> byType = new EnumMap<>(EntityType.class);
        int active = 0;
        int merged = 0;
        int withConflicts = 0;
        for (Entity entity : current.entities.values()) {
            if (entity.isActive()) {
                active++;
                byType.merge(entity.getType(), 1, Integer::sum);
                if (entity.hasConflicts()) {
                    withConflicts++;
                }
            } else {
                merged++;
            }
        }
        Map<RelationshipType, Integer> byRelationshipType = new EnumMap<>(RelationshipType.class);
        double confidenceSum = 0.0;
        for (Relationship relationship : current.relationships.values()) {
            byRelationshipType.merge(relationship.getType(), 1, Integer::sum);
            confidenceSum += relationship.getConfidence();
        }
        int relationshipCount = current.relationships.size();
        double average = relationshipCount == 0 ? 0.0 : confidenceSum / relationshipCount;
        return new GraphStatistics(active, merged, relationshipCount, byType, byRelationshipType,
                average, countComponents(current), withConflicts);
    }

    private static int countComponents(GraphState current) {
        Set<String> seen = new HashSet<>();
        int components = 0;
        for (Entity entity : current.entities.values()) {
            if (!entity.isActive() || !seen.add(entity.getId())) {
                continue;
            }
            components++;
            Deque<String> stack = new ArrayDeque<>();
            stack.push(entity.getId());
            while (!stack.isEmpty()) {
                String id = stack.pop();
                for (String key : current.incidence.getOrDefault(id, Set.of())) {
                    String other = current.relationships.get(key).otherEnd(id);
                    if (seen.add(other)) {
                        stack.push(other);
                    }
                }
            }
        }
        return components;
    }

    public int entityCount() {
        return (int) state.entities.values().stream().filter(Entity::isActive).count();
    }

    public int relationshipCount() {
        return state.relationships.size();
    }

    public long version() {
        return state.version;
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    public ConfidenceCombiner getCombiner() {
        return combiner;
    }

    /**
     * Immutable committed state.
     */
    private static final class GraphState {
        static final GraphState EMPTY = new GraphState(Map.of(), Map.of(), Map.of(), Map.of(), 0);

        final Map<String, Entity> entities;
        final Map<String, String> canonicalIndex;
        final Map<String, Relationship> relationships;
        final Map<String, Set<String>> incidence;
        final long version;

        GraphState(Map<String, Entity> entities, Map<String, String> canonicalIndex,
                   Map<String, Relationship> relationships, Map<String, Set<String>> incidence, long version) {
            this.entities = entities;
            this.canonicalIndex = canonicalIndex;
            this.relationships = relationships;
            this.incidence = incidence;
            this.version = version;
        }

        boolean isActive(String entityId) {
            Entity entity = entities.get(entityId);
            return entity != null && entity.isActive();
        }
    }

    /**
     * Private mutable copy of a state. Every operation validates before it mutates, so a rejected
     * write leaves the draft untouched.
     */
    private final class Draft {
        private final Map<String, Entity> entities;
        private final Map<String, String> canonicalIndex;
        private final Map<String, Relationship> relationships;
        private final Map<String, Set<String>> incidence;
        private final long baseVersion;
        private final List<MergeRecord> merges = new ArrayList<>();

        Draft(GraphState base) {
            this.entities = new TreeMap<>(base.entities);
            this.canonicalIndex = new TreeMap<>(base.canonicalIndex);
            this.relationships = new TreeMap<>(base.relationships);
            this.incidence = new TreeMap<>();
            base.incidence.forEach((id, keys) -> incidence.put(id, new TreeSet<>(keys)));
            this.baseVersion = base.version;
        }

        Entity upsertEntity(Entity incoming) {
            if (!incoming.isActive()) {
                throw new GraphInvariantException("cannot upsert merged entity " + incoming.getId());
            }
            String key = incoming.getCanonicalKey();
            Entity resident = liveEntity(canonicalIndex.get(key));
            if (resident == null) {
                Entity clash = entities.get(incoming.getId());
                if (clash != null) {
                    throw new GraphInvariantException("entity id " + incoming.getId()
                            + " already used by " + clash.getCanonicalKey());
                }
                entities.put(incoming.getId(), incoming);
                canonicalIndex.put(key, incoming.getId());
                metricsService.incrementEntityCreated(incoming.getType());
                log.debug("graph.entity.created id={} key={} confidence={}",
                        incoming.getId(), key, incoming.getConfidence());
                return foldOverlapping(incoming);
            }

            double confidence = Math.max(resident.getConfidence(), incoming.getConfidence());
            Entity merged = resident.absorbing(incoming).confidence(confidence).build();
            if (merged.getAttributes().equals(resident.getAttributes())
                    && merged.getMemberObservationIds().equals(resident.getMemberObservationIds())
                    && confidence == resident.getConfidence()) {
                return resident;
            }
            entities.put(resident.getId(), merged);
            if (merged.hasConflicts() && !resident.hasConflicts()) {
                log.warn("graph.entity.conflict id={} key={} attributes={}",
                        merged.getId(), key, merged.getConflicts());
            }
            return foldOverlapping(merged);
        }

        /**
         * Merges every other live entity that shares a member observation with {@code resident}
         * into it, so an observation re-clustered under a new canonical key keeps one owner.
         */
        private Entity foldOverlapping(Entity resident) {
            Set<String> members = resident.getMemberObservationIds();
            if (members.isEmpty()) {
                return resident;
            }
            List<Entity> overlapping = entities.values().stream()
                    .filter(Entity::isActive)
                    .filter(other -> !other.getId().equals(resident.getId()))
                    .filter(other -> !Collections.disjoint(other.getMemberObservationIds(), members))
                    .toList();
            for (Entity other : overlapping) {
                Set<String> shared = new TreeSet<>(other.getMemberObservationIds());
                shared.retainAll(members);
                merge(other.getId(), resident.getId(), "shared observations " + shared);
                log.info("graph.entity.folded source={} sourceKey={} target={} targetKey={} shared={}",
                        other.getId(), other.getCanonicalKey(), resident.getId(), resident.getCanonicalKey(),
                        shared.size());
            }
            return entities.get(resident.getId());
        }

        Relationship upsertRelationship(Relationship incoming) {
            requireLive(incoming.getSourceEntityId(), incoming);
            requireLive(incoming.getTargetEntityId(), incoming);
            Relationship existing = relationships.get(incoming.getKey());
            Relationship resident = combine(existing, incoming);
            store(resident);
            return resident;
        }

        MergeRecord merge(String sourceId, String targetId, String reason) {
            if (Objects.equals(sourceId, targetId)) {
                throw new GraphInvariantException("cannot merge entity " + sourceId + " into itself");
            }
            Entity source = requireActive(sourceId);
            Entity target = requireActive(targetId);

            Entity absorbed = target.absorbing(source).build();
            Entity retired = Entity.builder(source)
                    .status(EntityStatus.MERGED)
                    .mergedInto(targetId)
                    .updatedAt(Instant.now())
                    .build();
            entities.put(targetId, absorbed);
            entities.put(sourceId, retired);
            canonicalIndex.replaceAll((key, id) -> id.equals(sourceId) ? targetId : id);

            for (String key : new ArrayList<>(incidence.getOrDefault(sourceId, Set.of()))) {
                Relationship relationship = relationships.get(key);
                unstore(relationship);
                String newSource = relationship.getSourceEntityId().equals(sourceId)
                        ? targetId : relationship.getSourceEntityId();
                String newTarget = relationship.getTargetEntityId().equals(sourceId)
                        ? targetId : relationship.getTargetEntityId();
                if (newSource.equals(newTarget)) {
                    continue;
                }
                Relationship repointed = Relationship.builder(relationship)
                        .sourceEntityId(newSource)
                        .targetEntityId(newTarget)
                        .updatedAt(Instant.now())
                        .build();
                store(combine(relationships.get(repointed.getKey()), repointed));
            }
            incidence.remove(sourceId);
            metricsService.incrementEntityMerged(target.getType());
            MergeRecord record = MergeRecord.of(source, absorbed, reason);
            merges.add(record);
            return record;
        }

        private Relationship combine(Relationship existing, Relationship incoming) {
            Set<CorrelationResult> evidence = new LinkedHashSet<>();
            if (existing != null) {
                evidence.addAll(existing.getEvidence());
            }
            evidence.addAll(incoming.getEvidence());
            OptionalDouble derived = combiner.combine(evidence);

            if (existing == null) {
                double confidence = derived.orElse(incoming.getConfidence());
                return Relationship.builder(incoming)
                        .evidence(new ArrayList<>(evidence))
                        .confidence(confidence)
                        .build();
            }
            double confidence = derived.orElse(Math.max(existing.getConfidence(), incoming.getConfidence()));
            if (evidence.size() == existing.getEvidence().size() && confidence == existing.getConfidence()) {
                return existing;
            }
            return Relationship.builder(existing)
                    .evidence(new ArrayList<>(evidence))
                    .confidence(confidence)
                    .updatedAt(Instant.now())
                    .build();
        }

        private void store(Relationship relationship) {
            relationships.put(relationship.getKey(), relationship);
            incidence.computeIfAbsent(relationship.getSourceEntityId(), k -> new TreeSet<>()).add(relationship.getKey());
            incidence.computeIfAbsent(relationship.getTargetEntityId(), k -> new TreeSet<>()).add(relationship.getKey());
        }

        private void unstore(Relationship relationship) {
            relationships.remove(relationship.getKey());
            for (String endpoint : List.of(relationship.getSourceEntityId(), relationship.getTargetEntityId())) {
                Set<String> keys = incidence.get(endpoint);
                if (keys != null) {
                    keys.remove(relationship.getKey());
                }
            }
        }

        Entity liveEntity(String entityId) {
            return follow(entities, entityId);
        }

        private void requireLive(String entityId, Relationship relationship) {
            Entity entity = entities.get(entityId);
            if (entity == null) {
                throw new GraphInvariantException("relationship " + relationship.getType().getLabel()
                        + " references missing entity " + entityId);
            }
            if (!entity.isActive()) {
                throw new GraphInvariantException("relationship " + relationship.getType().getLabel()
                        + " references merged entity " + entityId + " (merged into " + entity.getMergedInto() + ")");
            }
        }

        private Entity requireActive(String entityId) {
            Entity entity = entities.get(entityId);
            if (entity == null) {
                throw new GraphInvariantException("entity not found: " + entityId);
            }
            if (!entity.isActive()) {
                throw new GraphInvariantException("entity " + entityId + " is already merged into "
                        + entity.getMergedInto());
            }
            return entity;
        }

        GraphState commit() {
            Map<String, Set<String>> frozenIncidence = new TreeMap<>();
            incidence.forEach((id, keys) -> {
                if (!keys.isEmpty()) {
                    frozenIncidence.put(id, Collections.unmodifiableSet(keys));
                }
            });
            return new GraphState(
                    Collections.unmodifiableMap(entities),
                    Collections.unmodifiableMap(canonicalIndex),
                    Collections.unmodifiableMap(relationships),
                    Collections.unmodifiableMap(frozenIncidence),
                    baseVersion + 1);
        }
    }
}
