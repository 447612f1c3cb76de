package com.osint.correlation.cluster;

import com.osint.correlation.core.model.CorrelationEdge;
import com.osint.correlation.core.model.CorrelationResult;
import com.osint.correlation.core.model.Entity;
import com.osint.correlation.core.model.EntityType;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.core.model.Relationship;
import com.osint.correlation.core.model.RelationshipType;
import com.osint.correlation.core.model.SourcedValue;
import com.osint.correlation.correlation.AlgorithmWeights;
import com.osint.correlation.correlation.ConfidenceCombiner;
import com.osint.correlation.graph.GraphBatch;
import com.osint.correlation.similarity.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a clustering result into one graph batch.
 *
 * <p>Besides one entity per cluster the batch holds:</p>
 * <ul>
 *   <li>{@code same_identity} links for merges the cluster builder refused</li>
 *   <li>EMAIL, DOMAIN and IP entities read from {@code email}, {@code website} and
 *       {@code ip_address} attributes, linked {@code associated_with}</li>
 *   <li>{@code follows} links where a contact list names a handle of another cluster</li>
 *   <li>{@code mentions} links for {@code @handle} references in a bio</li>
 * </ul>
 * Derived links carry {@value AlgorithmWeights#ATTRIBUTE_LINK} evidence; their confidence is the
 * combiner's result over it, so the graph can re-derive it.
 */
public class ClusterGraphMapper {
    private static final Logger log = LoggerFactory.getLogger(ClusterGraphMapper.class);

    static final double ATTRIBUTE_CONFIDENCE = 1.0;
    static final double FOLLOWS_CONFIDENCE = 0.9;
    static final double MENTIONS_CONFIDENCE = 0.6;
    private static final Pattern MENTION = Pattern.compile("(?<![\\w.])@([A-Za-z0-9_.]{2,})");

    private final ConfidenceCombiner combiner;

    public ClusterGraphMapper(ConfidenceCombiner combiner) {
        this.combiner = combiner;
    }

    public GraphBatch toBatch(ClusteringResult clustering, Collection<Observation> observations) {
        GraphBatch.Builder batch = GraphBatch.builder();
        clustering.entities().forEach(batch::entity);

        Map<String, Observation> byId = new LinkedHashMap<>();
        observations.stream()
                .filter(Observation::found)
                .sorted(Comparator.comparing(Observation::id))
                .forEach(o -> byId.put(o.id(), o));
        Map<String, String> entityByHandle = handleIndex(clustering, byId);

        int links = 0;
        for (CorrelationEdge refused : clustering.refusedMerges()) {
            String source = clustering.entityByObservation().get(refused.sourceObservationId());
            String target = clustering.entityByObservation().get(refused.targetObservationId());
            if (source != null && target != null && !source.equals(target)) {
                links += link(batch, source, target, RelationshipType.SAME_IDENTITY, refused.evidence()) ? 1 : 0;
            }
        }

        Map<String, Entity> clusterEntities = new LinkedHashMap<>();
        clustering.entities().forEach(e -> clusterEntities.put(e.getId(), e));
        Map<String, Entity> derived = new TreeMap<>();
        for (Observation observation : byId.values()) {
            String entityId = clustering.entityByObservation().get(observation.id());
            if (entityId == null) {
                continue;
            }
            Entity owner = clusterEntities.get(entityId);
            for (String email : observation.attributeAsStrings("email")) {
                String normalized = TextNormalizer.normalizeEmail(email);
                if (normalized != null) {
                    links += associate(batch, derived, owner, EntityType.EMAIL, normalized, "email", observation);
                }
            }
            String domain = TextNormalizer.domainOf(observation.attributeAsString("website"));
            if (domain != null) {
                links += associate(batch, derived, owner, EntityType.DOMAIN, domain, "website", observation);
            }
            for (String ip : observation.attributeAsStrings("ip_address")) {
                links += associate(batch, derived, owner, EntityType.IP, ip.trim(), "ip_address", observation);
            }

            for (String key : List.of("connections", "following")) {
                for (String handle : observation.attributeAsStrings(key)) {
                    String other = entityByHandle.get(TextNormalizer.normalizeHandle(handle));
                    links += contact(batch, entityId, other, RelationshipType.FOLLOWS, FOLLOWS_CONFIDENCE,
                            key, handle, observation);
                }
            }
            for (String handle : observation.attributeAsStrings("followers")) {
                String other = entityByHandle.get(TextNormalizer.normalizeHandle(handle));
                links += contact(batch, other, entityId, RelationshipType.FOLLOWS, FOLLOWS_CONFIDENCE,
                        "followers", handle, observation);
            }
            String bio = observation.attributeAsString("bio");
            if (bio != null) {
                Matcher matcher = MENTION.matcher(bio);
                while (matcher.find()) {
                    String other = entityByHandle.get(TextNormalizer.normalizeHandle(matcher.group(1)));
                    links += contact(batch, entityId, other, RelationshipType.MENTIONS, MENTIONS_CONFIDENCE,
                            "bio", matcher.group(1), observation);
                }
            }
        }
        derived.values().forEach(batch::entity);

        log.debug("graph.batch.mapped clusters={} derivedEntities={} relationships={}",
                clustering.entities().size(), derived.size(), links);
        return batch.build();
    }

    /**
     * Normalised handle to the entity whose cluster observed it. When several clusters observed the
     * same handle the first cluster in member order wins.
     */
    private static Map<String, String> handleIndex(ClusteringResult clustering, Map<String, Observation> byId) {
        Map<String, String> index = new TreeMap<>();
        for (int i = 0; i < clustering.clusters().size(); i++) {
            String entityId = clustering.entities().get(i).getId();
            for (String observationId : clustering.clusters().get(i).memberObservationIds()) {
                Observation observation = byId.get(observationId);
                if (observation == null) {
                    continue;
                }
                String username = observation.attributeAsString("username");
                if (username == null && TextNormalizer.normalizeEmail(observation.queryValue()) == null) {
                    username = observation.queryValue();
                }
                String handle = TextNormalizer.normalizeHandle(username);
                if (!handle.isEmpty()) {
                    index.putIfAbsent(handle, entityId);
                }
            }
        }
        return index;
    }

    private int associate(GraphBatch.Builder batch, Map<String, Entity> derived, Entity owner,
                          EntityType type, String value, String attribute, Observation observation) {
        String key = Entity.canonicalKey(type, value);
        if (key.equals(owner.getCanonicalKey())) {
            return 0;
        }
        Entity target = derived.computeIfAbsent(key, k -> Entity.builder()
                .type(type)
                .canonicalValue(value)
                .confidence(ATTRIBUTE_CONFIDENCE)
                .build());
        derived.put(key, Entity.builder(target)
                .attribute(attribute, new SourcedValue(value, observation.sourceId(), observation.id()))
                .build());
        return link(batch, owner.getId(), target.getId(), RelationshipType.ASSOCIATED_WITH,
                List.of(evidence(ATTRIBUTE_CONFIDENCE, attribute, value, observation))) ? 1 : 0;
    }

    private int contact(GraphBatch.Builder batch, String sourceEntityId, String targetEntityId,
                        RelationshipType type, double confidence, String attribute, String handle,
                        Observation observation) {
        if (sourceEntityId == null || targetEntityId == null || sourceEntityId.equals(targetEntityId)) {
            return 0;
        }
        return link(batch, sourceEntityId, targetEntityId, type,
                List.of(evidence(confidence, attribute, handle, observation))) ? 1 : 0;
    }

    private boolean link(GraphBatch.Builder batch, String sourceEntityId, String targetEntityId,
                         RelationshipType type, List<CorrelationResult> evidence) {
        OptionalDouble confidence = combiner.combine(evidence);
        if (confidence.isEmpty()) {
            return false;
        }
        batch.relationship(Relationship.builder()
                .sourceEntityId(sourceEntityId)
                .targetEntityId(targetEntityId)
                .type(type)
                .confidence(confidence.getAsDouble())
                .evidence(new ArrayList<>(evidence))
                .build());
        return true;
    }

    private static CorrelationResult evidence(double confidence, String attribute, String value,
                                              Observation observation) {
        return new CorrelationResult(AlgorithmWeights.ATTRIBUTE_LINK, confidence, List.of(observation.id()),
                Map.of("attribute", attribute, "value", value, "source", observation.sourceId()));
    }
}
