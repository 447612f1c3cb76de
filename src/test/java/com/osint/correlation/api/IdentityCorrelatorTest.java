package com.osint.correlation.api;

import com.osint.correlation.aggregation.AggregationListener;
import com.osint.correlation.aggregation.CancellationToken;
import com.osint.correlation.core.model.Entity;
import com.osint.correlation.core.model.EntityType;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.core.model.RelationshipType;
import com.osint.correlation.graph.RelationshipGraph;
import com.osint.correlation.metrics.MicrometerMetricsService;
import com.osint.correlation.source.FakeSourceAdapter;
import com.osint.correlation.source.SearchOptions;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentityCorrelator Tests")
class IdentityCorrelatorTest {

    private SimpleMeterRegistry registry;
    private IdentityCorrelator correlator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        correlator = IdentityCorrelator.builder()
                .adapter(FakeSourceAdapter.named("github")
                        .profile("john_doe", Map.of(
                                "display_name", "John Doe",
                                "location", "Berlin",
                                "email", "John.Doe@Example.com"))
                        .build())
                .adapter(FakeSourceAdapter.named("twitter")
                        .profile("john_doe", Map.of("display_name", "John Doe", "location", "Berlin"))
                        .build())
                .adapter(FakeSourceAdapter.named("gitlab").build())
                .adapter(FakeSourceAdapter.named("broken").failPermanently().build())
                .options(CorrelationOptions.builder()
                        .retryBaseDelay(Duration.ofMillis(1))
                        .retryMaxDelay(Duration.ofMillis(5))
                        .build())
                .metricsService(new MicrometerMetricsService(registry))
                .build();
    }

    @AfterEach
    void tearDown() {
        correlator.close();
    }

    @Nested
    @DisplayName("End-to-end run")
    class RunTests {

        @Test
        @DisplayName("Matching profiles from two sources fuse into one person")
        void fusesProfiles() {
            CorrelationRun run = correlator.run(List.of("john_doe"));

            CorrelationRun.Summary summary = run.summary();
            assertEquals(2, summary.found());
            assertEquals(1, summary.notFound());
            assertEquals(1, summary.errors());
            assertEquals(1, summary.edges());
            assertEquals(1, summary.entities());
            assertEquals(0, summary.rejectedWrites());
            assertFalse(run.cancelled());

            RelationshipGraph graph = correlator.getGraph();
            Entity person = graph.findByCanonicalKey(EntityType.PERSON, "johndoe").orElseThrow();
            assertEquals(2, person.getMemberObservationIds().size());
            Entity email = graph.findByCanonicalKey(EntityType.EMAIL, "john.doe@example.com").orElseThrow();
            assertTrue(graph.getRelationship(person.getId(), email.getId(), RelationshipType.ASSOCIATED_WITH)
                    .isPresent());
            assertEquals(2, run.snapshot().activeNodes().size());
        }

        @Test
        @DisplayName("Running the same input twice adds nothing to the graph")
        void rerunIsIdempotent() {
            correlator.run(List.of("john_doe"));
            int entities = correlator.getGraph().entityCount();
            int relationships = correlator.getGraph().relationshipCount();

            CorrelationRun second = correlator.run(List.of("john_doe"));

            assertEquals(entities, correlator.getGraph().entityCount());
            assertEquals(relationships, correlator.getGraph().relationshipCount());
            assertEquals(0, second.commit().rejected().size());
            assertEquals(1.0, registry.find("osint.entity.created").tag("entityType", "PERSON").counter().count());
        }

        @Test
        @DisplayName("A cancelled run still returns a result")
        void cancelledRun() {
            IdentityCorrelator slow = IdentityCorrelator.builder()
                    .adapter(FakeSourceAdapter.named("slowsite")
                            .latency(Duration.ofSeconds(5))
                            .profile("john_doe", Map.of("bio", "dev"))
                            .build())
                    .build();
            CancellationToken token = CancellationToken.create();
            token.cancel();

            try (slow) {
                CorrelationRun run = slow.run(List.of("john_doe"), SearchOptions.defaults(),
                        AggregationListener.NOOP, token);

                assertTrue(run.cancelled());
                assertEquals(0, run.summary().found());
                assertEquals(0, slow.getGraph().entityCount());
            }
        }
    }

    @Nested
    @DisplayName("Imported observations")
    class ImportTests {

        @Test
        @DisplayName("Observations gathered elsewhere run through correlation and clustering")
        void correlateObservations() {
            CorrelationRun run = correlator.correlateObservations(List.of(
                    Observation.found("forum", "jdoe", Map.of("username", "jdoe", "display_name", "J Doe")),
                    Observation.found("blog", "jdoe", Map.of("username", "jdoe", "display_name", "J Doe")),
                    Observation.notFound("wiki", "jdoe")));

            assertEquals(2, run.summary().found());
            assertEquals(1, run.summary().entities());
            assertTrue(correlator.getGraph().findByCanonicalKey(EntityType.PERSON, "jdoe").isPresent());
        }

        @Test
        @DisplayName("An observation re-clustered under a new key keeps a single live owner")
        void reclusteredObservationFolds() {
            Observation github = Observation.found("github", "john_doe", Map.of(
                    "display_name", "John Doe", "location", "Berlin", "email", "John.Doe@Example.com"));
            Observation twitter = Observation.found("twitter", "john_doe", Map.of(
                    "display_name", "John Doe", "location", "Berlin"));
            RelationshipGraph graph = correlator.getGraph();

            correlator.correlateObservations(List.of(github));
            Entity alone = graph.findByCanonicalKey(EntityType.USERNAME, "johndoe").orElseThrow();

            CorrelationRun second = correlator.correlateObservations(List.of(github, twitter));

            Entity person = graph.findByCanonicalKey(EntityType.PERSON, "johndoe").orElseThrow();
            List<Entity> owners = graph.exportGraph().activeNodes().stream()
                    .filter(e -> e.getMemberObservationIds().contains(github.id()))
                    .toList();
            assertEquals(List.of(person.getId()), owners.stream().map(Entity::getId).toList());
            assertEquals(person.getId(), graph.resolve(alone.getId()).orElseThrow().getId());
            assertEquals(person.getId(), graph.findByCanonicalKey(EntityType.USERNAME, "johndoe").orElseThrow().getId());

            assertEquals(1, graph.getMergeLedger().size());
            assertEquals(alone.getId(), graph.getMergeLedger().getAllRecords().get(0).sourceEntityId());
            assertTrue(graph.getMergeLedger().getAllRecords().get(0).reason().contains(github.id()));

            Entity email = graph.findByCanonicalKey(EntityType.EMAIL, "john.doe@example.com").orElseThrow();
            assertEquals(List.of(person.getId()), graph.neighbors(email.getId()).stream().map(Entity::getId).toList());
            assertEquals(List.of(person.getId()), second.commit().entities().stream()
                    .filter(e -> e.getType() == EntityType.PERSON)
                    .map(Entity::getId)
                    .toList());
            assertEquals(1.0, registry.find("osint.entity.merged").tag("entityType", "PERSON").counter().count());
        }

        @Test
        @DisplayName("Duplicate observation ids are rejected")
        void duplicateIds() {
            List<Observation> duplicated = List.of(
                    Observation.found("forum", "jdoe", Map.of()),
                    Observation.found("forum", "jdoe", Map.of("bio", "x")));

            assertThrows(IllegalArgumentException.class, () -> correlator.correlateObservations(duplicated));
        }
    }

    @Test
    @DisplayName("Builder rejects null collaborators")
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> IdentityCorrelator.builder().options(null));
        assertThrows(NullPointerException.class, () -> IdentityCorrelator.builder().adapter(null));
        assertEquals(4, correlator.getAdapters().size());
    }
}
