package com.osint.correlation.correlation;

import com.osint.correlation.aggregation.CancellationToken;
import com.osint.correlation.api.CorrelationOptions;
import com.osint.correlation.core.model.CorrelationEdge;
import com.osint.correlation.core.model.CorrelationResult;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.correlation.algorithm.AlgorithmType;
import com.osint.correlation.correlation.algorithm.CorrelationAlgorithm;
import com.osint.correlation.metrics.MetricsService;
import com.osint.correlation.metrics.NoOpMetricsService;
import com.osint.correlation.tracing.NoOpTracingService;
import com.osint.correlation.tracing.PipelineStage;
import com.osint.correlation.tracing.Span;
import com.osint.correlation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Turns observations into scored correlation edges.
 *
 * <p>Only {@code found} observations take part. Candidates are the distinct pairs sharing a
 * blocking key; there is no all-pairs fallback. Pairs are scored in sorted order with every enabled
 * algorithm, the results are combined with {@link ConfidenceCombiner}, and an edge is emitted when
 * the combined confidence is strictly above the threshold. Output is identical for identical input
 * and options, with or without parallel scoring.</p>
 */
public class CorrelationEngine {
    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    private final CorrelationOptions options;
    private final Map<AlgorithmType, CorrelationAlgorithm> algorithms;
    private final ConfidenceCombiner combiner;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public CorrelationEngine(CorrelationOptions options) {
        this(options, AlgorithmType.defaultRegistry(), new ObservationBlockingKeyStrategy(),
                new NoOpMetricsService(), new NoOpTracingService());
    }

    public CorrelationEngine(CorrelationOptions options,
                             Map<AlgorithmType, CorrelationAlgorithm> registry,
                             BlockingKeyStrategy blockingKeyStrategy,
                             MetricsService metricsService,
                             TracingService tracingService) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
        this.combiner = new ConfidenceCombiner(options.getAlgorithmWeights());

        Map<AlgorithmType, CorrelationAlgorithm> enabled = new EnumMap<>(AlgorithmType.class);
        for (AlgorithmType type : options.getEnabledAlgorithms()) {
            CorrelationAlgorithm algorithm = registry.get(type);
            if (algorithm == null) {
                throw new IllegalArgumentException("No implementation registered for algorithm: "
                        + type.getAlgorithmName());
            }
            enabled.put(type, algorithm);
        }
        this.algorithms = enabled;
    }

    public CorrelationReport correlate(Collection<Observation> observations) {
        return correlate(observations, CancellationToken.none());
    }

    /**
     * Scores candidate pairs among the observations.
     *
     * @throws IllegalArgumentException when two observations share an id
     */
    public CorrelationReport correlate(Collection<Observation> observations, CancellationToken cancellation) {
        Map<String, Observation> byId = indexFound(observations);
        try (Span span = tracingService.startSpan(PipelineStage.CORRELATE,
                Map.of("observations", (long) byId.size()))) {
            try {
                return scoreCandidates(byId, cancellation, span);
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private CorrelationReport scoreCandidates(Map<String, Observation> byId, CancellationToken cancellation,
                                              Span span) {
        List<CandidatePair> candidates = candidatePairs(byId.values());
        span.setAttribute("candidatePairs", candidates.size());
        log.debug("correlation.candidates observations={} pairs={}", byId.size(), candidates.size());

        AtomicLong comparisons = new AtomicLong();
        Stream<CandidatePair> stream = options.isParallelScoring()
                ? candidates.parallelStream()
                : candidates.stream();
        List<CorrelationEdge> edges = stream
                .takeWhile(pair -> !cancellation.isCancelled())
                .map(pair -> {
                    comparisons.incrementAndGet();
                    return scorePair(byId.get(pair.first()), byId.get(pair.second()));
                })
                .flatMap(Optional::stream)
                .toList();

        boolean cancelled = cancellation.isCancelled() && comparisons.get() < candidates.size();
        metricsService.recordComparisons(comparisons.get());
        edges.forEach(edge -> metricsService.recordEdgeConfidence(edge.confidence()));
        span.setAttribute("comparisons", comparisons.get());
        span.setAttribute("edges", edges.size());
        span.setStatus(Span.SpanStatus.OK);

        if (cancelled) {
            log.info("correlation.cancelled comparisons={} candidates={} edges={}",
                    comparisons.get(), candidates.size(), edges.size());
        } else {
            log.info("correlation.completed comparisons={} edges={}", comparisons.get(), edges.size());
        }
        return new CorrelationReport(edges, candidates.size(), comparisons.get(), cancelled);
    }

    /**
     * Runs every enabled algorithm on one pair and combines the results.
     *
     * @return the edge, or empty when no algorithm applied or the combined confidence is not
     * above the threshold
     */
    public Optional<CorrelationEdge> scorePair(Observation a, Observation b) {
        List<CorrelationResult> evidence = new ArrayList<>();
        for (CorrelationAlgorithm algorithm : algorithms.values()) {
            algorithm.score(a, b).ifPresent(evidence::add);
        }
        OptionalDouble combined = combiner.combine(evidence);
        if (combined.isEmpty() || combined.getAsDouble() <= options.getCorrelationThreshold()) {
            return Optional.empty();
        }
        return Optional.of(new CorrelationEdge(a.id(), b.id(), combined.getAsDouble(), evidence));
    }

    /**
     * Distinct pairs sharing at least one blocking key, sorted by (first, second) id.
     */
    List<CandidatePair> candidatePairs(Collection<Observation> observations) {
        Map<String, Set<String>> blocks = new TreeMap<>();
        for (Observation observation : observations) {
            for (String key : blockingKeyStrategy.generateKeys(observation)) {
                blocks.computeIfAbsent(key, k -> new TreeSet<>()).add(observation.id());
            }
        }
        Set<CandidatePair> pairs = new TreeSet<>(CandidatePair.ORDER);
        for (Set<String> block : blocks.values()) {
            List<String> ids = new ArrayList<>(block);
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    pairs.add(new CandidatePair(ids.get(i), ids.get(j)));
                }
            }
        }
        return new ArrayList<>(pairs);
    }

    private static Map<String, Observation> indexFound(Collection<Observation> observations) {
        Map<String, Observation> byId = new HashMap<>();
        Set<String> seen = new TreeSet<>();
        for (Observation observation : observations) {
            if (!seen.add(observation.id())) {
                throw new IllegalArgumentException("Duplicate observation id: " + observation.id());
            }
            if (observation.found()) {
                byId.put(observation.id(), observation);
            }
        }
        return byId;
    }

    public CorrelationOptions getOptions() {
        return options;
    }

    public ConfidenceCombiner getCombiner() {
        return combiner;
    }

    /**
     * Two observation ids, {@code first < second}.
     */
    record CandidatePair(String first, String second) {
        static final Comparator<CandidatePair> ORDER =
                Comparator.comparing(CandidatePair::first).thenComparing(CandidatePair::second);
    }
}
