package com.osint.correlation.api;

import com.osint.correlation.aggregation.AggregationListener;
import com.osint.correlation.aggregation.AggregationResult;
import com.osint.correlation.aggregation.Aggregator;
import com.osint.correlation.aggregation.CancellationToken;
import com.osint.correlation.aggregation.NoOpRateLimiter;
import com.osint.correlation.aggregation.RateLimiter;
import com.osint.correlation.cache.NoOpObservationCache;
import com.osint.correlation.cache.ObservationCache;
import com.osint.correlation.cluster.ClusterGraphMapper;
import com.osint.correlation.cluster.ClusteringResult;
import com.osint.correlation.cluster.EntityClusterBuilder;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.correlation.BlockingKeyStrategy;
import com.osint.correlation.correlation.ConfidenceCombiner;
import com.osint.correlation.correlation.CorrelationEngine;
import com.osint.correlation.correlation.CorrelationReport;
import com.osint.correlation.correlation.ObservationBlockingKeyStrategy;
import com.osint.correlation.correlation.algorithm.AlgorithmType;
import com.osint.correlation.graph.BatchCommitResult;
import com.osint.correlation.graph.GraphBatch;
import com.osint.correlation.graph.MergeLedger;
import com.osint.correlation.graph.RelationshipGraph;
import com.osint.correlation.logging.LogContext;
import com.osint.correlation.metrics.MetricsService;
import com.osint.correlation.metrics.NoOpMetricsService;
import com.osint.correlation.source.SearchOptions;
import com.osint.correlation.source.SourceAdapter;
import com.osint.correlation.tracing.NoOpTracingService;
import com.osint.correlation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point: runs aggregation, correlation, clustering and the graph commit as one pass.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (IdentityCorrelator correlator = IdentityCorrelator.builder()
 *         .adapter(usernameSearch)
 *         .adapter(breachLookup)
 *         .options(CorrelationOptions.conservative())
 *         .build()) {
 *     CorrelationRun run = correlator.run(List.of("john_doe", "john.doe@example.com"));
 *     log.info("run finished {}", run.summary());
 *     List&lt;GraphPath&gt; paths = correlator.getGraph().pathsWithinDepth(a, b, 3);
 * }
 * </pre>
 *
 * <p>The graph outlives a run: repeated runs over the same input add nothing new.</p>
 */
public class IdentityCorrelator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IdentityCorrelator.class);

    private final CorrelationOptions options;
    private final Aggregator aggregator;
    private final CorrelationEngine engine;
    private final EntityClusterBuilder clusterBuilder;
    private final ClusterGraphMapper mapper;
    private final RelationshipGraph graph;

    private IdentityCorrelator(Builder builder) {
        this.options = builder.options;
        MetricsService metricsService = builder.metricsService;
        TracingService tracingService = builder.tracingService;

        this.aggregator = Aggregator.builder()
                .adapters(builder.adapters)
                .options(options)
                .cache(builder.cache)
                .rateLimiter(builder.rateLimiter)
                .metricsService(metricsService)
                .tracingService(tracingService)
                .build();
        this.engine = new CorrelationEngine(options, AlgorithmType.defaultRegistry(),
                builder.blockingKeyStrategy, metricsService, tracingService);
        this.clusterBuilder = new EntityClusterBuilder(options.getMinClusterConfidence(), tracingService);
        this.graph = builder.graph != null
                ? builder.graph
                : new RelationshipGraph(new ConfidenceCombiner(options.getAlgorithmWeights()),
                options.getMaxTraversalDepth(), new MergeLedger(), metricsService, tracingService);
        this.mapper = new ClusterGraphMapper(graph.getCombiner());

        log.info("IdentityCorrelator initialized: sources={}, options={}", builder.adapters.size(), options);
    }

    public CorrelationRun run(List<String> queryValues) {
        return run(queryValues, SearchOptions.defaults(), AggregationListener.NOOP, CancellationToken.none());
    }

    public CorrelationRun run(List<String> queryValues, SearchOptions searchOptions, AggregationListener listener) {
        return run(queryValues, searchOptions, listener, CancellationToken.none());
    }

    /**
     * Queries every source for the values, then correlates what was found and commits it to the graph.
     * Source failures surface as error observations; they never abort the run. A cancelled run still
     * commits what was gathered before the cancellation.
     */
    public CorrelationRun run(List<String> queryValues, SearchOptions searchOptions,
                              AggregationListener listener, CancellationToken cancellation) {
        AggregationResult aggregation = aggregator.aggregate(queryValues, searchOptions, listener, cancellation);
        return process(aggregation, cancellation);
    }

    /**
     * Runs the pipeline from correlation onwards over observations gathered elsewhere.
     *
     * @throws IllegalArgumentException when two found observations share an id
     */
    public CorrelationRun correlateObservations(List<Observation> observations) {
        Objects.requireNonNull(observations, "observations is required");
        AggregationResult imported = new AggregationResult(LogContext.generateBatchId(), observations,
                List.of(), false);
        return process(imported, CancellationToken.none());
    }

    private CorrelationRun process(AggregationResult aggregation, CancellationToken cancellation) {
        try (LogContext ctx = LogContext.forCorrelation(aggregation.batchId())) {
            CorrelationReport report = engine.correlate(aggregation.observations(), cancellation);
            ClusteringResult clustering = clusterBuilder.build(aggregation.observations(), report.edges());
            GraphBatch batch = mapper.toBatch(clustering, aggregation.observations());
            BatchCommitResult commit = graph.applyBatch(batch);

            CorrelationRun run = new CorrelationRun(aggregation, report, clustering, commit, graph.exportGraph());
            if (commit.hasRejections()) {
                log.warn("run.completed.with.rejections rejected={}", commit.rejected().size());
            }
            log.info("run.completed {}", run.summary());
            return run;
        }
    }

    public RelationshipGraph getGraph() {
        return graph;
    }

    public CorrelationOptions getOptions() {
        return options;
    }

    public List<SourceAdapter> getAdapters() {
        return aggregator.getAdapters();
    }

    @Override
    public void close() {
        aggregator.close();
        log.info("IdentityCorrelator closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<SourceAdapter> adapters = new ArrayList<>();
        private CorrelationOptions options = CorrelationOptions.defaults();
        private ObservationCache cache = new NoOpObservationCache();
        private RateLimiter rateLimiter = new NoOpRateLimiter();
        private BlockingKeyStrategy blockingKeyStrategy = new ObservationBlockingKeyStrategy();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();
        private RelationshipGraph graph;

        public Builder adapter(SourceAdapter adapter) {
            this.adapters.add(Objects.requireNonNull(adapter, "adapter is required"));
            return this;
        }

        public Builder adapters(List<? extends SourceAdapter> adapters) {
            adapters.forEach(this::adapter);
            return this;
        }

        public Builder options(CorrelationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder cache(ObservationCache cache) {
            this.cache = Objects.requireNonNull(cache, "cache is required");
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter is required");
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy is required");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
            return this;
        }

        /**
         * Graph to commit into, for sharing one graph across correlators. A new in-memory graph
         * is created when unset.
         */
        public Builder graph(RelationshipGraph graph) {
            this.graph = graph;
            return this;
        }

        public IdentityCorrelator build() {
            return new IdentityCorrelator(this);
        }
    }
}
