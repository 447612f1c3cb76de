package com.osint.correlation.aggregation;

import com.osint.correlation.api.CorrelationOptions;
import com.osint.correlation.cache.NoOpObservationCache;
import com.osint.correlation.cache.ObservationCache;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.logging.LogContext;
import com.osint.correlation.metrics.MetricsService;
import com.osint.correlation.metrics.NoOpMetricsService;
import com.osint.correlation.source.SearchOptions;
import com.osint.correlation.source.SourceAdapter;
import com.osint.correlation.tracing.NoOpTracingService;
import com.osint.correlation.tracing.PipelineStage;
import com.osint.correlation.tracing.Span;
import com.osint.correlation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queries every configured source adapter concurrently and collects their observations.
 *
 * <p>At most {@code maxConcurrentRequests} adapter calls are in flight at any time. Each call runs
 * under the per-source timeout; an expired call is interrupted and counts as a transient failure.
 * Transient failures are retried with exponential backoff, permanent ones are not. A source that
 * still fails contributes one {@code error} observation per query value and never affects the
 * other sources. Cancelling the batch, or reaching the batch deadline, interrupts in-flight calls
 * and returns what settled so far.</p>
 *
 * <p>Instances own two thread pools and should be closed when no longer needed.</p>
 */
public class Aggregator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    static final String CANCELLED_REASON = "cancelled";

    private final List<SourceAdapter> adapters;
    private final CorrelationOptions options;
    private final RetryPolicy retryPolicy;
    private final ObservationCache cache;
    private final RateLimiter rateLimiter;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService coordinator;
    private final ExecutorService callExecutor;

    private Aggregator(Builder builder) {
        this.adapters = List.copyOf(builder.adapters);
        this.options = builder.options;
        this.retryPolicy = builder.options.retryPolicy();
        this.cache = builder.cache;
        this.rateLimiter = builder.rateLimiter;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
        this.coordinator = Executors.newCachedThreadPool(namedThreads("osint-aggregate"));
        this.callExecutor = Executors.newCachedThreadPool(namedThreads("osint-source-call"));
        log.info("Aggregator initialized: sources={}, maxConcurrentRequests={}, perSourceTimeout={}",
                adapters.size(), options.getMaxConcurrentRequests(), options.getPerSourceTimeout());
    }

    public AggregationResult aggregate(List<String> queryValues) {
        return aggregate(queryValues, SearchOptions.defaults(), AggregationListener.NOOP, CancellationToken.none());
    }

    public AggregationResult aggregate(List<String> queryValues, SearchOptions searchOptions,
                                       AggregationListener listener) {
        return aggregate(queryValues, searchOptions, listener, CancellationToken.none());
    }

    /**
     * Runs one batch. Partial failures never raise: every configured source is represented in the
     * result, failed ones by error observations.
     *
     * @param queryValues   values to look up (usernames, emails...)
     * @param searchOptions options passed to every adapter; the per-source timeout fills a missing timeout
     * @param listener      progress sink
     * @param cancellation  caller-held cancellation handle
     */
    public AggregationResult aggregate(List<String> queryValues, SearchOptions searchOptions,
                                       AggregationListener listener, CancellationToken cancellation) {
        Objects.requireNonNull(queryValues, "queryValues is required");
        List<String> queries = List.copyOf(new LinkedHashSet<>(queryValues));
        SearchOptions effectiveOptions = (searchOptions != null ? searchOptions : SearchOptions.defaults())
                .withDefaultTimeout(options.getPerSourceTimeout());
        SerializedListener events = new SerializedListener(listener != null ? listener : AggregationListener.NOOP,
                adapters.size());
        String batchId = LogContext.generateBatchId();

        try (LogContext ctx = LogContext.forAggregation(batchId);
             Span span = tracingService.startSpan(PipelineStage.AGGREGATE,
                     Map.of("sources", (long) adapters.size(), "queries", (long) queries.size()))) {
            log.info("aggregation.started sources={} queries={}", adapters.size(), queries.size());

            BatchState batch = new BatchState(options.getMaxConcurrentRequests());
            Map<String, Future<SourceOutcome>> running = new LinkedHashMap<>();
            Map<String, String> mdc = MDC.getCopyOfContextMap();
            for (SourceAdapter adapter : adapters) {
                running.put(adapter.getName(), coordinator.submit(() -> {
                    if (mdc != null) {
                        MDC.setContextMap(mdc);
                    }
                    try (LogContext sourceCtx = LogContext.forSource(batchId, adapter.getName())) {
                        SourceOutcome outcome = querySource(adapter, queries, effectiveOptions, events, batch);
                        events.sourceSettled(outcome);
                        return outcome;
                    } finally {
                        MDC.clear();
                    }
                }));
            }
            boolean cancelled;
            try (CancellationToken.Registration registration = cancellation.onCancel(() -> {
                batch.cancel();
                running.values().forEach(f -> f.cancel(true));
            })) {
                cancelled = awaitAll(running, batch, cancellation);
            }
            List<SourceOutcome> outcomes = new ArrayList<>();
            for (Map.Entry<String, Future<SourceOutcome>> entry : running.entrySet()) {
                SourceOutcome outcome = settledOutcome(entry.getKey(), entry.getValue(), queries);
                if (outcome == null) {
                    outcome = cancelledOutcome(entry.getKey(), queries);
                    events.sourceSettled(outcome);
                }
                outcomes.add(outcome);
            }

            AggregationResult result = assemble(batchId, outcomes, cancelled);
            span.setAttribute("found", result.foundCount());
            span.setAttribute("errors", result.errorCount());
            span.setStatus(Span.SpanStatus.OK);
            log.info("aggregation.completed found={} notFound={} errors={} cancelled={}",
                    result.foundCount(), result.notFoundCount(), result.errorCount(), cancelled);
            events.batchCompleted(result);
            return result;
        }
    }

    /**
     * Waits for every source until all settle, the caller cancels, or the batch deadline passes.
     *
     * @return true if the batch was cut short
     */
    private boolean awaitAll(Map<String, Future<SourceOutcome>> running, BatchState batch,
                             CancellationToken cancellation) {
        long deadline = options.getBatchTimeout()
                .map(timeout -> System.nanoTime() + timeout.toNanos())
                .orElse(Long.MAX_VALUE);
        boolean cutShort = false;
        for (Map.Entry<String, Future<SourceOutcome>> entry : running.entrySet()) {
            Future<SourceOutcome> future = entry.getValue();
            try {
                if (deadline == Long.MAX_VALUE) {
                    future.get();
                } else {
                    future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                }
            } catch (TimeoutException e) {
                log.warn("aggregation.deadline batchTimeout={} pendingSource={}",
                        options.getBatchTimeout().orElse(null), entry.getKey());
                cutShort = true;
                break;
            } catch (CancellationException e) {
                cutShort = true;
                break;
            } catch (ExecutionException e) {
                log.error("aggregation.source.crashed source={}", entry.getKey(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cutShort = true;
                break;
            }
        }
        if (cutShort || cancellation.isCancelled()) {
            batch.cancel();
            running.values().forEach(f -> f.cancel(true));
            return true;
        }
        return false;
    }

    private SourceOutcome settledOutcome(String sourceName, Future<SourceOutcome> future, List<String> queries) {
        if (!future.isDone() || future.isCancelled()) {
            return null;
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            String reason = "unexpected failure: " + e.getCause();
            return new SourceOutcome(sourceName, errorObservations(sourceName, queries, reason),
                    0, Duration.ZERO, reason, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    /**
     * Queries one source with retries, serving cached answers where possible.
     */
    private SourceOutcome querySource(SourceAdapter adapter, List<String> queries, SearchOptions searchOptions,
                                      SerializedListener events, BatchState batch) {
        String sourceName = adapter.getName();
        events.sourceStarted(sourceName);
        long started = System.nanoTime();

        List<Observation> observations = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        for (String query : queries) {
            Optional<List<Observation>> cached = cache.get(sourceName, query);
            if (cached.isPresent()) {
                metricsService.recordCacheHit();
                observations.addAll(cached.get());
            } else {
                metricsService.recordCacheMiss();
                pending.add(query);
            }
        }
        if (pending.isEmpty()) {
            log.debug("aggregation.source.cached source={} queries={}", sourceName, queries.size());
            return new SourceOutcome(sourceName, observations, 0, elapsedSince(started), null, true);
        }

        int attempts = 0;
        String lastReason = null;
        while (attempts < retryPolicy.maxAttempts()) {
            if (batch.isCancelled()) {
                lastReason = CANCELLED_REASON;
                break;
            }
            if (attempts > 0) {
                Duration delay = retryPolicy.delayBefore(attempts - 1);
                metricsService.incrementSourceRetry(sourceName);
                log.debug("aggregation.source.retrying source={} attempt={} delayMs={}",
                        sourceName, attempts + 1, delay.toMillis());
                if (!batch.sleep(delay)) {
                    lastReason = CANCELLED_REASON;
                    break;
                }
            }
            attempts++;
            try {
                List<Observation> answered = attempt(adapter, pending, searchOptions, events, batch);
                cacheAnswers(sourceName, pending, answered);
                observations.addAll(answered);
                log.debug("aggregation.source.succeeded source={} attempts={} observations={}",
                        sourceName, attempts, answered.size());
                return new SourceOutcome(sourceName, observations, attempts, elapsedSince(started), null, false);
            } catch (AttemptFailure failure) {
                lastReason = failure.getMessage();
                if (failure.cancelled) {
                    break;
                }
                if (!failure.isTransient) {
                    log.warn("aggregation.source.failed source={} attempts={} transient=false reason={}",
                            sourceName, attempts, lastReason);
                    break;
                }
                log.debug("aggregation.source.transientFailure source={} attempt={} reason={}",
                        sourceName, attempts, lastReason);
            }
        }
        if (!CANCELLED_REASON.equals(lastReason) && attempts >= retryPolicy.maxAttempts()) {
            log.warn("aggregation.source.failed source={} attempts={} transient=true reason={}",
                    sourceName, attempts, lastReason);
        }
        observations.addAll(errorObservations(sourceName, pending, lastReason));
        return new SourceOutcome(sourceName, observations, attempts, elapsedSince(started), lastReason, false);
    }

    /**
     * One bounded adapter call. The permit is taken before submission and returned by the call
     * itself, so a timed-out call that ignores interruption keeps its slot until it really ends.
     */
    private List<Observation> attempt(SourceAdapter adapter, List<String> queries, SearchOptions searchOptions,
                                      SerializedListener events, BatchState batch) throws AttemptFailure {
        String sourceName = adapter.getName();
        try {
            rateLimiter.acquire(sourceName);
            batch.permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AttemptFailure.cancelled();
        }

        AtomicBoolean claimed = new AtomicBoolean(false);
        long callStarted = System.nanoTime();
        Future<List<Observation>> call = callExecutor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return List.of();
            }
            try {
                return adapter.search(queries, searchOptions,
                        (completed, total) -> events.sourceProgress(sourceName, completed, total));
            } finally {
                batch.permits.release();
            }
        });
        batch.track(call);

        Duration timeout = options.getPerSourceTimeout();
        try {
            List<Observation> answered = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Duration took = elapsedSince(callStarted);
            List<Observation> stamped = new ArrayList<>();
            for (Observation observation : answered != null ? answered : List.<Observation>of()) {
                Observation withTime = observation.responseTime() == null
                        ? observation.withResponseTime(took) : observation;
                metricsService.recordSourceQuery(sourceName, withTime.status(), took);
                stamped.add(withTime);
            }
            return stamped;
        } catch (TimeoutException e) {
            cancelCall(call, claimed, batch);
            metricsService.incrementSourceTimeout(sourceName);
            log.warn("aggregation.source.timeout source={} timeoutMs={}", sourceName, timeout.toMillis());
            throw new AttemptFailure("timeout after " + timeout.toMillis() + "ms", true, false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AttemptFailure(describe(cause), RetryPolicy.isTransient(cause), false);
        } catch (CancellationException e) {
            throw AttemptFailure.cancelled();
        } catch (InterruptedException e) {
            cancelCall(call, claimed, batch);
            Thread.currentThread().interrupt();
            throw AttemptFailure.cancelled();
        } finally {
            batch.untrack(call);
        }
    }

    private static void cancelCall(Future<?> call, AtomicBoolean claimed, BatchState batch) {
        call.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            // never started, so its finally block will not return the permit
            batch.permits.release();
        }
    }

    private void cacheAnswers(String sourceName, List<String> queries, List<Observation> answered) {
        Map<String, List<Observation>> byQuery = new LinkedHashMap<>();
        for (Observation observation : answered) {
            byQuery.computeIfAbsent(observation.queryValue(), k -> new ArrayList<>()).add(observation);
        }
        for (String query : queries) {
            List<Observation> forQuery = byQuery.get(query);
            if (forQuery != null) {
                cache.put(sourceName, query, forQuery);
            }
        }
    }

    private SourceOutcome cancelledOutcome(String sourceName, List<String> queries) {
        log.info("aggregation.source.cancelled source={}", sourceName);
        return new SourceOutcome(sourceName, errorObservations(sourceName, queries, CANCELLED_REASON),
                0, Duration.ZERO, CANCELLED_REASON, false);
    }

    /**
     * Flattens outcomes in configuration order and makes observation ids unique within the batch.
     */
    private static AggregationResult assemble(String batchId, List<SourceOutcome> outcomes, boolean cancelled) {
        Set<String> usedIds = new HashSet<>();
        List<Observation> all = new ArrayList<>();
        List<SourceOutcome> renumbered = new ArrayList<>();
        for (SourceOutcome outcome : outcomes) {
            List<Observation> unique = new ArrayList<>();
            for (Observation observation : outcome.observations()) {
                String id = observation.id();
                int suffix = 2;
                while (!usedIds.add(id)) {
                    id = observation.id() + "#" + suffix++;
                }
                unique.add(id.equals(observation.id()) ? observation : observation.withId(id));
            }
            all.addAll(unique);
            renumbered.add(new SourceOutcome(outcome.sourceName(), unique, outcome.attempts(),
                    outcome.elapsed(), outcome.errorReason(), outcome.fromCache()));
        }
        return new AggregationResult(batchId, all, renumbered, cancelled);
    }

    private static List<Observation> errorObservations(String sourceName, List<String> queries, String reason) {
        String effectiveReason = reason != null ? reason : "unknown failure";
        return queries.stream()
                .map(query -> Observation.error(sourceName, query, effectiveReason))
                .toList();
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public List<SourceAdapter> getAdapters() {
        return adapters;
    }

    @Override
    public void close() {
        coordinator.shutdownNow();
        callExecutor.shutdownNow();
        try {
            if (!coordinator.awaitTermination(5, TimeUnit.SECONDS)
                    || !callExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Aggregator threads did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<SourceAdapter> adapters = new ArrayList<>();
        private CorrelationOptions options = CorrelationOptions.defaults();
        private ObservationCache cache = new NoOpObservationCache();
        private RateLimiter rateLimiter = new NoOpRateLimiter();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();

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

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
            return this;
        }

        public Aggregator build() {
            Set<String> names = new HashSet<>();
            for (SourceAdapter adapter : adapters) {
                if (adapter.getName() == null || adapter.getName().isBlank()) {
                    throw new IllegalArgumentException("source adapter name must not be blank");
                }
                if (!names.add(adapter.getName())) {
                    throw new IllegalArgumentException("Duplicate source adapter name: " + adapter.getName());
                }
            }
            return new Aggregator(this);
        }
    }

    /**
     * Per-batch shared state: the concurrency bound, in-flight calls and the cancelled flag.
     */
    private static final class BatchState {
        private final Semaphore permits;
        private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
        private final Object sleepLock = new Object();
        private volatile boolean cancelled;

        private BatchState(int maxConcurrentRequests) {
            this.permits = new Semaphore(maxConcurrentRequests, true);
        }

        boolean isCancelled() {
            return cancelled;
        }

        void track(Future<?> call) {
            inFlight.add(call);
            if (cancelled) {
                call.cancel(true);
            }
        }

        void untrack(Future<?> call) {
            inFlight.remove(call);
        }

        void cancel() {
            cancelled = true;
            inFlight.forEach(call -> call.cancel(true));
            synchronized (sleepLock) {
                sleepLock.notifyAll();
            }
        }

        /**
         * Waits for the backoff delay unless the batch is cancelled first.
         *
         * @return false if cancelled while waiting
         */
        boolean sleep(Duration delay) {
            long deadline = System.nanoTime() + delay.toNanos();
            synchronized (sleepLock) {
                while (!cancelled) {
                    long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                    if (remainingMillis <= 0) {
                        return true;
                    }
                    try {
                        sleepLock.wait(remainingMillis);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                }
            }
            return false;
        }
    }

    /**
     * Serialises listener calls and counts settled sources. Listener failures are logged, never propagated.
     */
    private static final class SerializedListener {
        private final AggregationListener delegate;
        private final int total;
        private final Set<String> settled = new HashSet<>();

        private SerializedListener(AggregationListener delegate, int total) {
            this.delegate = delegate;
            this.total = total;
        }

        synchronized void sourceStarted(String sourceName) {
            safely(() -> delegate.onSourceStarted(sourceName));
        }

        synchronized void sourceProgress(String sourceName, int completed, int sourceTotal) {
            safely(() -> delegate.onSourceProgress(sourceName, completed, sourceTotal));
        }

        synchronized void sourceSettled(SourceOutcome outcome) {
            if (!settled.add(outcome.sourceName())) {
                return;
            }
            safely(() -> delegate.onSourceCompleted(outcome));
            int completed = settled.size();
            safely(() -> delegate.onProgress(completed, total));
        }

        synchronized void batchCompleted(AggregationResult result) {
            safely(() -> delegate.onBatchCompleted(result));
        }

        private void safely(Runnable event) {
            try {
                event.run();
            } catch (RuntimeException e) {
                log.warn("aggregation.listener.failed listener={}", delegate.getClass().getName(), e);
            }
        }
    }

    /**
     * Failure of a single adapter attempt.
     */
    private static final class AttemptFailure extends Exception {
        private final boolean isTransient;
        private final boolean cancelled;

        private AttemptFailure(String reason, boolean isTransient, boolean cancelled) {
            super(reason, null, false, false);
            this.isTransient = isTransient;
            this.cancelled = cancelled;
        }

        static AttemptFailure cancelled() {
            return new AttemptFailure(CANCELLED_REASON, false, true);
        }
    }
}
