package com.osint.correlation.source;

import com.osint.correlation.core.model.Observation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process source used by tests: configurable latency, transient failures before success,
 * permanent failure, and per-query attributes.
 */
public class FakeSourceAdapter implements SourceAdapter {

    private final String name;
    private final Duration latency;
    private final int transientFailures;
    private final boolean permanentFailure;
    private final boolean ignoreInterrupts;
    private final Map<String, Map<String, Object>> profiles;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight;
    private final AtomicInteger maxInFlight;

    private FakeSourceAdapter(Builder builder) {
        this.name = builder.name;
        this.latency = builder.latency;
        this.transientFailures = builder.transientFailures;
        this.permanentFailure = builder.permanentFailure;
        this.ignoreInterrupts = builder.ignoreInterrupts;
        this.profiles = Map.copyOf(builder.profiles);
        this.inFlight = builder.inFlight;
        this.maxInFlight = builder.maxInFlight;
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<Observation> search(List<String> queryValues, SearchOptions options, SourceProgressCallback progress) {
        int call = calls.incrementAndGet();
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            pause();
            if (permanentFailure) {
                throw new PermanentSourceException(name, "authentication rejected");
            }
            if (call <= transientFailures) {
                throw new TransientSourceException(name, "connection reset");
            }
            List<Observation> observations = new ArrayList<>();
            int completed = 0;
            for (String query : queryValues) {
                Map<String, Object> attributes = profiles.get(query);
                observations.add(attributes != null
                        ? Observation.found(name, query, attributes)
                        : Observation.notFound(name, query));
                progress.onProgress(++completed, queryValues.size());
            }
            return observations;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void pause() {
        if (latency.isZero()) {
            return;
        }
        long deadline = System.nanoTime() + latency.toNanos();
        while (System.nanoTime() < deadline) {
            try {
                Thread.sleep(Math.max(1, (deadline - System.nanoTime()) / 1_000_000));
            } catch (InterruptedException e) {
                if (!ignoreInterrupts) {
                    Thread.currentThread().interrupt();
                    throw new TransientSourceException(name, "interrupted");
                }
            }
        }
    }

    @Override
    public List<String> availableSites() {
        return List.of();
    }

    @Override
    public List<String> availableCategories() {
        return List.of();
    }

    public int calls() {
        return calls.get();
    }

    public static class Builder {
        private final String name;
        private Duration latency = Duration.ZERO;
        private int transientFailures;
        private boolean permanentFailure;
        private boolean ignoreInterrupts;
        private final Map<String, Map<String, Object>> profiles = new HashMap<>();
        private AtomicInteger inFlight = new AtomicInteger();
        private AtomicInteger maxInFlight = new AtomicInteger();

        private Builder(String name) {
            this.name = name;
        }

        public Builder latency(Duration latency) {
            this.latency = latency;
            return this;
        }

        public Builder failTransiently(int times) {
            this.transientFailures = times;
            return this;
        }

        public Builder failPermanently() {
            this.permanentFailure = true;
            return this;
        }

        public Builder ignoreInterrupts() {
            this.ignoreInterrupts = true;
            return this;
        }

        public Builder profile(String query, Map<String, Object> attributes) {
            this.profiles.put(query, attributes);
            return this;
        }

        /**
         * Shares concurrency counters between several fakes.
         */
        public Builder trackConcurrency(AtomicInteger inFlight, AtomicInteger maxInFlight) {
            this.inFlight = inFlight;
            this.maxInFlight = maxInFlight;
            return this;
        }

        public FakeSourceAdapter build() {
            return new FakeSourceAdapter(this);
        }
    }
}
