package com.osint.correlation.api;

import com.osint.correlation.aggregation.RetryPolicy;
import com.osint.correlation.correlation.AlgorithmWeights;
import com.osint.correlation.correlation.algorithm.AlgorithmType;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration consumed by the aggregator, correlation engine, cluster builder and graph.
 * Passed explicitly into constructors; there is no global configuration state.
 */
public class CorrelationOptions {

    private static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 10;
    private static final Duration DEFAULT_PER_SOURCE_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    private static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofMillis(200);
    private static final Duration DEFAULT_RETRY_MAX_DELAY = Duration.ofSeconds(5);
    private static final double DEFAULT_CORRELATION_THRESHOLD = 0.6;
    private static final double DEFAULT_MIN_CLUSTER_CONFIDENCE = 0.0;
    private static final int DEFAULT_MAX_TRAVERSAL_DEPTH = 4;

    private final int maxConcurrentRequests;
    private final Duration perSourceTimeout;
    private final int maxRetryAttempts;
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;
    private final Duration batchTimeout;
    private final AlgorithmWeights algorithmWeights;
    private final Set<AlgorithmType> enabledAlgorithms;
    private final double correlationThreshold;
    private final double minClusterConfidence;
    private final int maxTraversalDepth;
    private final boolean parallelScoring;

    private CorrelationOptions(Builder builder) {
        this.maxConcurrentRequests = builder.maxConcurrentRequests;
        this.perSourceTimeout = builder.perSourceTimeout;
        this.maxRetryAttempts = builder.maxRetryAttempts;
        this.retryBaseDelay = builder.retryBaseDelay;
        this.retryMaxDelay = builder.retryMaxDelay;
        this.batchTimeout = builder.batchTimeout;
        this.algorithmWeights = builder.algorithmWeights;
        this.enabledAlgorithms = Collections.unmodifiableSet(EnumSet.copyOf(builder.enabledAlgorithms));
        this.correlationThreshold = builder.correlationThreshold;
        this.minClusterConfidence = builder.minClusterConfidence;
        this.maxTraversalDepth = builder.maxTraversalDepth;
        this.parallelScoring = builder.parallelScoring;
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public Duration getPerSourceTimeout() {
        return perSourceTimeout;
    }

    /**
     * Retries after the first attempt for transient failures. 0 disables retrying.
     */
    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    /**
     * Overall deadline for one aggregation batch, if any.
     */
    public Optional<Duration> getBatchTimeout() {
        return Optional.ofNullable(batchTimeout);
    }

    public AlgorithmWeights getAlgorithmWeights() {
        return algorithmWeights;
    }

    public Set<AlgorithmType> getEnabledAlgorithms() {
        return enabledAlgorithms;
    }

    public double getCorrelationThreshold() {
        return correlationThreshold;
    }

    /**
     * Floor under which the cluster builder refuses a merge and records a
     * same-identity link instead. 0 never refuses.
     */
    public double getMinClusterConfidence() {
        return minClusterConfidence;
    }

    public int getMaxTraversalDepth() {
        return maxTraversalDepth;
    }

    public boolean isParallelScoring() {
        return parallelScoring;
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetryAttempts, retryBaseDelay, retryMaxDelay);
    }

    public static CorrelationOptions defaults() {
        return builder().build();
    }

    /**
     * Stricter matching: higher threshold and a merge floor that keeps weak chains apart.
     */
    public static CorrelationOptions conservative() {
        return builder()
                .correlationThreshold(0.8)
                .minClusterConfidence(0.5)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxConcurrentRequests(maxConcurrentRequests)
                .perSourceTimeout(perSourceTimeout)
                .maxRetryAttempts(maxRetryAttempts)
                .retryBaseDelay(retryBaseDelay)
                .retryMaxDelay(retryMaxDelay)
                .batchTimeout(batchTimeout)
                .algorithmWeights(algorithmWeights)
                .enabledAlgorithms(enabledAlgorithms)
                .correlationThreshold(correlationThreshold)
                .minClusterConfidence(minClusterConfidence)
                .maxTraversalDepth(maxTraversalDepth)
                .parallelScoring(parallelScoring);
    }

    public static class Builder {
        private int maxConcurrentRequests = DEFAULT_MAX_CONCURRENT_REQUESTS;
        private Duration perSourceTimeout = DEFAULT_PER_SOURCE_TIMEOUT;
        private int maxRetryAttempts = DEFAULT_MAX_RETRY_ATTEMPTS;
        private Duration retryBaseDelay = DEFAULT_RETRY_BASE_DELAY;
        private Duration retryMaxDelay = DEFAULT_RETRY_MAX_DELAY;
        private Duration batchTimeout;
        private AlgorithmWeights algorithmWeights = AlgorithmWeights.equal();
        private Set<AlgorithmType> enabledAlgorithms = EnumSet.allOf(AlgorithmType.class);
        private double correlationThreshold = DEFAULT_CORRELATION_THRESHOLD;
        private double minClusterConfidence = DEFAULT_MIN_CLUSTER_CONFIDENCE;
        private int maxTraversalDepth = DEFAULT_MAX_TRAVERSAL_DEPTH;
        private boolean parallelScoring = false;

        public Builder maxConcurrentRequests(int maxConcurrentRequests) {
            if (maxConcurrentRequests <= 0) {
                throw new IllegalArgumentException("maxConcurrentRequests must be positive");
            }
            this.maxConcurrentRequests = maxConcurrentRequests;
            return this;
        }

        public Builder perSourceTimeout(Duration perSourceTimeout) {
            requirePositive(perSourceTimeout, "perSourceTimeout");
            this.perSourceTimeout = perSourceTimeout;
            return this;
        }

        public Builder maxRetryAttempts(int maxRetryAttempts) {
            if (maxRetryAttempts < 0) {
                throw new IllegalArgumentException("maxRetryAttempts must not be negative");
            }
            this.maxRetryAttempts = maxRetryAttempts;
            return this;
        }

        public Builder retryBaseDelay(Duration retryBaseDelay) {
            if (retryBaseDelay == null || retryBaseDelay.isNegative()) {
                throw new IllegalArgumentException("retryBaseDelay must not be negative");
            }
            this.retryBaseDelay = retryBaseDelay;
            return this;
        }

        public Builder retryMaxDelay(Duration retryMaxDelay) {
            if (retryMaxDelay == null || retryMaxDelay.isNegative()) {
                throw new IllegalArgumentException("retryMaxDelay must not be negative");
            }
            this.retryMaxDelay = retryMaxDelay;
            return this;
        }

        /**
         * @param batchTimeout overall batch deadline, or null for none
         */
        public Builder batchTimeout(Duration batchTimeout) {
            if (batchTimeout != null) {
                requirePositive(batchTimeout, "batchTimeout");
            }
            this.batchTimeout = batchTimeout;
            return this;
        }

        public Builder algorithmWeights(AlgorithmWeights algorithmWeights) {
            if (algorithmWeights == null) {
                throw new IllegalArgumentException("algorithmWeights is required");
            }
            this.algorithmWeights = algorithmWeights;
            return this;
        }

        public Builder enabledAlgorithms(Set<AlgorithmType> enabledAlgorithms) {
            if (enabledAlgorithms == null || enabledAlgorithms.isEmpty()) {
                throw new IllegalArgumentException("at least one correlation algorithm must be enabled");
            }
            this.enabledAlgorithms = EnumSet.copyOf(enabledAlgorithms);
            return this;
        }

        public Builder correlationThreshold(double correlationThreshold) {
            validateUnitInterval(correlationThreshold, "correlationThreshold");
            this.correlationThreshold = correlationThreshold;
            return this;
        }

        public Builder minClusterConfidence(double minClusterConfidence) {
            validateUnitInterval(minClusterConfidence, "minClusterConfidence");
            this.minClusterConfidence = minClusterConfidence;
            return this;
        }

        public Builder maxTraversalDepth(int maxTraversalDepth) {
            if (maxTraversalDepth <= 0) {
                throw new IllegalArgumentException("maxTraversalDepth must be positive");
            }
            this.maxTraversalDepth = maxTraversalDepth;
            return this;
        }

        public Builder parallelScoring(boolean parallelScoring) {
            this.parallelScoring = parallelScoring;
            return this;
        }

        public CorrelationOptions build() {
            if (retryMaxDelay.compareTo(retryBaseDelay) < 0) {
                throw new IllegalArgumentException("retryMaxDelay must be >= retryBaseDelay");
            }
            boolean anyEnabledWeighted = enabledAlgorithms.stream()
                    .anyMatch(t -> algorithmWeights.weightFor(t.getAlgorithmName()) > 0.0);
            if (!anyEnabledWeighted) {
                throw new IllegalArgumentException("every enabled algorithm has weight 0");
            }
            return new CorrelationOptions(this);
        }

        private static void validateUnitInterval(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }

    @Override
    public String toString() {
        return "CorrelationOptions{" +
                "maxConcurrentRequests=" + maxConcurrentRequests +
                ", perSourceTimeout=" + perSourceTimeout +
                ", maxRetryAttempts=" + maxRetryAttempts +
                ", retryBaseDelay=" + retryBaseDelay +
                ", retryMaxDelay=" + retryMaxDelay +
                ", batchTimeout=" + batchTimeout +
                ", algorithmWeights=" + algorithmWeights +
                ", enabledAlgorithms=" + enabledAlgorithms +
                ", correlationThreshold=" + correlationThreshold +
                ", minClusterConfidence=" + minClusterConfidence +
                ", maxTraversalDepth=" + maxTraversalDepth +
                ", parallelScoring=" + parallelScoring +
                '}';
    }
}
