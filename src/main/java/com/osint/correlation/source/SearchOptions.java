package com.osint.correlation.source;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Options passed through to source adapters. Every field is optional;
 * adapters ignore the ones they do not support.
 */
public final class SearchOptions {

    private final Duration timeout;
    private final Integer parallelism;
    private final List<String> sites;
    private final List<String> categories;
    private final boolean excludeSensitiveContent;

    private SearchOptions(Builder builder) {
        this.timeout = builder.timeout;
        this.parallelism = builder.parallelism;
        this.sites = List.copyOf(builder.sites);
        this.categories = List.copyOf(builder.categories);
        this.excludeSensitiveContent = builder.excludeSensitiveContent;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<Integer> getParallelism() {
        return Optional.ofNullable(parallelism);
    }

    public List<String> getSites() {
        return sites;
    }

    public List<String> getCategories() {
        return categories;
    }

    public boolean isExcludeSensitiveContent() {
        return excludeSensitiveContent;
    }

    /**
     * Returns a copy with the timeout set, unless one is already present.
     */
    public SearchOptions withDefaultTimeout(Duration defaultTimeout) {
        if (timeout != null) {
            return this;
        }
        return toBuilder().timeout(defaultTimeout).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .timeout(timeout)
                .parallelism(parallelism)
                .sites(sites)
                .categories(categories)
                .excludeSensitiveContent(excludeSensitiveContent);
    }

    public static SearchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration timeout;
        private Integer parallelism;
        private final List<String> sites = new ArrayList<>();
        private final List<String> categories = new ArrayList<>();
        private boolean excludeSensitiveContent;

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder parallelism(Integer parallelism) {
            if (parallelism != null && parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Adds site filters. Comma-separated entries are split.
         */
        public Builder sites(List<String> sites) {
            this.sites.clear();
            this.sites.addAll(normalizeList(sites));
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories.clear();
            this.categories.addAll(normalizeList(categories));
            return this;
        }

        public Builder excludeSensitiveContent(boolean excludeSensitiveContent) {
            this.excludeSensitiveContent = excludeSensitiveContent;
            return this;
        }

        public SearchOptions build() {
            return new SearchOptions(this);
        }

        private static List<String> normalizeList(List<String> values) {
            List<String> out = new ArrayList<>();
            if (values == null) {
                return out;
            }
            for (String value : values) {
                if (value == null) {
                    continue;
                }
                for (String part : value.split(",")) {
                    String trimmed = part.trim();
                    if (!trimmed.isEmpty()) {
                        out.add(trimmed);
                    }
                }
            }
            return out;
        }
    }

    @Override
    public String toString() {
        return "SearchOptions{" +
                "timeout=" + timeout +
                ", parallelism=" + parallelism +
                ", sites=" + sites +
                ", categories=" + categories +
                ", excludeSensitiveContent=" + excludeSensitiveContent +
                '}';
    }
}
