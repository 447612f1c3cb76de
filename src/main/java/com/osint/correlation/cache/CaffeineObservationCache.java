package com.osint.correlation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.osint.correlation.core.model.Observation;
import com.osint.correlation.core.model.ObservationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed {@link ObservationCache}.
 */
public class CaffeineObservationCache implements ObservationCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineObservationCache.class);

    private final Cache<CacheKey, List<Observation>> cache;

    public CaffeineObservationCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineObservationCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<List<Observation>> get(String sourceName, String queryValue) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(sourceName, queryValue)));
    }

    @Override
    public void put(String sourceName, String queryValue, List<Observation> observations) {
        boolean hasError = observations.stream().anyMatch(o -> o.status() == ObservationStatus.ERROR);
        if (hasError) {
            log.debug("cache.skip source={} query={} reason=error-observation", sourceName, queryValue);
            return;
        }
        cache.put(new CacheKey(sourceName, queryValue), List.copyOf(observations));
    }

    @Override
    public void invalidateSource(String sourceName) {
        cache.asMap().keySet().removeIf(key -> key.sourceName().equals(sourceName));
        log.debug("cache.invalidated source={}", sourceName);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    record CacheKey(String sourceName, String queryValue) {}
}
