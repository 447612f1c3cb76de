package com.osint.correlation.aggregation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Allows at most {@code requestsPerWindow} attempts per source in each fixed time window.
 * Callers over the limit wait for the next window.
 */
public class FixedWindowRateLimiter implements RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private final int requestsPerWindow;
    private final long windowMillis;
    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public FixedWindowRateLimiter(int requestsPerWindow, Duration window) {
        this(requestsPerWindow, window, Clock.systemUTC());
    }

    FixedWindowRateLimiter(int requestsPerWindow, Duration window, Clock clock) {
        if (requestsPerWindow <= 0) {
            throw new IllegalArgumentException("requestsPerWindow must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.requestsPerWindow = requestsPerWindow;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    @Override
    public void acquire(String sourceName) throws InterruptedException {
        Window window = windows.computeIfAbsent(sourceName, k -> new Window());
        while (true) {
            long waitMillis;
            synchronized (window) {
                long now = clock.millis();
                if (now - window.start >= windowMillis) {
                    window.start = now;
                    window.used = 0;
                }
                if (window.used < requestsPerWindow) {
                    window.used++;
                    return;
                }
                waitMillis = window.start + windowMillis - now;
            }
            log.debug("ratelimit.waiting source={} waitMs={}", sourceName, waitMillis);
            Thread.sleep(Math.max(1, waitMillis));
        }
    }

    /**
     * Attempts left in the current window of a source.
     */
    public int remaining(String sourceName) {
        Window window = windows.get(sourceName);
        if (window == null) {
            return requestsPerWindow;
        }
        synchronized (window) {
            if (clock.millis() - window.start >= windowMillis) {
                return requestsPerWindow;
            }
            return requestsPerWindow - window.used;
        }
    }

    private static final class Window {
        private long start = Long.MIN_VALUE / 2;
        private int used;
    }
}
