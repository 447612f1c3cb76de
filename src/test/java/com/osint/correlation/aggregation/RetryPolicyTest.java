package com.osint.correlation.aggregation;

import com.osint.correlation.source.PermanentSourceException;
import com.osint.correlation.source.TransientSourceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

    @Test
    @DisplayName("Delays double from the base delay up to the cap")
    void exponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofMillis(500));

        assertEquals(Duration.ofMillis(100), policy.delayBefore(0));
        assertEquals(Duration.ofMillis(200), policy.delayBefore(1));
        assertEquals(Duration.ofMillis(400), policy.delayBefore(2));
        assertEquals(Duration.ofMillis(500), policy.delayBefore(3));
        assertEquals(Duration.ofMillis(500), policy.delayBefore(40));
    }

    @Test
    @DisplayName("Attempts include the first call")
    void maxAttempts() {
        assertEquals(4, new RetryPolicy(3, Duration.ZERO, Duration.ZERO).maxAttempts());
        assertEquals(1, RetryPolicy.none().maxAttempts());
    }

    @Test
    @DisplayName("Failures are classified by kind")
    void classification() {
        assertTrue(RetryPolicy.isTransient(new TransientSourceException("s", "rate limited")));
        assertTrue(RetryPolicy.isTransient(new UncheckedIOException(new IOException("reset"))));
        assertTrue(RetryPolicy.isTransient(new TimeoutException()));
        assertFalse(RetryPolicy.isTransient(new PermanentSourceException("s", "bad credentials")));
        assertFalse(RetryPolicy.isTransient(new IllegalStateException("parse error")));
    }

    @Test
    @DisplayName("Invalid policies are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(1, Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }
}
