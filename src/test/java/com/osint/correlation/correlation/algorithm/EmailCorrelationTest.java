package com.osint.correlation.correlation.algorithm;

import com.osint.correlation.core.model.CorrelationResult;
import com.osint.correlation.core.model.Observation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EmailCorrelation Tests")
class EmailCorrelationTest {

    private final EmailCorrelation algorithm = new EmailCorrelation();

    @Test
    @DisplayName("Same address on two sources scores 1.0")
    void exactMatch() {
        Observation a = Observation.found("hibp", "john@example.com", Map.of());
        Observation b = Observation.found("github", "johndoe", Map.of("email", "John@Example.com"));

        CorrelationResult result = algorithm.score(a, b).orElseThrow();

        assertEquals(1.0, result.confidence());
        assertEquals("exact", result.data().get("matchType"));
    }

    @Test
    @DisplayName("Unrelated addresses are absent")
    void unrelated() {
        Observation a = Observation.found("hibp", "john@example.com", Map.of());
        Observation b = Observation.found("hibp", "mary@other.org", Map.of());

        assertTrue(algorithm.score(a, b).isEmpty());
    }

    @Test
    @DisplayName("Local-part separator variants on one domain score 0.65")
    void separatorVariant() {
        Observation a = Observation.found("hibp", "john.doe@acme.io", Map.of());
        Observation b = Observation.found("gravatar", "john_doe@acme.io", Map.of());

        CorrelationResult result = algorithm.score(a, b).orElseThrow();

        assertEquals(EmailCorrelation.SEPARATOR_VARIANT, result.confidence());
        assertEquals("separator_variant", result.data().get("matchType"));
    }

    @Test
    @DisplayName("Shared corporate domain is weak evidence")
    void sameDomain() {
        Observation a = Observation.found("hibp", "john@acme.io", Map.of());
        Observation b = Observation.found("hibp", "mary@acme.io", Map.of());

        assertEquals(EmailCorrelation.SAME_DOMAIN, algorithm.score(a, b).orElseThrow().confidence());
    }

    @Test
    @DisplayName("Any shared domain scores the fixed domain value, free-mail providers included")
    void freeMailDomain() {
        Observation a = Observation.found("x", "alice@gmail.com", Map.of());
        Observation b = Observation.found("y", "bob@gmail.com", Map.of());

        CorrelationResult result = algorithm.score(a, b).orElseThrow();

        assertEquals(EmailCorrelation.SAME_DOMAIN, result.confidence());
        assertEquals("domain", result.data().get("matchType"));
        assertEquals("gmail.com", result.data().get("domain"));
    }

    @Test
    @DisplayName("Observations without any email are not applicable")
    void noEmail() {
        Observation a = Observation.found("github", "johndoe", Map.of());
        Observation b = Observation.found("hibp", "john@acme.io", Map.of());

        assertTrue(algorithm.score(a, b).isEmpty());
    }
}
