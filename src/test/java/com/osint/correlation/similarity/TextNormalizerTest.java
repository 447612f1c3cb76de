package com.osint.correlation.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TextNormalizer Tests")
class TextNormalizerTest {

    @Test
    @DisplayName("Handles drop case, separators and a leading @")
    void normalizeHandle() {
        assertEquals("johndoe", TextNormalizer.normalizeHandle("John.Doe"));
        assertEquals("johndoe", TextNormalizer.normalizeHandle("john_doe"));
        assertEquals("johndoe", TextNormalizer.normalizeHandle("@JohnDoe "));
        assertEquals("", TextNormalizer.normalizeHandle(null));
    }

    @Test
    @DisplayName("Trailing digits are stripped")
    void stripTrailingDigits() {
        assertEquals("johndoe", TextNormalizer.stripTrailingDigits("johndoe1987"));
        assertEquals("j0hn", TextNormalizer.stripTrailingDigits("j0hn"));
    }

    @Test
    @DisplayName("Only well-formed addresses normalise as email")
    void normalizeEmail() {
        assertEquals("john@example.com", TextNormalizer.normalizeEmail(" John@Example.COM "));
        assertNull(TextNormalizer.normalizeEmail("john_doe"));
        assertNull(TextNormalizer.normalizeEmail("@example.com"));
        assertNull(TextNormalizer.normalizeEmail("john@"));
        assertNull(TextNormalizer.normalizeEmail("a@b@c"));
    }

    @Test
    @DisplayName("Email parts")
    void emailParts() {
        assertEquals("john.doe", TextNormalizer.emailLocalPart("john.doe@example.com"));
        assertEquals("example.com", TextNormalizer.emailDomain("john.doe@example.com"));
    }

    @Test
    @DisplayName("Domain is extracted from URLs and bare hosts")
    void domainOf() {
        assertEquals("example.com", TextNormalizer.domainOf("https://www.example.com/about?x=1"));
        assertEquals("blog.example.org", TextNormalizer.domainOf("blog.example.org:8080"));
        assertEquals("example.com", TextNormalizer.domainOf("example.com"));
        assertNull(TextNormalizer.domainOf("localhost"));
        assertNull(TextNormalizer.domainOf(" "));
    }

    @Test
    @DisplayName("Tokens keep first-seen order without duplicates")
    void tokens() {
        assertEquals(List.of("security", "researcher", "at", "acme"),
                List.copyOf(TextNormalizer.tokens("Security researcher at ACME. Security!")));
    }
}
