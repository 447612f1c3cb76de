package com.osint.correlation.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalisation helpers shared by the correlation algorithms and blocking keys.
 */
public final class TextNormalizer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}@#]+");
    private static final Pattern TRAILING_DIGITS = Pattern.compile("\\d+$");

    private TextNormalizer() {
    }

    /**
     * Case-folds and strips punctuation, whitespace and separators: {@code John.Doe -> johndoe}.
     */
    public static String normalizeHandle(String value) {
        if (value == null) {
            return "";
        }
        String handle = value.trim();
        if (handle.startsWith("@")) {
            handle = handle.substring(1);
        }
        return NON_ALPHANUMERIC.matcher(handle.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Removes a trailing run of digits: {@code johndoe99 -> johndoe}.
     */
    public static String stripTrailingDigits(String normalizedHandle) {
        return TRAILING_DIGITS.matcher(normalizedHandle).replaceAll("");
    }

    /**
     * Lower-cased word tokens of a free-text value, in first-seen order.
     */
    public static Set<String> tokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Lower-cased, trimmed email, or null when the value is not an email address.
     */
    public static String normalizeEmail(String value) {
        if (value == null) {
            return null;
        }
        String email = value.trim().toLowerCase(Locale.ROOT);
        int at = email.indexOf('@');
        if (at <= 0 || at != email.lastIndexOf('@') || at == email.length() - 1) {
            return null;
        }
        return email;
    }

    public static String emailLocalPart(String normalizedEmail) {
        return normalizedEmail.substring(0, normalizedEmail.indexOf('@'));
    }

    public static String emailDomain(String normalizedEmail) {
        return normalizedEmail.substring(normalizedEmail.indexOf('@') + 1);
    }

    /**
     * Host part of a URL or bare host name, lower-cased and without a {@code www.} prefix.
     * Returns null when nothing host-like is present.
     */
    public static String domainOf(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) {
            return null;
        }
        String host = urlOrHost.trim().toLowerCase(Locale.ROOT);
        int scheme = host.indexOf("://");
        if (scheme >= 0) {
            host = host.substring(scheme + 3);
        }
        int end = host.length();
        for (char stop : new char[]{'/', '?', '#', ':'}) {
            int idx = host.indexOf(stop);
            if (idx >= 0 && idx < end) {
                end = idx;
            }
        }
        host = host.substring(0, end);
        int userInfo = host.lastIndexOf('@');
        if (userInfo >= 0) {
            host = host.substring(userInfo + 1);
        }
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return host.contains(".") ? host : null;
    }
}
