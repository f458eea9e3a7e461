package com.dbbaskette.envsync.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credential-shaped substrings before text reaches a log or audit sink.
 *
 * <p>All shapes are compiled into one alternation in priority order and evaluated in a
 * single left-to-right pass. Each hit is reported as a tagged {@link Redaction}; only the
 * secret part of a hit is replaced, so {@code Bearer abc} becomes {@code Bearer ***REDACTED***}.
 */
public final class Redactor {

    public static final String MASK = "***REDACTED***";

    public enum Kind {
        AWS_ACCESS_KEY("aws"),
        GITHUB_TOKEN("gh"),
        JWT("jwt"),
        BEARER_TOKEN("bearer"),
        CONNECTION_STRING_PASSWORD("connpw"),
        KEY_VALUE_SECRET("kv"),
        HIGH_ENTROPY("entropy");

        private final String group;

        Kind(String group) {
            this.group = group;
        }
    }

    /** One masked span, half-open {@code [start, end)} in the scanned text. */
    public record Redaction(Kind kind, int start, int end) {}

    private static final Pattern COMBINED = Pattern.compile(String.join("|",
            "(?<aws>\\b(?:AKIA|ASIA)[0-9A-Z]{16}\\b)",
            "(?<gh>\\b(?:gh[pousr]_[A-Za-z0-9]{20,}|github_pat_[A-Za-z0-9_]{20,}))",
            "(?<jwt>\\beyJ[A-Za-z0-9_-]{5,}\\.eyJ[A-Za-z0-9_-]{5,}\\.[A-Za-z0-9_-]{5,})",
            "(?i:\\bbearer)\\s+(?<bearer>[A-Za-z0-9._~+/=-]{8,})",
            "\\b[a-zA-Z][a-zA-Z0-9+.-]*://[^:/\\s@]+:(?<connpw>[^@\\s/]+)@",
            "(?i:\\b(?:password|passwd|pwd|secret|client[_-]?secret|token|api[_-]?key|access[_-]?key|private[_-]?key))"
                    + "[\"']?\\s*[:=]\\s*[\"']?(?<kv>[^\\s\"',;&}]+)",
            "(?<entropy>\\b[A-Za-z0-9+/_-]{40,}={0,2})"));

    private static final double MIN_ENTROPY_BITS = 4.0;

    private static final Set<String> SENSITIVE_KEYS = Set.of(
            "password", "passwd", "secret", "token", "apikey", "accesskey", "privatekey",
            "clientsecret", "credential", "credentials", "authorization", "value", "plaintext");

    private static final int MIN_LITERAL_LENGTH = 4;

    private Redactor() {}

    /**
     * Finds every credential-shaped span in the text, in order of appearance.
     */
    public static List<Redaction> scan(String input) {
        List<Redaction> hits = new ArrayList<>();
        if (input == null || input.isEmpty()) return hits;
        Matcher m = COMBINED.matcher(input);
        while (m.find()) {
            for (Kind kind : Kind.values()) {
                int start = m.start(kind.group);
                if (start < 0) continue;
                int end = m.end(kind.group);
                if (kind != Kind.HIGH_ENTROPY || looksRandom(input.substring(start, end))) {
                    hits.add(new Redaction(kind, start, end));
                }
                break;
            }
        }
        return hits;
    }

    public static String redact(String input) {
        if (input == null) return null;
        List<Redaction> hits = scan(input);
        if (hits.isEmpty()) return input;
        StringBuilder out = new StringBuilder(input.length());
        int cursor = 0;
        for (Redaction hit : hits) {
            out.append(input, cursor, hit.start()).append(MASK);
            cursor = hit.end();
        }
        out.append(input, cursor, input.length());
        return out.toString();
    }

    /**
     * Redacts text and additionally masks every literal occurrence of the known values.
     */
    public static String redact(String input, Collection<String> knownValues) {
        if (input == null) return null;
        String result = input;
        if (knownValues != null) {
            List<String> ordered = new ArrayList<>(knownValues);
            ordered.sort(Comparator.comparingInt(String::length).reversed());
            for (String value : ordered) {
                if (value != null && value.length() >= MIN_LITERAL_LENGTH) {
                    result = result.replace(value, MASK);
                }
            }
        }
        return redact(result);
    }

    /**
     * Deep copy of maps and lists with sensitive keys masked and every string redacted.
     */
    public static Object redactStructure(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                String key = String.valueOf(k);
                copy.put(key, isSensitiveKey(key) && v != null ? MASK : redactStructure(v));
            });
            return copy;
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                copy.add(redactStructure(item));
            }
            return copy;
        }
        if (value instanceof CharSequence text) {
            return redact(text.toString());
        }
        return value;
    }

    static boolean isSensitiveKey(String key) {
        String normalized = key.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        if (SENSITIVE_KEYS.contains(normalized)) return true;
        return normalized.endsWith("password") || normalized.endsWith("secret")
                || normalized.endsWith("apikey") || normalized.endsWith("privatekey");
    }

    private static boolean looksRandom(String candidate) {
        boolean hasDigit = false;
        boolean hasLetter = false;
        int[] counts = new int[128];
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (Character.isDigit(c)) hasDigit = true;
            if (Character.isLetter(c)) hasLetter = true;
            if (c < 128) counts[c]++;
        }
        if (!hasDigit || !hasLetter) return false;
        double entropy = 0;
        for (int count : counts) {
            if (count == 0) continue;
            double p = (double) count / candidate.length();
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy >= MIN_ENTROPY_BITS;
    }
}
