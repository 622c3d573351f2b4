package com.mlops.cleanup.config;

import java.util.Objects;

/**
 * Compiled name pattern. Supports:
 * - Exact match: "demo-scripts"
 * - Prefix match: "temp-*"
 * - Suffix match: "*monitoring.coreos.com"
 * - Contains match: "*-demo-*"
 */
public final class NameMatcher {

    enum Mode { EXACT, PREFIX, SUFFIX, CONTAINS }

    private final String pattern;
    private final Mode mode;
    private final String text;

    private NameMatcher(String pattern, Mode mode, String text) {
        this.pattern = pattern;
        this.mode = mode;
        this.text = text;
    }

    /**
     * @throws IllegalArgumentException if the pattern is blank or consists only of wildcards
     */
    public static NameMatcher compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Empty name pattern");
        }
        String trimmed = pattern.trim();
        boolean startsWithWildcard = trimmed.startsWith("*");
        boolean endsWithWildcard = trimmed.length() > 1 && trimmed.endsWith("*");

        int start = startsWithWildcard ? 1 : 0;
        int end = endsWithWildcard ? trimmed.length() - 1 : trimmed.length();
        String text = start >= end ? "" : trimmed.substring(start, end);
        if (text.isEmpty() || text.contains("*")) {
            throw new IllegalArgumentException("Invalid name pattern '" + pattern
                    + "': wildcards are only allowed at the start or end");
        }

        Mode mode;
        if (startsWithWildcard && endsWithWildcard) {
            mode = Mode.CONTAINS;
        } else if (startsWithWildcard) {
            mode = Mode.SUFFIX;
        } else if (endsWithWildcard) {
            mode = Mode.PREFIX;
        } else {
            mode = Mode.EXACT;
        }
        return new NameMatcher(trimmed, mode, text);
    }

    public boolean matches(String name) {
        if (name == null) {
            return false;
        }
        switch (mode) {
            case PREFIX:
                return name.startsWith(text);
            case SUFFIX:
                return name.endsWith(text);
            case CONTAINS:
                return name.contains(text);
            default:
                return name.equals(text);
        }
    }

    public String getPattern() {
        return pattern;
    }

    Mode getMode() {
        return mode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NameMatcher)) return false;
        NameMatcher that = (NameMatcher) o;
        return mode == that.mode && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, text);
    }

    @Override
    public String toString() {
        return pattern;
    }
}
