package com.pie.scheduler.output;

import java.util.Objects;

/**
 * One textual framing marker the engine may add around a task's output, and how to strip it.
 * Applying a rule never lengthens the text and leaves it unchanged when the marker is absent.
 */
public record CleanupRule(String marker, StripStrategy strategy) {

    public CleanupRule {
        Objects.requireNonNull(strategy, "strategy");
        if (marker == null || marker.isEmpty()) {
            throw new IllegalArgumentException("Cleanup marker must not be empty");
        }
    }

    public static CleanupRule keepAfter(String marker) {
        return new CleanupRule(marker, StripStrategy.KEEP_AFTER);
    }

    public static CleanupRule keepBefore(String marker) {
        return new CleanupRule(marker, StripStrategy.KEEP_BEFORE);
    }

    public static CleanupRule remove(String marker) {
        return new CleanupRule(marker, StripStrategy.REMOVE);
    }

    public static CleanupRule dropLeadingLines(String marker) {
        return new CleanupRule(marker, StripStrategy.DROP_LEADING_LINES);
    }

    public String apply(String text) {
        return switch (strategy) {
            case KEEP_AFTER -> {
                int idx = firstAtLineStart(text);
                yield idx < 0 ? text : text.substring(idx + marker.length());
            }
            case KEEP_BEFORE -> {
                int idx = firstAtLineStart(text);
                yield idx < 0 ? text : text.substring(0, idx);
            }
            case REMOVE -> text.replace(marker, "");
            case DROP_LEADING_LINES -> dropLeadingMarkerLines(text);
        };
    }

    /** Index of the first occurrence at the start of the text or right after a newline; -1 if none. */
    private int firstAtLineStart(String text) {
        int idx = text.indexOf(marker);
        while (idx > 0 && text.charAt(idx - 1) != '\n') {
            idx = text.indexOf(marker, idx + 1);
        }
        return idx;
    }

    private String dropLeadingMarkerLines(String text) {
        String rest = text;
        while (!rest.isEmpty()) {
            int newline = rest.indexOf('\n');
            String first = newline < 0 ? rest : rest.substring(0, newline);
            if (!first.contains(marker)) break;
            rest = newline < 0 ? "" : rest.substring(newline + 1);
        }
        return rest;
    }
}
