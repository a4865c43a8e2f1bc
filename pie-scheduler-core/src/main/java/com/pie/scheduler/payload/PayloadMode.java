package com.pie.scheduler.payload;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Configurable payload shapes (PIE_PAYLOAD_MODE).
 */
public enum PayloadMode {
    /** Task id plus parent task ids; engine resolves upstream outputs itself. */
    LINEAGE(LineagePayloadStrategy::new),
    /** Upstream outputs inlined into the request. */
    CONTENT(ContentPassingPayloadStrategy::new);

    private final Supplier<PayloadStrategy> factory;

    PayloadMode(Supplier<PayloadStrategy> factory) {
        this.factory = factory;
    }

    public PayloadStrategy newStrategy() {
        return factory.get();
    }

    /**
     * Parses a mode name, case-insensitive. Blank means {@link #LINEAGE}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static PayloadMode fromString(String value) {
        if (value == null || value.isBlank()) return LINEAGE;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("CONTENT_PASSING".equals(normalized)) return CONTENT;
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown payload mode '" + value + "'; expected LINEAGE or CONTENT", e);
        }
    }
}
