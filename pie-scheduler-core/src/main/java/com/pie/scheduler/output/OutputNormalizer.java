package com.pie.scheduler.output;

import java.util.List;
import java.util.Objects;

/**
 * Best-effort removal of the framing text the engine CLI prints around an inferlet's answer.
 * <p>
 * Rules run once, in order, each followed by a strip. Every rule cuts only at engine framing (a marker
 * that starts a line, leading banner lines, end-of-turn tokens), so marker text inside the answer is
 * kept and normalizing an already-normalized answer leaves it unchanged. Missing markers are ignored.
 */
public final class OutputNormalizer {

    private static final List<CleanupRule> DEFAULT_RULES = List.of(
            CleanupRule.keepAfter("Completed:"),
            CleanupRule.keepBefore("Stopping backend"),
            CleanupRule.keepBefore("🔄"),
            CleanupRule.remove("<|eot_id|>"),
            CleanupRule.dropLeadingLines("Inferlet launched"));

    private final List<CleanupRule> rules;

    public OutputNormalizer(List<CleanupRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /** Normalizer with the engine CLI's known banners and markers. */
    public static OutputNormalizer withDefaultRules() {
        return new OutputNormalizer(DEFAULT_RULES);
    }

    /** Normalizer that only trims whitespace. */
    public static OutputNormalizer passThrough() {
        return new OutputNormalizer(List.of());
    }

    public static List<CleanupRule> defaultRules() {
        return DEFAULT_RULES;
    }

    public String normalize(String raw) {
        if (raw == null) return "";
        String text = raw.strip();
        for (CleanupRule rule : rules) {
            text = rule.apply(text).strip();
        }
        return text;
    }
}
