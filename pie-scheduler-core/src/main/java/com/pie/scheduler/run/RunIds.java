package com.pie.scheduler.run;

import java.util.UUID;

/**
 * Run id generation: prefix plus the first 8 hex characters of a random UUID.
 */
public final class RunIds {

    public static final String DEFAULT_PREFIX = "run_";

    private RunIds() {
    }

    public static String newRunId() {
        return newRunId(DEFAULT_PREFIX);
    }

    public static String newRunId(String prefix) {
        String p = prefix != null ? prefix : DEFAULT_PREFIX;
        return p + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
