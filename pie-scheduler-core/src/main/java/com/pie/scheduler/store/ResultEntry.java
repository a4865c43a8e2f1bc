package com.pie.scheduler.store;

import java.time.Instant;

/**
 * Completed output of one node. Only successful nodes are stored; failures abort the run instead,
 * so every entry is implicitly a success.
 */
public record ResultEntry(String nodeId, String content, Instant completedAt) {

    public ResultEntry {
        content = content != null ? content : "";
    }
}
