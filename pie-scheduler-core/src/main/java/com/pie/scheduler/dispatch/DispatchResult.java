package com.pie.scheduler.dispatch;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Result of dispatching one node: status, timing and either normalized content (success) or a
 * diagnostic (any other status). Returned to the scheduler loop through the worker's future.
 */
public final class DispatchResult {

    private final String nodeId;
    private final NodeStatus status;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final String content;
    private final String diagnostic;

    private DispatchResult(String nodeId, NodeStatus status, Instant startedAt, Instant finishedAt,
                           String content, String diagnostic) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.status = Objects.requireNonNull(status, "status");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.finishedAt = finishedAt != null ? finishedAt : startedAt;
        this.content = content != null ? content : "";
        this.diagnostic = diagnostic != null ? diagnostic : "";
    }

    public static DispatchResult success(String nodeId, Instant startedAt, Instant finishedAt, String content) {
        return new DispatchResult(nodeId, NodeStatus.SUCCESS, startedAt, finishedAt, content, null);
    }

    public static DispatchResult failure(String nodeId, NodeStatus status, Instant startedAt, Instant finishedAt,
                                         String diagnostic) {
        if (status.isSuccess()) {
            throw new IllegalArgumentException("failure() requires a non-success status");
        }
        return new DispatchResult(nodeId, status, startedAt, finishedAt, null, diagnostic);
    }

    public String getNodeId() {
        return nodeId;
    }

    public NodeStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    /** Normalized output; empty unless {@link #isSuccess()}. */
    public String getContent() {
        return content;
    }

    /** Error text; empty on success. */
    public String getDiagnostic() {
        return diagnostic;
    }

    @Override
    public String toString() {
        return "DispatchResult{nodeId='" + nodeId + "', status=" + status + ", duration=" + duration() + "}";
    }
}
