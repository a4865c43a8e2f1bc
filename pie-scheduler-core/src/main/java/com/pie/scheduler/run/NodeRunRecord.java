package com.pie.scheduler.run;

import com.pie.scheduler.dispatch.DispatchResult;
import com.pie.scheduler.dispatch.NodeStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-node line of a {@link RunOutcome}. Timing is absent for nodes that never started.
 *
 * @param output content on success, diagnostic otherwise
 */
public record NodeRunRecord(
        String nodeId,
        NodeStatus status,
        Instant startedAt,
        Instant finishedAt,
        String output
) {
    public NodeRunRecord {
        output = output != null ? output : "";
    }

    public static NodeRunRecord from(DispatchResult result) {
        return new NodeRunRecord(result.getNodeId(), result.getStatus(), result.getStartedAt(),
                result.getFinishedAt(), result.isSuccess() ? result.getContent() : result.getDiagnostic());
    }

    public static NodeRunRecord notStarted(String nodeId) {
        return new NodeRunRecord(nodeId, NodeStatus.NOT_STARTED, null, null, "");
    }

    public static NodeRunRecord cancelled(String nodeId, Instant startedAt, Instant finishedAt) {
        return new NodeRunRecord(nodeId, NodeStatus.CANCELLED, startedAt, finishedAt, "Cancelled after run abort");
    }

    public boolean started() {
        return startedAt != null;
    }

    /** Null when the node never started. */
    public Duration duration() {
        if (startedAt == null || finishedAt == null) return null;
        return Duration.between(startedAt, finishedAt);
    }
}
