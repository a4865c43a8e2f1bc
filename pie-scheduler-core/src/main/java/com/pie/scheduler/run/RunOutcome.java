package com.pie.scheduler.run;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one {@link WorkflowScheduler#run}: run-level status plus one {@link NodeRunRecord} per node
 * in declaration order. Results of nodes completed before an abort are kept.
 */
public final class RunOutcome {

    private final String runId;
    private final String workflowName;
    private final RunStatus status;
    private final String failingNodeId;
    private final String diagnostic;
    private final DeadlockReport deadlockReport;
    private final List<NodeRunRecord> records;
    private final Map<String, String> results;
    private final Instant startedAt;
    private final Instant finishedAt;

    public RunOutcome(String runId, String workflowName, RunStatus status, String failingNodeId, String diagnostic,
               DeadlockReport deadlockReport, List<NodeRunRecord> records, Map<String, String> results,
               Instant startedAt, Instant finishedAt) {
        this.runId = runId;
        this.workflowName = workflowName;
        this.status = status;
        this.failingNodeId = failingNodeId;
        this.diagnostic = diagnostic;
        this.deadlockReport = deadlockReport;
        this.records = List.copyOf(records);
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public String getRunId() {
        return runId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    public Optional<String> getFailingNodeId() {
        return Optional.ofNullable(failingNodeId);
    }

    /** Failing node's diagnostic, or the deadlock description; empty on success. */
    public String getDiagnostic() {
        return diagnostic != null ? diagnostic : "";
    }

    public Optional<DeadlockReport> getDeadlockReport() {
        return Optional.ofNullable(deadlockReport);
    }

    public List<NodeRunRecord> getRecords() {
        return records;
    }

    public Optional<NodeRunRecord> getRecord(String nodeId) {
        return records.stream().filter(r -> r.nodeId().equals(nodeId)).findFirst();
    }

    /** Completed node id to normalized output, in completion order. */
    public Map<String, String> getResults() {
        return results;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getWallTime() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return "RunOutcome{runId='" + runId + "', workflow='" + workflowName + "', status=" + status
                + (failingNodeId != null ? ", failingNode=" + failingNodeId : "") + "}";
    }
}
