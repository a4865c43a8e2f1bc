package com.pie.report;

import com.pie.scheduler.run.NodeRunRecord;
import com.pie.scheduler.run.RunOutcome;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders the post-run execution table: one row per node ordered by start time (never-started nodes
 * last), followed by the total wall-clock time from the first start to the last finish.
 */
public final class RunSummaryTable {

    private static final int WIDTH = 80;
    private static final String ROW = "| %-20s | %-10s | %-10s | %-9s | %-10s |";
    private static final String NONE = "-";

    private final DateTimeFormatter timeFormat;

    public RunSummaryTable() {
        this(ZoneId.systemDefault());
    }

    public RunSummaryTable(ZoneId zone) {
        this.timeFormat = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(Objects.requireNonNull(zone, "zone"));
    }

    public String render(RunOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(WIDTH)).append('\n');
        sb.append("Workflow Execution Summary: ").append(outcome.getWorkflowName()).append('\n');
        sb.append("Run ID: ").append(outcome.getRunId()).append('\n');
        sb.append("Status: ").append(outcome.getStatus()).append('\n');
        sb.append("-".repeat(WIDTH)).append('\n');
        sb.append(String.format(Locale.ROOT, ROW, "Node ID", "Start", "End", "Duration", "Status")).append('\n');
        sb.append("-".repeat(WIDTH)).append('\n');
        for (NodeRunRecord record : ordered(outcome.getRecords())) {
            sb.append(row(record)).append('\n');
        }
        sb.append("-".repeat(WIDTH)).append('\n');
        sb.append("Total Wall-clock Time: ")
                .append(wallClock(outcome.getRecords()).map(RunSummaryTable::seconds).orElse("N/A"))
                .append('\n');
        sb.append("=".repeat(WIDTH));
        return sb.toString();
    }

    /** Started nodes by start time, then never-started nodes in declaration order. */
    static List<NodeRunRecord> ordered(List<NodeRunRecord> records) {
        List<NodeRunRecord> started = new ArrayList<>();
        List<NodeRunRecord> notStarted = new ArrayList<>();
        for (NodeRunRecord r : records) {
            (r.started() ? started : notStarted).add(r);
        }
        started.sort(Comparator.comparing(NodeRunRecord::startedAt));
        started.addAll(notStarted);
        return started;
    }

    /** First start to last finish over nodes that ran; empty when none did. */
    static Optional<Duration> wallClock(List<NodeRunRecord> records) {
        Instant first = null;
        Instant last = null;
        for (NodeRunRecord r : records) {
            if (r.startedAt() != null && (first == null || r.startedAt().isBefore(first))) first = r.startedAt();
            if (r.finishedAt() != null && (last == null || r.finishedAt().isAfter(last))) last = r.finishedAt();
        }
        if (first == null || last == null) return Optional.empty();
        return Optional.of(Duration.between(first, last));
    }

    private String row(NodeRunRecord r) {
        return String.format(Locale.ROOT, ROW,
                r.nodeId(),
                r.startedAt() != null ? timeFormat.format(r.startedAt()) : NONE,
                r.finishedAt() != null ? timeFormat.format(r.finishedAt()) : NONE,
                r.duration() != null ? seconds(r.duration()) : NONE,
                r.status());
    }

    static String seconds(Duration d) {
        return String.format(Locale.ROOT, "%.2fs", d.toMillis() / 1000.0);
    }
}
