package com.pie.report;

import com.pie.scheduler.dispatch.DispatchResult;
import com.pie.scheduler.listener.SchedulerListener;
import com.pie.scheduler.run.DeadlockReport;
import com.pie.scheduler.run.RunOutcome;
import com.pie.workflow.model.NodeDefinition;
import com.pie.workflow.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Human-readable progress reporting: submissions, completions with an output preview, failures,
 * deadlocks, the final results of a successful run and the summary table.
 */
public final class RunReportListener implements SchedulerListener {

    private static final Logger log = LoggerFactory.getLogger(RunReportListener.class);

    static final int PREVIEW_LENGTH = 100;

    private final RunSummaryTable table;
    private final boolean printResults;

    public RunReportListener() {
        this(new RunSummaryTable(), true);
    }

    public RunReportListener(RunSummaryTable table, boolean printResults) {
        this.table = table != null ? table : new RunSummaryTable();
        this.printResults = printResults;
    }

    @Override
    public void onRunStarted(String runId, WorkflowDefinition workflow, int maxWorkers) {
        log.info("=== Starting Workflow: {} (ID: {}, workers: {}) ===", workflow.getName(), runId, maxWorkers);
    }

    @Override
    public void onNodeDispatched(String runId, NodeDefinition node, Map<String, String> upstream) {
        log.info("[Start] {} (inputs: {})", node.getId(), upstream.isEmpty() ? "none" : upstream.keySet());
    }

    @Override
    public void onNodeCompleted(String runId, DispatchResult result) {
        log.info("[Finish] {} ({})", result.getNodeId(), RunSummaryTable.seconds(result.duration()));
        log.info("   Clean Output: {}", preview(result.getContent()));
    }

    @Override
    public void onNodeFailed(String runId, DispatchResult result) {
        log.error("Node {} {}:\n{}", result.getNodeId(), result.getStatus(), result.getDiagnostic());
        log.error("Aborting workflow due to failure in {}", result.getNodeId());
    }

    @Override
    public void onDeadlock(String runId, DeadlockReport report) {
        log.error("Deadlock detected! Remaining: {}", report.getStuckNodes());
        report.getUnmetDependencies().forEach((node, unmet) -> log.error("   {} waits for {}", node, unmet));
        if (!report.getMissingDependencies().isEmpty()) {
            log.error("   Dependencies not defined in workflow: {}", report.getMissingDependencies());
        }
    }

    @Override
    public void onRunFinished(RunOutcome outcome) {
        if (outcome.isCompleted()) {
            log.info("=== Workflow Completed Successfully! ===");
            if (printResults) {
                StringBuilder sb = new StringBuilder("Final Results:");
                outcome.getResults().forEach((id, content) -> sb.append("\n\n>>>>> Node: [").append(id)
                        .append("] <<<<<\n").append(content).append('\n').append("-".repeat(40)));
                log.info("{}", sb);
            }
        } else {
            log.warn("=== Workflow {} ({}) ===", outcome.getStatus(),
                    outcome.getFailingNodeId().map(id -> "failed node: " + id).orElse(outcome.getDiagnostic()));
        }
        log.info("\n{}", table.render(outcome));
    }

    static String preview(String content) {
        if (content == null) return "";
        return content.length() < PREVIEW_LENGTH ? content : content.substring(0, PREVIEW_LENGTH) + "...";
    }
}
