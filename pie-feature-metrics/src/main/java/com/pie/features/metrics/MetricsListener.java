package com.pie.features.metrics;

import com.pie.scheduler.dispatch.DispatchResult;
import com.pie.scheduler.listener.SchedulerListener;
import com.pie.scheduler.run.RunOutcome;
import com.pie.workflow.model.WorkflowDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records scheduler metrics: {@code pie.node.executions} and {@code pie.node.duration} per workflow and
 * node status, {@code pie.run.outcomes} per workflow and run status.
 * Uses a {@link SimpleMeterRegistry} unless a registry is supplied.
 */
public final class MetricsListener implements SchedulerListener {

    public static final String NODE_EXECUTIONS = "pie.node.executions";
    public static final String NODE_DURATION = "pie.node.duration";
    public static final String RUN_OUTCOMES = "pie.run.outcomes";

    private final MeterRegistry registry;
    /** Workflow name per active run id. */
    private final Map<String, String> workflows = new ConcurrentHashMap<>();

    public MetricsListener() {
        this(new SimpleMeterRegistry());
    }

    public MetricsListener(MeterRegistry registry) {
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
    }

    @Override
    public void onRunStarted(String runId, WorkflowDefinition workflow, int maxWorkers) {
        workflows.put(runId, nullToUnknown(workflow.getName()));
    }

    @Override
    public void onNodeCompleted(String runId, DispatchResult result) {
        record(runId, result);
    }

    @Override
    public void onNodeFailed(String runId, DispatchResult result) {
        record(runId, result);
    }

    @Override
    public void onRunFinished(RunOutcome outcome) {
        String workflow = nullToUnknown(outcome.getWorkflowName());
        registry.counter(RUN_OUTCOMES, "workflow", workflow, "status", outcome.getStatus().name()).increment();
        workflows.remove(outcome.getRunId());
    }

    private void record(String runId, DispatchResult result) {
        String workflow = workflows.getOrDefault(runId, "unknown");
        String status = result.getStatus().name();
        registry.counter(NODE_EXECUTIONS, "workflow", workflow, "status", status).increment();
        Timer.builder(NODE_DURATION)
                .tag("workflow", workflow)
                .tag("status", status)
                .register(registry)
                .record(result.duration());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
