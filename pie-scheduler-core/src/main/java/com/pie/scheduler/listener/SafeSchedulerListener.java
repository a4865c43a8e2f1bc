package com.pie.scheduler.listener;

import com.pie.scheduler.dispatch.DispatchResult;
import com.pie.scheduler.run.DeadlockReport;
import com.pie.scheduler.run.RunOutcome;
import com.pie.workflow.model.NodeDefinition;
import com.pie.workflow.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fail-safe fan-out to a list of listeners. Any exception from a delegate is caught and logged and the
 * remaining delegates still run, so reporting never fails a run.
 */
public final class SafeSchedulerListener implements SchedulerListener {

    private static final Logger log = LoggerFactory.getLogger(SafeSchedulerListener.class);

    private final List<SchedulerListener> delegates;

    public SafeSchedulerListener(List<SchedulerListener> delegates) {
        this.delegates = delegates != null ? List.copyOf(delegates) : List.of();
    }

    @Override
    public void onRunStarted(String runId, WorkflowDefinition workflow, int maxWorkers) {
        each("onRunStarted", runId, l -> l.onRunStarted(runId, workflow, maxWorkers));
    }

    @Override
    public void onNodeDispatched(String runId, NodeDefinition node, Map<String, String> upstream) {
        each("onNodeDispatched", runId, l -> l.onNodeDispatched(runId, node, upstream));
    }

    @Override
    public void onNodeCompleted(String runId, DispatchResult result) {
        each("onNodeCompleted", runId, l -> l.onNodeCompleted(runId, result));
    }

    @Override
    public void onNodeFailed(String runId, DispatchResult result) {
        each("onNodeFailed", runId, l -> l.onNodeFailed(runId, result));
    }

    @Override
    public void onDeadlock(String runId, DeadlockReport report) {
        each("onDeadlock", runId, l -> l.onDeadlock(runId, report));
    }

    @Override
    public void onRunFinished(RunOutcome outcome) {
        each("onRunFinished", outcome.getRunId(), l -> l.onRunFinished(outcome));
    }

    private void each(String event, String runId, Consumer<SchedulerListener> call) {
        for (SchedulerListener delegate : delegates) {
            try {
                call.accept(delegate);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} (runId={}); run continues. Error: {}",
                        delegate.getClass().getSimpleName(), event, runId, e.getMessage(), e);
            }
        }
    }

    public List<SchedulerListener> getDelegates() {
        return delegates;
    }
}
