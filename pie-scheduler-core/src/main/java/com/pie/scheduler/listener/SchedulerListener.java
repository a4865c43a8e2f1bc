package com.pie.scheduler.listener;

import com.pie.scheduler.dispatch.DispatchResult;
import com.pie.scheduler.run.DeadlockReport;
import com.pie.scheduler.run.RunOutcome;
import com.pie.workflow.model.NodeDefinition;
import com.pie.workflow.model.WorkflowDefinition;

import java.util.Map;

/**
 * Observer of scheduler events. All callbacks run on the scheduler loop thread, in event order.
 * Implementations must return quickly; they are wrapped in {@link SafeSchedulerListener} so an
 * exception never affects the run.
 */
public interface SchedulerListener {

    default void onRunStarted(String runId, WorkflowDefinition workflow, int maxWorkers) {
    }

    /** Node moved pending to running; {@code upstream} is exactly what it receives. */
    default void onNodeDispatched(String runId, NodeDefinition node, Map<String, String> upstream) {
    }

    default void onNodeCompleted(String runId, DispatchResult result) {
    }

    /** Node failed, timed out or raised; the run is about to abort. */
    default void onNodeFailed(String runId, DispatchResult result) {
    }

    default void onDeadlock(String runId, DeadlockReport report) {
    }

    default void onRunFinished(RunOutcome outcome) {
    }
}
