package com.pie.features.metrics;

import com.pie.scheduler.dispatch.DispatchResult;
import com.pie.scheduler.dispatch.NodeStatus;
import com.pie.scheduler.run.NodeRunRecord;
import com.pie.scheduler.run.RunOutcome;
import com.pie.scheduler.run.RunStatus;
import com.pie.workflow.model.WorkflowDefinition;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class MetricsListenerTest {

    @Test
    void countsNodesAndRunsPerWorkflowAndStatus() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsListener listener = new MetricsListener(registry);
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");

        listener.onRunStarted("run_1", new WorkflowDefinition("rashomon", List.of()), 2);
        listener.onNodeCompleted("run_1", DispatchResult.success("A", t0, t0.plusMillis(400), "a"));
        listener.onNodeCompleted("run_1", DispatchResult.success("B", t0, t0.plusMillis(600), "b"));
        listener.onNodeFailed("run_1", DispatchResult.failure("C", NodeStatus.TIMEOUT, t0, t0.plusSeconds(1), "slow"));
        listener.onRunFinished(new RunOutcome("run_1", "rashomon", RunStatus.FAILED, "C", "slow", null,
                List.of(NodeRunRecord.notStarted("D")), Map.of(), t0, t0.plusSeconds(2)));

        assertEquals(2.0, registry.get(MetricsListener.NODE_EXECUTIONS)
                .tags("workflow", "rashomon", "status", "SUCCESS").counter().count());
        assertEquals(1.0, registry.get(MetricsListener.NODE_EXECUTIONS)
                .tags("workflow", "rashomon", "status", "TIMEOUT").counter().count());
        assertEquals(1000.0, registry.get(MetricsListener.NODE_DURATION)
                .tags("workflow", "rashomon", "status", "SUCCESS").timer().totalTime(TimeUnit.MILLISECONDS));
        assertEquals(1.0, registry.get(MetricsListener.RUN_OUTCOMES)
                .tags("workflow", "rashomon", "status", "FAILED").counter().count());
    }

    @Test
    void unknownRunFallsBackToUnknownWorkflow() {
        MetricsListener listener = new MetricsListener(null);
        Instant t0 = Instant.now();
        listener.onNodeCompleted("run_x", DispatchResult.success("A", t0, t0, "a"));
        assertNotNull(listener.getRegistry().find(MetricsListener.NODE_EXECUTIONS)
                .tags("workflow", "unknown").counter());
    }
}
