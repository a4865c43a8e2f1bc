package com.pie.scheduler.listener;

import com.pie.scheduler.run.DeadlockReport;
import com.pie.workflow.model.WorkflowDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SafeSchedulerListenerTest {

    @Test
    void failingDelegateDoesNotStopOthers() {
        List<String> seen = new ArrayList<>();
        SchedulerListener broken = new SchedulerListener() {
            @Override
            public void onRunStarted(String runId, WorkflowDefinition workflow, int maxWorkers) {
                throw new RuntimeException("broken");
            }

            @Override
            public void onDeadlock(String runId, DeadlockReport report) {
                throw new IllegalStateException("broken too");
            }
        };
        SchedulerListener recording = new SchedulerListener() {
            @Override
            public void onRunStarted(String runId, WorkflowDefinition workflow, int maxWorkers) {
                seen.add("started:" + runId + ":" + maxWorkers);
            }

            @Override
            public void onDeadlock(String runId, DeadlockReport report) {
                seen.add("deadlock:" + report.getStuckNodes());
            }
        };
        SafeSchedulerListener safe = new SafeSchedulerListener(List.of(broken, recording));

        assertDoesNotThrow(() -> safe.onRunStarted("run_1", new WorkflowDefinition("w", List.of()), 2));
        assertDoesNotThrow(() -> safe.onDeadlock("run_1",
                new DeadlockReport(Map.of("B", List.of("ghost")), Set.of("ghost"))));

        assertEquals(List.of("started:run_1:2", "deadlock:[B]"), seen);
    }

    @Test
    void nullDelegatesMeansNoListeners() {
        assertEquals(0, new SafeSchedulerListener(null).getDelegates().size());
    }
}
