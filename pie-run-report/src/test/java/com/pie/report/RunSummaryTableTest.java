package com.pie.report;

import com.pie.scheduler.dispatch.NodeStatus;
import com.pie.scheduler.run.NodeRunRecord;
import com.pie.scheduler.run.RunOutcome;
import com.pie.scheduler.run.RunStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunSummaryTableTest {

    private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");

    private static NodeRunRecord ran(String id, int startSec, int endSec, NodeStatus status) {
        return new NodeRunRecord(id, status, T0.plusSeconds(startSec), T0.plusSeconds(endSec), "x");
    }

    private static RunOutcome outcome(RunStatus status, List<NodeRunRecord> records) {
        return new RunOutcome("run_abcdef12", "Rashomon", status, null, null, null,
                records, Map.of(), T0, T0.plusSeconds(30));
    }

    @Test
    void rowsSortedByStartWithNotStartedLast() {
        List<NodeRunRecord> records = List.of(
                NodeRunRecord.notStarted("Z"),
                ran("B", 5, 9, NodeStatus.SUCCESS),
                ran("A", 0, 4, NodeStatus.SUCCESS));
        assertEquals(List.of("A", "B", "Z"),
                RunSummaryTable.ordered(records).stream().map(NodeRunRecord::nodeId).toList());
    }

    @Test
    void wallClockSpansFirstStartToLastFinish() {
        List<NodeRunRecord> records = List.of(
                ran("A", 2, 4, NodeStatus.SUCCESS),
                ran("B", 3, 12, NodeStatus.FAILED),
                NodeRunRecord.notStarted("C"));
        assertEquals(Duration.ofSeconds(10), RunSummaryTable.wallClock(records).orElseThrow());
        assertTrue(RunSummaryTable.wallClock(List.of(NodeRunRecord.notStarted("C"))).isEmpty());
    }

    @Test
    void rendersHeaderRowsAndTotal() {
        String table = new RunSummaryTable(ZoneOffset.UTC).render(outcome(RunStatus.FAILED, List.of(
                ran("Witness", 0, 3, NodeStatus.SUCCESS),
                NodeRunRecord.notStarted("Judge"))));

        assertTrue(table.contains("Workflow Execution Summary: Rashomon"), table);
        assertTrue(table.contains("Run ID: run_abcdef12"), table);
        assertTrue(table.contains("| Witness              | 10:00:00   | 10:00:03   | 3.00s     | SUCCESS    |"), table);
        assertTrue(table.contains("| Judge                | -          | -          | -         | NOT_STARTED |"), table);
        assertTrue(table.contains("Total Wall-clock Time: 3.00s"), table);
        assertTrue(table.indexOf("Witness") < table.indexOf("Judge"));
    }

    @Test
    void totalIsNotAvailableWhenNothingRan() {
        String table = new RunSummaryTable(ZoneOffset.UTC).render(outcome(RunStatus.DEADLOCK,
                List.of(NodeRunRecord.notStarted("A"))));
        assertTrue(table.contains("Total Wall-clock Time: N/A"), table);
    }

    @Test
    void secondsFormatting() {
        assertEquals("1.25s", RunSummaryTable.seconds(Duration.ofMillis(1250)));
    }
}
