package com.pie.app;

import com.pie.config.SchedulerConfig;
import com.pie.engine.EngineClient;
import com.pie.engine.EngineResponse;
import com.pie.engine.cli.CliEngineClient;
import com.pie.scheduler.run.WorkflowScheduler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PieSchedulerApplicationTest {

    private static final String WORKFLOW = """
            {
              "name": "Two witnesses",
              "nodes": [
                { "id": "Woodcutter", "image": "agents/witness.wasm", "instruction": "Tell what you saw." },
                { "id": "Priest", "image": "agents/witness.wasm", "instruction": "Tell what you heard." },
                { "id": "Judge", "dependencies": ["Woodcutter", "Priest"], "image": "agents/judge.wasm",
                  "instruction": "Decide." }
              ]
            }
            """;

    @TempDir
    Path dir;

    private final Map<String, String> submitted = new ConcurrentHashMap<>();

    private Path writeWorkflow(String json) throws Exception {
        Files.createDirectories(dir.resolve("agents"));
        Files.write(dir.resolve("agents/witness.wasm"), new byte[]{1});
        Files.write(dir.resolve("agents/judge.wasm"), new byte[]{1});
        Path file = dir.resolve("workflow.json");
        Files.writeString(file, json);
        return file;
    }

    private EngineClient engine(int exitCode) {
        return (request, timeout) -> {
            submitted.put(request.taskId(), request.payloadJson());
            return exitCode == 0 ? EngineResponse.success("Completed: ok") : EngineResponse.failure(exitCode, "boom");
        };
    }

    @Test
    void completedRunExitsZero() throws Exception {
        Path file = writeWorkflow(WORKFLOW);
        SchedulerConfig config = SchedulerConfig.builder().maxWorkers(2).runIdPrefix("test_").build();

        int code = PieSchedulerApplication.run(new String[]{file.toString()}, config, engine(0));

        assertEquals(PieSchedulerApplication.EXIT_OK, code);
        assertEquals(3, submitted.size());
        assertTrue(submitted.keySet().stream().allMatch(id -> id.startsWith("test_")), submitted.keySet().toString());
    }

    @Test
    void failedNodeExitsOne() throws Exception {
        Path file = writeWorkflow(WORKFLOW);
        int code = PieSchedulerApplication.run(new String[]{file.toString()}, SchedulerConfig.builder().build(), engine(1));
        assertEquals(PieSchedulerApplication.EXIT_FAILED, code);
    }

    @Test
    void deadlockExitsOne() throws Exception {
        Path file = writeWorkflow("""
                { "name": "stuck", "nodes": [ { "id": "A", "dependencies": ["ghost"], "image": "agents/judge.wasm" } ] }
                """);
        int code = PieSchedulerApplication.run(new String[]{file.toString()}, SchedulerConfig.builder().build(), engine(0));
        assertEquals(PieSchedulerApplication.EXIT_FAILED, code);
        assertTrue(submitted.isEmpty());
    }

    @Test
    void eagerValidationRejectsDanglingDependencyBeforeRunning() throws Exception {
        Path file = writeWorkflow("""
                { "name": "stuck", "nodes": [ { "id": "A", "dependencies": ["ghost"], "image": "agents/judge.wasm" } ] }
                """);
        SchedulerConfig config = SchedulerConfig.builder().validateDependencies(true).build();
        assertEquals(PieSchedulerApplication.EXIT_FAILED,
                PieSchedulerApplication.run(new String[]{file.toString()}, config, engine(0)));
        assertTrue(submitted.isEmpty());
    }

    @Test
    void missingArgumentsOrFileExitOne() {
        SchedulerConfig config = SchedulerConfig.builder().build();
        assertEquals(PieSchedulerApplication.EXIT_FAILED, PieSchedulerApplication.run(new String[0], config, engine(0)));
        assertEquals(PieSchedulerApplication.EXIT_FAILED,
                PieSchedulerApplication.run(new String[]{dir.resolve("nope.json").toString()}, config, engine(0)));
    }

    @Test
    void contentModeSendsUpstreamResults() throws Exception {
        Path file = writeWorkflow(WORKFLOW);
        SchedulerConfig config = SchedulerConfig.builder().payloadMode("content").build();

        assertEquals(PieSchedulerApplication.EXIT_OK,
                PieSchedulerApplication.run(new String[]{file.toString()}, config, engine(0)));

        String judgePayload = submitted.entrySet().stream()
                .filter(e -> e.getKey().endsWith("_Judge")).map(Map.Entry::getValue).findFirst().orElseThrow();
        assertTrue(judgePayload.contains("\"upstream_results\":{\"Woodcutter\":\"ok\",\"Priest\":\"ok\"}"), judgePayload);
    }

    @Test
    void unknownPayloadModeIsRejected() {
        SchedulerConfig config = SchedulerConfig.builder().payloadMode("broadcast").build();
        assertThrows(IllegalArgumentException.class,
                () -> PieSchedulerApplication.newScheduler(config, engine(0), List.of()));
    }

    @Test
    void schedulerAndEngineFollowConfiguration() {
        SchedulerConfig config = SchedulerConfig.builder()
                .maxWorkers(3).shutdownGraceSeconds(7).runIdPrefix("x_")
                .cliCommand("/opt/pie/pie-cli --verbose").engineLogLevel("warn").build();

        WorkflowScheduler scheduler = PieSchedulerApplication.newScheduler(config, engine(0), List.of());
        assertEquals(3, scheduler.getMaxWorkers());
        assertEquals(7, scheduler.getShutdownGrace().toSeconds());
        assertEquals("x_", scheduler.getRunIdPrefix());

        CliEngineClient client = (CliEngineClient) PieSchedulerApplication.newEngineClient(config);
        assertEquals(List.of("/opt/pie/pie-cli", "--verbose"), client.getCommand());
        assertEquals("warn", client.getEngineLogLevel());
    }
}
