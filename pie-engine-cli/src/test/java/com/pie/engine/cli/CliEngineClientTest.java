package com.pie.engine.cli;

import com.pie.engine.EngineRequest;
import com.pie.engine.EngineResponse;
import com.pie.engine.EngineTimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs a shell script in place of the engine CLI. The script receives the same arguments
 * ({@code submit <artifact> -- --input <json>}) the real CLI would.
 */
class CliEngineClientTest {

    @TempDir
    Path tempDir;

    private CliEngineClient clientFor(String script) throws IOException {
        Path file = Files.writeString(tempDir.resolve("fake-pie-cli.sh"), script);
        return new CliEngineClient(List.of("sh", file.toString()), "warn", tempDir);
    }

    private EngineRequest request() {
        return new EngineRequest("run_0000abcd_a", tempDir.resolve("agent.wasm"), "{\"prompt\":\"hi\"}");
    }

    @Test
    void submit_capturesStdoutAndPassesArguments() throws Exception {
        CliEngineClient client = clientFor("""
                echo "Inferlet launched with ID: 42"
                echo "verb=$1 sep=$3 flag=$4"
                echo "payload=$5"
                echo "log=$RUST_LOG"
                """);

        EngineResponse response = client.submit(request(), Duration.ofSeconds(30));

        assertTrue(response.isSuccess());
        assertTrue(response.output().contains("Inferlet launched with ID: 42"));
        assertTrue(response.output().contains("verb=submit sep=-- flag=--input"), response.output());
        assertTrue(response.output().contains("payload={\"prompt\":\"hi\"}"), response.output());
        assertTrue(response.output().contains("log=warn"), response.output());
    }

    @Test
    void submit_reportsNonZeroExitWithDiagnostic() throws Exception {
        CliEngineClient client = clientFor("""
                echo "Error: Connection refused (os error 111)" >&2
                exit 3
                """);

        EngineResponse response = client.submit(request(), null);

        assertFalse(response.isSuccess());
        assertEquals(3, response.exitCode());
        assertEquals("Error: Connection refused (os error 111)", response.diagnostic());
    }

    @Test
    void submit_throwsTimeoutWhenEngineHangs() throws Exception {
        CliEngineClient client = clientFor("sleep 10\n");

        long start = System.nanoTime();
        EngineTimeoutException e = assertThrows(EngineTimeoutException.class,
                () -> client.submit(request(), Duration.ofMillis(300)));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals("run_0000abcd_a", e.getTaskId());
        assertTrue(elapsedMs < 5_000, "timeout should not wait for the process, took " + elapsedMs + "ms");
    }

    @Test
    void submit_missingExecutableIsIoError() {
        CliEngineClient client = new CliEngineClient(tempDir.resolve("no-such-pie-cli").toString());

        IOException e = assertThrows(IOException.class, () -> client.submit(request(), Duration.ofSeconds(5)));
        assertTrue(e.getMessage().contains("Could not launch engine command"), e.getMessage());
    }

    @Test
    void buildCommand_appendsSubmitArguments() {
        CliEngineClient client = new CliEngineClient();

        List<String> cmd = client.buildCommand(request());

        assertEquals(List.of("pie-cli", "submit", tempDir.resolve("agent.wasm").toString(), "--", "--input",
                "{\"prompt\":\"hi\"}"), cmd);
        assertEquals("error", client.getEngineLogLevel());
    }
}
