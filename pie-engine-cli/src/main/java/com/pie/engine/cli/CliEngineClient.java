package com.pie.engine.cli;

import com.pie.engine.EngineClient;
import com.pie.engine.EngineRequest;
import com.pie.engine.EngineResponse;
import com.pie.engine.EngineTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Engine client that submits each task through the engine command line:
 * {@code <command> submit <artifact> -- --input <payloadJson>}.
 * <p>
 * The CLI connects to a running engine server ({@code pie serve}) and streams the inferlet output to
 * stdout; diagnostics go to stderr. Both streams are redirected to temp files so a chatty process can
 * never block on a full pipe. {@code RUST_LOG} is set to keep engine logging out of the captured output.
 * One process per task; the process is destroyed when the task times out or the worker is interrupted.
 */
public final class CliEngineClient implements EngineClient {

    private static final Logger log = LoggerFactory.getLogger(CliEngineClient.class);

    public static final String DEFAULT_EXECUTABLE = "pie-cli";
    public static final String DEFAULT_ENGINE_LOG_LEVEL = "error";
    private static final String ENV_ENGINE_LOG = "RUST_LOG";

    private final List<String> command;
    private final String engineLogLevel;
    private final Path workingDirectory;

    /**
     * @param command          executable plus any leading arguments (e.g. {@code ["pie-cli"]} or
     *                         {@code ["/opt/pie/target/release/pie-cli"]}); must not be empty
     * @param engineLogLevel   value for {@code RUST_LOG}; null for {@value #DEFAULT_ENGINE_LOG_LEVEL}
     * @param workingDirectory process working directory; null for the current directory
     */
    public CliEngineClient(List<String> command, String engineLogLevel, Path workingDirectory) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Engine command must not be empty");
        }
        this.command = List.copyOf(command);
        this.engineLogLevel = engineLogLevel != null && !engineLogLevel.isBlank()
                ? engineLogLevel.trim() : DEFAULT_ENGINE_LOG_LEVEL;
        this.workingDirectory = workingDirectory;
    }

    /** Client for the given executable with the default log level and working directory. */
    public CliEngineClient(String executable) {
        this(List.of(executable != null && !executable.isBlank() ? executable.trim() : DEFAULT_EXECUTABLE),
                DEFAULT_ENGINE_LOG_LEVEL, null);
    }

    public CliEngineClient() {
        this(DEFAULT_EXECUTABLE);
    }

    @Override
    public EngineResponse submit(EngineRequest request, Duration timeout)
            throws EngineTimeoutException, IOException, InterruptedException {
        List<String> cmd = buildCommand(request);
        Path stdoutFile = Files.createTempFile("pie-task-", ".out");
        Path stderrFile = Files.createTempFile("pie-task-", ".err");
        try {
            ProcessBuilder pb = new ProcessBuilder(cmd)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            pb.environment().put(ENV_ENGINE_LOG, engineLogLevel);
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new IOException("Could not launch engine command '" + command.get(0)
                        + "'; is it installed and on PATH? (" + e.getMessage() + ")", e);
            }
            log.debug("Engine task submitted | taskId={} | pid={} | artifact={}", request.taskId(), process.pid(), request.artifact());
            int exitCode = awaitExit(process, request.taskId(), timeout);
            String output = Files.readString(stdoutFile, StandardCharsets.UTF_8).strip();
            String diagnostic = Files.readString(stderrFile, StandardCharsets.UTF_8).strip();
            return new EngineResponse(exitCode, output, diagnostic);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    List<String> buildCommand(EngineRequest request) {
        List<String> cmd = new ArrayList<>(command);
        cmd.add("submit");
        cmd.add(request.artifact().toString());
        cmd.add("--");
        cmd.add("--input");
        cmd.add(request.payloadJson());
        return cmd;
    }

    private static int awaitExit(Process process, String taskId, Duration timeout)
            throws EngineTimeoutException, InterruptedException {
        try {
            if (EngineClient.isUnbounded(timeout)) {
                return process.waitFor();
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Engine task timed out; process destroyed | taskId={} | timeoutMs={}", taskId, timeout.toMillis());
                throw new EngineTimeoutException(taskId, timeout);
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            log.info("Engine task cancelled; process destroyed | taskId={}", taskId);
            throw e;
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }

    public List<String> getCommand() {
        return command;
    }

    public String getEngineLogLevel() {
        return engineLogLevel;
    }
}
