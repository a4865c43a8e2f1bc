package com.pie.app;

import com.pie.config.SchedulerConfig;
import com.pie.engine.EngineClient;
import com.pie.engine.cli.CliEngineClient;
import com.pie.features.metrics.MetricsListener;
import com.pie.report.RunReportListener;
import com.pie.scheduler.dispatch.NodeDispatcher;
import com.pie.scheduler.listener.SchedulerListener;
import com.pie.scheduler.output.OutputNormalizer;
import com.pie.scheduler.payload.PayloadMode;
import com.pie.scheduler.run.RunOutcome;
import com.pie.scheduler.run.WorkflowScheduler;
import com.pie.workflow.load.InvalidWorkflowException;
import com.pie.workflow.load.WorkflowLoader;
import com.pie.workflow.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point: {@code pie-scheduler <workflow.json>}.
 * <p>
 * Configuration comes from PIE_* environment variables (see {@link SchedulerConfig}). Exits with 0 when
 * every node completed and 1 otherwise, including when the workflow cannot be loaded.
 */
public final class PieSchedulerApplication {

    private static final Logger log = LoggerFactory.getLogger(PieSchedulerApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private PieSchedulerApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, SchedulerConfig.fromEnvironment()));
    }

    static int run(String[] args, SchedulerConfig config) {
        return run(args, config, newEngineClient(config));
    }

    /**
     * Loads the workflow named by {@code args[0]} and runs it against the given engine.
     *
     * @return process exit code
     */
    static int run(String[] args, SchedulerConfig config, EngineClient engineClient) {
        if (args == null || args.length == 0 || args[0].isBlank()) {
            log.error("Usage: pie-scheduler <workflow.json>");
            return EXIT_FAILED;
        }
        log.info("Scheduler configuration: {}", config);
        WorkflowScheduler scheduler;
        WorkflowDefinition workflow;
        try {
            scheduler = newScheduler(config, engineClient, List.of(new RunReportListener(), new MetricsListener()));
            workflow = new WorkflowLoader(config.isValidateDependencies()).load(Path.of(args[0]));
        } catch (InvalidWorkflowException | IllegalArgumentException e) {
            log.error("Error: {}", e.getMessage());
            return EXIT_FAILED;
        }
        RunOutcome outcome = scheduler.run(workflow);
        return outcome.isCompleted() ? EXIT_OK : EXIT_FAILED;
    }

    /**
     * Wires dispatcher and scheduler from configuration.
     *
     * @throws IllegalArgumentException for an unknown payload mode
     */
    static WorkflowScheduler newScheduler(SchedulerConfig config, EngineClient engineClient,
                                          List<? extends SchedulerListener> listeners) {
        PayloadMode mode = PayloadMode.fromString(config.getPayloadMode());
        NodeDispatcher dispatcher = new NodeDispatcher(engineClient, mode.newStrategy(),
                OutputNormalizer.withDefaultRules(), config.getNodeTimeout());
        return WorkflowScheduler.builder()
                .dispatcher(dispatcher)
                .maxWorkers(config.getMaxWorkers())
                .shutdownGrace(Duration.ofSeconds(config.getShutdownGraceSeconds()))
                .runIdPrefix(config.getRunIdPrefix())
                .listeners(listeners)
                .build();
    }

    /** CLI client; PIE_CLI_COMMAND may carry leading arguments separated by whitespace. */
    static EngineClient newEngineClient(SchedulerConfig config) {
        List<String> command = Arrays.asList(config.getCliCommand().trim().split("\\s+"));
        return new CliEngineClient(command, config.getEngineLogLevel(), null);
    }
}
