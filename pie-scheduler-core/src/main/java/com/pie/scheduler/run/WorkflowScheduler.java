package com.pie.scheduler.run;

import com.pie.scheduler.dispatch.DispatchResult;
import com.pie.scheduler.dispatch.NodeDispatcher;
import com.pie.scheduler.dispatch.NodeStatus;
import com.pie.scheduler.graph.DependencyGraph;
import com.pie.scheduler.listener.SafeSchedulerListener;
import com.pie.scheduler.listener.SchedulerListener;
import com.pie.scheduler.store.ResultStore;
import com.pie.workflow.model.NodeDefinition;
import com.pie.workflow.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a workflow to completion over a bounded worker pool.
 * <p>
 * One loop thread owns all run state (pending, running and completed id sets, the {@link ResultStore},
 * the per-node results). Workers only call {@link NodeDispatcher#dispatch} and hand the
 * {@link DispatchResult} back through their future. The loop blocks on the completion service, never
 * polls, and stops at the first of: graph drained, first node failure (fail-fast, in-flight work is
 * interrupted), or deadlock.
 * <p>
 * Result store invariant violations are not node failures: they propagate out of {@link #run} after
 * the pool is torn down.
 */
public final class WorkflowScheduler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowScheduler.class);

    public static final int DEFAULT_MAX_WORKERS = 4;
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final NodeDispatcher dispatcher;
    private final int maxWorkers;
    private final Duration shutdownGrace;
    private final String runIdPrefix;
    private final SchedulerListener listener;

    private WorkflowScheduler(Builder builder) {
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
        this.maxWorkers = builder.maxWorkers;
        this.shutdownGrace = builder.shutdownGrace;
        this.runIdPrefix = builder.runIdPrefix;
        this.listener = new SafeSchedulerListener(builder.listeners);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Runs the workflow under a freshly generated run id. */
    public RunOutcome run(WorkflowDefinition workflow) {
        return run(workflow, RunIds.newRunId(runIdPrefix));
    }

    public RunOutcome run(WorkflowDefinition workflow, String runId) {
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(runId, "runId");
        return new Run(workflow, runId).execute();
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public String getRunIdPrefix() {
        return runIdPrefix;
    }

    /** State of a single run. Confined to the calling thread. */
    private final class Run {

        private final WorkflowDefinition workflow;
        private final String runId;
        private final DependencyGraph graph;
        private final ResultStore store = new ResultStore();
        private final Set<String> pending;
        private final Set<String> running = new LinkedHashSet<>();
        private final Set<String> completed = new LinkedHashSet<>();
        private final Map<String, DispatchResult> finished = new HashMap<>();
        private final Map<String, Instant> dispatchedAt = new HashMap<>();
        private final Map<Future<DispatchResult>, String> inFlight = new LinkedHashMap<>();
        private final Set<String> cancelled = new LinkedHashSet<>();
        private final Path baseDirectory;
        private Instant startedAt;

        Run(WorkflowDefinition workflow, String runId) {
            this.workflow = workflow;
            this.runId = runId;
            this.graph = new DependencyGraph(workflow);
            this.pending = new LinkedHashSet<>(graph.nodeIds());
            this.baseDirectory = workflow.getBaseDirectory();
        }

        RunOutcome execute() {
            startedAt = Instant.now();
            log.info("Run started runId={} workflow={} nodes={} maxWorkers={}",
                    runId, workflow.getName(), graph.size(), maxWorkers);
            listener.onRunStarted(runId, workflow, maxWorkers);

            ExecutorService executor = Executors.newFixedThreadPool(maxWorkers, new WorkerThreadFactory(runId));
            CompletionService<DispatchResult> completions = new ExecutorCompletionService<>(executor);
            RunOutcome outcome;
            try {
                outcome = loop(completions);
            } finally {
                shutdown(executor);
            }
            log.info("Run finished runId={} status={} wallTime={}ms", runId, outcome.getStatus(),
                    outcome.getWallTime().toMillis());
            listener.onRunFinished(outcome);
            return outcome;
        }

        private RunOutcome loop(CompletionService<DispatchResult> completions) {
            while (!DependencyGraph.isEmpty(pending, running)) {
                for (String nodeId : graph.ready(pending, completed)) {
                    if (running.size() >= maxWorkers) break;
                    submit(nodeId, completions);
                }

                if (running.isEmpty()) {
                    return deadlock();
                }

                DispatchResult result;
                try {
                    result = awaitNext(completions);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Run interrupted runId={}; cancelling {} in-flight node(s)", runId, running.size());
                    cancelInFlight();
                    return outcome(RunStatus.FAILED, null, "Run interrupted", null);
                }

                running.remove(result.getNodeId());
                finished.put(result.getNodeId(), result);
                if (result.isSuccess()) {
                    store.put(result.getNodeId(), result.getContent());
                    completed.add(result.getNodeId());
                    log.info("Node completed runId={} node={} duration={}ms",
                            runId, result.getNodeId(), result.duration().toMillis());
                    listener.onNodeCompleted(runId, result);
                } else {
                    log.error("Node failed runId={} node={} status={} diagnostic={}",
                            runId, result.getNodeId(), result.getStatus(), result.getDiagnostic());
                    listener.onNodeFailed(runId, result);
                    cancelInFlight();
                    return outcome(RunStatus.FAILED, result.getNodeId(), result.getDiagnostic(), null);
                }
            }
            return outcome(RunStatus.COMPLETED, null, null, null);
        }

        private void submit(String nodeId, CompletionService<DispatchResult> completions) {
            NodeDefinition node = graph.node(nodeId);
            Map<String, String> upstream = store.getUpstream(node.getDependencies());
            pending.remove(nodeId);
            running.add(nodeId);
            dispatchedAt.put(nodeId, Instant.now());
            Future<DispatchResult> future = completions.submit(
                    () -> dispatcher.dispatch(node, runId, upstream, baseDirectory));
            inFlight.put(future, nodeId);
            log.debug("Node dispatched runId={} node={} upstream={}", runId, nodeId, upstream.keySet());
            listener.onNodeDispatched(runId, node, upstream);
        }

        private DispatchResult awaitNext(CompletionService<DispatchResult> completions) throws InterruptedException {
            Future<DispatchResult> future = completions.take();
            String nodeId = inFlight.remove(future);
            try {
                return future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Dispatcher raised for node={} runId={}", nodeId, runId, cause);
                Instant started = dispatchedAt.getOrDefault(nodeId, Instant.now());
                return DispatchResult.failure(nodeId, NodeStatus.EXCEPTION, started, Instant.now(),
                        cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
            }
        }

        private RunOutcome deadlock() {
            Map<String, List<String>> unmet = new LinkedHashMap<>();
            for (String nodeId : pending) {
                unmet.put(nodeId, graph.unmetDependencies(nodeId, completed));
            }
            DeadlockReport report = new DeadlockReport(unmet, graph.missingDependencies());
            log.error("Deadlock runId={}: {}", runId, report.describe());
            listener.onDeadlock(runId, report);
            return outcome(RunStatus.DEADLOCK, null, report.describe(), report);
        }

        private void cancelInFlight() {
            for (Map.Entry<Future<DispatchResult>, String> e : inFlight.entrySet()) {
                e.getKey().cancel(true);
                cancelled.add(e.getValue());
            }
            inFlight.clear();
            running.clear();
        }

        private RunOutcome outcome(RunStatus status, String failingNodeId, String diagnostic, DeadlockReport report) {
            Instant finishedAt = Instant.now();
            List<NodeRunRecord> records = new ArrayList<>();
            for (String nodeId : graph.nodeIds()) {
                DispatchResult result = finished.get(nodeId);
                if (result != null) {
                    records.add(NodeRunRecord.from(result));
                } else if (cancelled.contains(nodeId)) {
                    records.add(NodeRunRecord.cancelled(nodeId, dispatchedAt.get(nodeId), finishedAt));
                } else {
                    records.add(NodeRunRecord.notStarted(nodeId));
                }
            }
            return new RunOutcome(runId, workflow.getName(), status, failingNodeId, diagnostic, report,
                    records, store.snapshot(), startedAt, finishedAt);
        }

        private void shutdown(ExecutorService executor) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Workers did not stop within {}s after run runId={}", shutdownGrace.toSeconds(), runId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String runId) {
            this.prefix = "pie-worker-" + runId + "-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    public static final class Builder {
        private NodeDispatcher dispatcher;
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private Duration shutdownGrace = DEFAULT_SHUTDOWN_GRACE;
        private String runIdPrefix = RunIds.DEFAULT_PREFIX;
        private final List<SchedulerListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder dispatcher(NodeDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /** @throws IllegalArgumentException if below 1 */
        public Builder maxWorkers(int maxWorkers) {
            if (maxWorkers < 1) {
                throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
            }
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace != null && !shutdownGrace.isNegative() ? shutdownGrace : Duration.ZERO;
            return this;
        }

        public Builder runIdPrefix(String runIdPrefix) {
            this.runIdPrefix = runIdPrefix != null ? runIdPrefix : RunIds.DEFAULT_PREFIX;
            return this;
        }

        public Builder listener(SchedulerListener listener) {
            if (listener != null) listeners.add(listener);
            return this;
        }

        public Builder listeners(List<? extends SchedulerListener> listeners) {
            if (listeners != null) listeners.forEach(this::listener);
            return this;
        }

        public WorkflowScheduler build() {
            return new WorkflowScheduler(this);
        }
    }
}
