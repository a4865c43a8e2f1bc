package com.pie.scheduler.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pie.engine.EngineClient;
import com.pie.engine.EngineRequest;
import com.pie.engine.EngineResponse;
import com.pie.engine.EngineTimeoutException;
import com.pie.scheduler.output.OutputNormalizer;
import com.pie.scheduler.payload.PayloadContext;
import com.pie.scheduler.payload.PayloadStrategy;
import com.pie.scheduler.payload.TaskIds;
import com.pie.workflow.model.NodeDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes one node against the engine: resolve artifact, build payload, submit, normalize output.
 * <p>
 * Never throws for node-local errors; every outcome is folded into a {@link DispatchResult}. Touches no
 * shared state, so one instance is shared by all worker threads.
 */
public final class NodeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NodeDispatcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String CONNECTION_REFUSED = "Connection refused";

    private final EngineClient engineClient;
    private final PayloadStrategy payloadStrategy;
    private final OutputNormalizer normalizer;
    private final Duration timeout;

    public NodeDispatcher(EngineClient engineClient, PayloadStrategy payloadStrategy,
                          OutputNormalizer normalizer, Duration timeout) {
        this.engineClient = Objects.requireNonNull(engineClient, "engineClient");
        this.payloadStrategy = Objects.requireNonNull(payloadStrategy, "payloadStrategy");
        this.normalizer = normalizer != null ? normalizer : OutputNormalizer.withDefaultRules();
        this.timeout = timeout;
    }

    /**
     * Dispatches the node and blocks until the engine answers.
     *
     * @param node          node to run
     * @param runId         current run id
     * @param upstream      outputs of exactly the node's dependencies, in dependency order
     * @param baseDirectory directory the node's artifact path is relative to
     */
    public DispatchResult dispatch(NodeDefinition node, String runId, Map<String, String> upstream,
                                   Path baseDirectory) {
        Instant startedAt = Instant.now();
        String nodeId = node.getId();
        try {
            Path artifact = resolveArtifact(node, baseDirectory);
            String taskId = TaskIds.taskId(runId, nodeId);
            List<String> parentTaskIds = TaskIds.parentTaskIds(runId, node.getDependencies());
            Map<String, Object> payload = payloadStrategy.buildPayload(
                    new PayloadContext(runId, node, taskId, parentTaskIds, upstream));
            String payloadJson = MAPPER.writeValueAsString(payload);
            log.debug("Submitting node={} taskId={} artifact={}", nodeId, taskId, artifact);

            EngineResponse response = engineClient.submit(new EngineRequest(taskId, artifact, payloadJson), timeout);
            if (!response.isSuccess()) {
                String diagnostic = !response.diagnostic().isBlank()
                        ? response.diagnostic()
                        : "Engine exited with status " + response.exitCode();
                if (diagnostic.contains(CONNECTION_REFUSED)) {
                    log.warn("Engine refused the connection for node={}; is the engine server running (pie serve)?",
                            nodeId);
                }
                return DispatchResult.failure(nodeId, NodeStatus.FAILED, startedAt, Instant.now(), diagnostic);
            }
            return DispatchResult.success(nodeId, startedAt, Instant.now(), normalizer.normalize(response.output()));
        } catch (ArtifactNotFoundException e) {
            return DispatchResult.failure(nodeId, NodeStatus.FAILED, startedAt, Instant.now(), e.getMessage());
        } catch (EngineTimeoutException e) {
            return DispatchResult.failure(nodeId, NodeStatus.TIMEOUT, startedAt, Instant.now(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DispatchResult.failure(nodeId, NodeStatus.CANCELLED, startedAt, Instant.now(),
                    "Node cancelled while running");
        } catch (JsonProcessingException e) {
            return DispatchResult.failure(nodeId, NodeStatus.EXCEPTION, startedAt, Instant.now(),
                    "Could not serialize payload: " + e.getOriginalMessage());
        } catch (IOException | RuntimeException e) {
            log.warn("Node {} raised {}", nodeId, e.toString());
            return DispatchResult.failure(nodeId, NodeStatus.EXCEPTION, startedAt, Instant.now(), describe(e));
        }
    }

    Path resolveArtifact(NodeDefinition node, Path baseDirectory) throws ArtifactNotFoundException {
        String image = node.getImage();
        if (image == null || image.isBlank()) {
            throw new ArtifactNotFoundException(node.getId(), baseDirectory);
        }
        Path resolved = baseDirectory.resolve(image).toAbsolutePath().normalize();
        if (!Files.isRegularFile(resolved)) {
            throw new ArtifactNotFoundException(node.getId(), resolved);
        }
        return resolved;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
