package com.pie.engine;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One engine submission.
 *
 * @param taskId      task identifier ({@code runId_nodeId}); lets the engine correlate lineage
 * @param artifact    absolute path of the executable unit (e.g. wasm inferlet) the engine runs
 * @param payloadJson JSON input handed to the artifact
 */
public record EngineRequest(String taskId, Path artifact, String payloadJson) {

    public EngineRequest {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(artifact, "artifact");
        payloadJson = payloadJson != null ? payloadJson : "{}";
    }
}
