package com.pie.scheduler.dispatch;

import java.nio.file.Path;

/**
 * The node's artifact does not exist at its resolved path. Raised before the engine is invoked.
 */
public class ArtifactNotFoundException extends Exception {

    private final String nodeId;
    private final Path resolvedPath;

    public ArtifactNotFoundException(String nodeId, Path resolvedPath) {
        super("Artifact for node '" + nodeId + "' not found: " + resolvedPath);
        this.nodeId = nodeId;
        this.resolvedPath = resolvedPath;
    }

    public String getNodeId() {
        return nodeId;
    }

    public Path getResolvedPath() {
        return resolvedPath;
    }
}
