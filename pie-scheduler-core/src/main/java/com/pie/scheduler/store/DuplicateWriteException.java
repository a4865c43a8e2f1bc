package com.pie.scheduler.store;

/**
 * A node's result was written twice. Indicates a broken node lifecycle in the scheduler, never a
 * recoverable condition.
 */
public final class DuplicateWriteException extends IllegalStateException {

    private final String nodeId;

    public DuplicateWriteException(String nodeId) {
        super("Result for node '" + nodeId + "' was already written");
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
