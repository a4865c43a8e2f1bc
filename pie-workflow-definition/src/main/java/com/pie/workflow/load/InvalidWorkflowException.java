package com.pie.workflow.load;

/**
 * Thrown when a workflow document cannot be read or is structurally invalid
 * (unparseable JSON, missing or duplicate node ids, dangling dependencies under eager validation).
 */
public class InvalidWorkflowException extends RuntimeException {

    public InvalidWorkflowException(String message) {
        super(message);
    }

    public InvalidWorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
