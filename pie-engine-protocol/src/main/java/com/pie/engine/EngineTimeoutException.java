package com.pie.engine;

import java.time.Duration;

/**
 * Thrown by {@link EngineClient#submit} when the engine did not answer within the bound.
 * Distinguishes an unresponsive engine from one that reported an error.
 */
public final class EngineTimeoutException extends Exception {

    private final String taskId;
    private final Duration timeout;

    public EngineTimeoutException(String taskId, Duration timeout) {
        super(String.format("Engine did not answer task %s within %ss", taskId,
                timeout != null ? timeout.toMillis() / 1000.0 : "?"));
        this.taskId = taskId;
        this.timeout = timeout;
    }

    public String getTaskId() {
        return taskId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
