package com.pie.scheduler.dispatch;

/**
 * Outcome of one node in a run. The dispatcher returns the first four, or {@link #CANCELLED} when its
 * worker is interrupted. The scheduler assigns {@link #NOT_STARTED} to nodes it never dispatched and
 * {@link #CANCELLED} to nodes still in flight when it aborts.
 */
public enum NodeStatus {
    /** Engine answered with exit status 0; output normalized and stored. */
    SUCCESS,
    /** Engine reported an error, or the artifact was missing. */
    FAILED,
    /** Engine did not answer within the node timeout. */
    TIMEOUT,
    /** Unexpected error (engine binary missing, I/O failure). */
    EXCEPTION,
    /** Never dispatched because the run ended first. */
    NOT_STARTED,
    /** In flight when the run was aborted. */
    CANCELLED;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
