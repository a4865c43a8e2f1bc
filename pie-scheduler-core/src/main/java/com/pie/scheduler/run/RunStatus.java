package com.pie.scheduler.run;

/** Run-level outcome. */
public enum RunStatus {
    /** Every node completed. */
    COMPLETED,
    /** A node failed, timed out or raised; the run was aborted. */
    FAILED,
    /** Pending nodes remained with nothing ready and nothing running. */
    DEADLOCK
}
