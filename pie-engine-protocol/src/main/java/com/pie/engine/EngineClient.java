package com.pie.engine;

import java.io.IOException;
import java.time.Duration;

/**
 * Contract for submitting one task to the external inference engine and receiving its result.
 * The scheduler depends on this contract only; the default implementation launches the engine CLI
 * once per task, tests substitute an in-memory fake.
 * <p>
 * Implementations are called concurrently from worker threads and must be thread-safe.
 */
public interface EngineClient {

    /**
     * Submits the task and blocks until the engine answers or the timeout elapses.
     *
     * @param request task id, artifact and payload
     * @param timeout maximum wait; {@code null}, zero or negative means unbounded
     * @return exit status plus raw output and diagnostic text
     * @throws EngineTimeoutException when the engine did not answer in time
     * @throws IOException            when the engine could not be reached or launched
     * @throws InterruptedException   when the calling worker was cancelled
     */
    EngineResponse submit(EngineRequest request, Duration timeout)
            throws EngineTimeoutException, IOException, InterruptedException;

    /** Whether a timeout value means "wait forever". */
    static boolean isUnbounded(Duration timeout) {
        return timeout == null || timeout.isZero() || timeout.isNegative();
    }
}
