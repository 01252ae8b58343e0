package io.foreman.worker;

import java.time.Duration;

/**
 * A running (or finished) worker as the dispatcher sees it. The id is what gets persisted with the task.
 */
public interface WorkerHandle {
    String id();

    boolean isAlive();

    /**
     * Waits up to {@code timeout} for the worker to exit. Returns true if it is no longer alive.
     */
    boolean awaitExit(Duration timeout) throws InterruptedException;

    void terminate(TerminationMode mode);
}
