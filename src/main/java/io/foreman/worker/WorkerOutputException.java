package io.foreman.worker;

/**
 * A worker's output could not be read. The dispatcher treats the worker as having left no marker.
 */
public final class WorkerOutputException extends RuntimeException {
    public WorkerOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
