package io.foreman.worker;

public final class WorkerLaunchException extends Exception {
    public WorkerLaunchException(String message, Throwable cause) {
        super(message, cause);
    }

    public WorkerLaunchException(String message) {
        super(message);
    }
}
