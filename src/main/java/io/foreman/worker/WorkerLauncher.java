package io.foreman.worker;

public interface WorkerLauncher {
    WorkerHandle launch(WorkerRequest request) throws WorkerLaunchException;

    /**
     * Re-attaches to a worker started by an earlier pass. A handle that no longer resolves to a running worker
     * comes back dead rather than failing.
     */
    WorkerHandle attach(String handleId);

    /**
     * Everything the latest worker for {@code primaryTaskId} has written so far; empty if nothing.
     */
    String readOutput(long primaryTaskId);
}
