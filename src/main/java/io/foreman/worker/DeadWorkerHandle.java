package io.foreman.worker;

import java.time.Duration;

final class DeadWorkerHandle implements WorkerHandle {
    private final String id;

    DeadWorkerHandle(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isAlive() {
        return false;
    }

    @Override
    public boolean awaitExit(Duration timeout) {
        return true;
    }

    @Override
    public void terminate(TerminationMode mode) {
        // nothing to stop
    }
}
