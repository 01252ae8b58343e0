package io.foreman.worker;

import io.foreman.model.WorkerRole;

import java.util.List;

/**
 * One worker launch: the role, the task the output is reported against, every task it covers and the
 * instruction payload.
 */
public record WorkerRequest(WorkerRole role, long primaryTaskId, List<Long> taskIds, long timeoutMs, String payload) {
    public WorkerRequest {
        taskIds = List.copyOf(taskIds);
        if (!taskIds.contains(primaryTaskId)) {
            throw new IllegalArgumentException("primary task " + primaryTaskId + " missing from " + taskIds);
        }
    }

    public long timeoutSeconds() {
        return Math.max(1L, timeoutMs / 1000L);
    }
}
