package io.foreman.model;

/**
 * Snapshot of one row of the task table. Timestamps are epoch millis; {@code null} when unset.
 */
public record TaskRecord(
        long id,
        String name,
        String project,
        String phase,
        int priority,
        String implementationPlan,
        String notes,
        String solution,
        TaskStatus status,
        WorkerRole assignedRole,
        String workerHandle,
        int attemptCount,
        String blockedReason,
        String errorLog,
        long createdAtMs,
        Long startedAtMs,
        Long completedAtMs,
        long updatedAtMs
) {
    public PhaseKey phaseKey() {
        return new PhaseKey(project, phase);
    }

    public boolean hasWorkerHandle() {
        return workerHandle != null && !workerHandle.isBlank();
    }
}
