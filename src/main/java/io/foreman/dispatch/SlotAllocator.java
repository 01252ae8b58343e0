package io.foreman.dispatch;

import io.foreman.config.DispatcherSettings;
import io.foreman.model.TaskRecord;
import io.foreman.model.TaskStatus;
import io.foreman.model.WorkerRole;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class SlotAllocator {
    private final DispatcherSettings settings;
    private final LivenessChecker liveness;

    public SlotAllocator(DispatcherSettings settings, LivenessChecker liveness) {
        this.settings = settings;
        this.liveness = liveness;
    }

    /**
     * Distinct live workers of {@code role}. Tasks of one validated phase share a handle and count once.
     */
    public int liveWorkers(WorkerRole role, List<TaskRecord> inProgress) {
        Set<String> handles = new HashSet<>();
        for (TaskRecord t : inProgress) {
            if (t.status() != TaskStatus.IN_PROGRESS || t.assignedRole() != role || !t.hasWorkerHandle()) {
                continue;
            }
            if (handles.contains(t.workerHandle())) {
                continue;
            }
            if (liveness.check(t).alive()) {
                handles.add(t.workerHandle());
            }
        }
        return handles.size();
    }

    public int availableSlots(WorkerRole role, List<TaskRecord> inProgress) {
        return availableSlots(settings.maxParallel(role), liveWorkers(role, inProgress));
    }

    public static int availableSlots(int cap, int live) {
        return Math.max(0, cap - live);
    }
}
