package io.foreman.dispatch;

import io.foreman.model.PhaseKey;
import io.foreman.model.TaskRecord;
import io.foreman.model.TaskStatus;
import io.foreman.storage.TaskStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds phases whose every task has left TODO, IN_PROGRESS and BLOCKED, with at least one READY_FOR_TESTING.
 * Such a phase is validated as one unit carried by its primary task.
 */
public final class PhaseGate {
    static final Comparator<TaskRecord> PRIMARY_ORDER = Comparator
            .comparingInt(TaskRecord::priority).reversed()
            .thenComparingLong(TaskRecord::id);

    private final TaskStore store;

    public PhaseGate(TaskStore store) {
        this.store = store;
    }

    public List<PhaseCandidate> eligiblePhases() {
        List<PhaseCandidate> out = new ArrayList<>();
        for (TaskStore.PhaseSummary summary : store.phaseSummaries()) {
            if (!isEligible(summary)) {
                continue;
            }
            List<TaskRecord> ready = store.listPhaseTasks(summary.key(), TaskStatus.READY_FOR_TESTING);
            if (ready.isEmpty()) {
                continue;
            }
            out.add(new PhaseCandidate(summary.key(), primaryOf(ready), ready));
        }
        return out;
    }

    public static boolean isEligible(TaskStore.PhaseSummary summary) {
        return summary.unfinishedBuild() == 0 && summary.readyForTesting() > 0;
    }

    /**
     * Highest priority, then lowest id.
     */
    public static TaskRecord primaryOf(List<TaskRecord> tasks) {
        return tasks.stream()
                .min(PRIMARY_ORDER)
                .orElseThrow(() -> new IllegalArgumentException("phase has no tasks"));
    }

    public record PhaseCandidate(PhaseKey key, TaskRecord primary, List<TaskRecord> tasks) {
        public PhaseCandidate {
            tasks = List.copyOf(tasks);
        }

        public List<Long> taskIds() {
            return tasks.stream().map(TaskRecord::id).toList();
        }
    }
}
