package io.foreman.dispatch;

import io.foreman.config.ForemanConfig;
import io.foreman.model.NewTask;
import io.foreman.model.PhaseKey;
import io.foreman.model.TaskRecord;
import io.foreman.model.TaskStatus;
import io.foreman.model.WorkerRole;
import io.foreman.storage.Database;
import io.foreman.storage.TaskStore;
import io.foreman.support.TestDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class PhaseGateTest {
    private static final long NOW = 1_700_000_000_000L;

    @Test
    void eligibilityNeedsNoUnfinishedBuildAndSomethingReady() {
        PhaseKey key = new PhaseKey("shop", "P");
        Assertions.assertTrue(PhaseGate.isEligible(new TaskStore.PhaseSummary(key, 0, 2)));
        Assertions.assertFalse(PhaseGate.isEligible(new TaskStore.PhaseSummary(key, 1, 2)));
        Assertions.assertFalse(PhaseGate.isEligible(new TaskStore.PhaseSummary(key, 0, 0)));
    }

    @Test
    void primaryIsHighestPriorityThenLowestId() {
        TaskRecord a = task(4, 3);
        TaskRecord b = task(2, 3);
        TaskRecord c = task(9, 8);
        Assertions.assertEquals(9L, PhaseGate.primaryOf(List.of(a, b, c)).id());
        Assertions.assertEquals(2L, PhaseGate.primaryOf(List.of(a, b)).id());
        Assertions.assertThrows(IllegalArgumentException.class, () -> PhaseGate.primaryOf(List.of()));
    }

    @Test
    void onlyFullyBuiltPhasesAreOffered() throws Exception {
        Path root = Files.createTempDirectory("foreman-test-gate-");
        try {
            Database db = new Database(ForemanConfig.fromRoot(root.toString()));
            db.init();
            TaskStore store = new TaskStore(db);
            List<Long> ids = store.insertTasks(List.of(
                    new NewTask("p1-a", "shop", "P1", 3, null, null),
                    new NewTask("p1-b", "shop", "P1", 3, null, null),
                    new NewTask("p2-a", "shop", "P2", 3, null, null),
                    new NewTask("other", "blog", "P1", 3, null, null)
            ), NOW);
            for (long id : List.of(ids.get(0), ids.get(2), ids.get(3))) {
                store.markDispatched(id, WorkerRole.BUILD, "w-" + id, NOW);
                store.applyTransition(TaskStore.Transition.buildComplete(id, "w-" + id), NOW);
            }

            List<PhaseGate.PhaseCandidate> phases = new PhaseGate(store).eligiblePhases();

            Assertions.assertEquals(List.of(new PhaseKey("shop", "P2"), new PhaseKey("blog", "P1")),
                    phases.stream().map(PhaseGate.PhaseCandidate::key).toList());
            Assertions.assertEquals(List.of(ids.get(2)), phases.get(0).taskIds());
            Assertions.assertEquals(TaskStatus.READY_FOR_TESTING, phases.get(1).primary().status());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    private static TaskRecord task(long id, int priority) {
        return new TaskRecord(id, "t" + id, "shop", "P", priority, null, null, null, TaskStatus.READY_FOR_TESTING, null,
                null, 0, null, null, NOW, null, null, NOW);
    }
}
