package io.foreman.storage;

import io.foreman.config.ForemanConfig;
import io.foreman.model.BlockedReasonEntry;
import io.foreman.model.NewTask;
import io.foreman.model.PendingQuestion;
import io.foreman.model.PhaseKey;
import io.foreman.model.QuestionStatus;
import io.foreman.model.TaskHistoryEntry;
import io.foreman.model.TaskRecord;
import io.foreman.model.TaskStatus;
import io.foreman.model.WorkerRole;
import io.foreman.support.TestDirs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class TaskStoreTest {
    private static final long NOW = 1_700_000_000_000L;

    private Path root;
    private Database db;
    private TaskStore store;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("foreman-test-store-");
        db = new Database(ForemanConfig.fromRoot(root.toString()));
        db.init();
        store = new TaskStore(db);
    }

    @AfterEach
    void tearDown() throws Exception {
        TestDirs.deleteRecursively(root);
    }

    @Test
    void insertedTasksStartInTodoAndListByPriorityThenId() {
        List<Long> ids = store.insertTasks(List.of(
                new NewTask("low", "shop", "P1", 1, "plan a", null),
                new NewTask("high", "shop", "P1", 5, null, "n"),
                new NewTask("also-low", "shop", "P2", 1, null, null)
        ), NOW);
        Assertions.assertEquals(3, ids.size());

        List<TaskRecord> listed = store.listTasks(null, 10);
        Assertions.assertEquals(List.of(ids.get(1), ids.get(0), ids.get(2)), listed.stream().map(TaskRecord::id).toList());
        TaskRecord first = store.getTask(ids.get(0)).orElseThrow();
        Assertions.assertEquals(TaskStatus.TODO, first.status());
        Assertions.assertEquals(0, first.attemptCount());
        Assertions.assertNull(first.workerHandle());
        Assertions.assertEquals("plan a", first.implementationPlan());
        Assertions.assertEquals(new PhaseKey("shop", "P1"), first.phaseKey());

        List<TaskHistoryEntry> history = store.listHistory(ids.get(0), 10);
        Assertions.assertEquals(1, history.size());
        Assertions.assertEquals("TODO", history.get(0).status());
    }

    @Test
    void markDispatchedIsCompareAndSetOnTodo() {
        long id = store.insertTasks(List.of(new NewTask("t", "p", "P", 3, null, null)), NOW).get(0);

        Assertions.assertTrue(store.markDispatched(id, WorkerRole.BUILD, "4242", NOW + 1));
        Assertions.assertFalse(store.markDispatched(id, WorkerRole.BUILD, "4343", NOW + 2));

        TaskRecord task = store.getTask(id).orElseThrow();
        Assertions.assertEquals(TaskStatus.IN_PROGRESS, task.status());
        Assertions.assertEquals("4242", task.workerHandle());
        Assertions.assertEquals(WorkerRole.BUILD, task.assignedRole());
        Assertions.assertEquals(1, task.attemptCount());
        Assertions.assertEquals(NOW + 1, task.startedAtMs());
    }

    @Test
    void transitionRequiresExpectedHandle() {
        long id = store.insertTasks(List.of(new NewTask("t", "p", "P", 3, null, null)), NOW).get(0);
        store.markDispatched(id, WorkerRole.BUILD, "w-1", NOW);

        Assertions.assertFalse(store.applyTransition(TaskStore.Transition.buildComplete(id, "w-other"), NOW + 1));
        Assertions.assertEquals(TaskStatus.IN_PROGRESS, store.getTask(id).orElseThrow().status());

        Assertions.assertTrue(store.applyTransition(TaskStore.Transition.buildComplete(id, "w-1"), NOW + 2));
        TaskRecord task = store.getTask(id).orElseThrow();
        Assertions.assertEquals(TaskStatus.READY_FOR_TESTING, task.status());
        Assertions.assertNull(task.workerHandle());
        Assertions.assertEquals(0, task.attemptCount());
    }

    @Test
    void blockedTransitionRecordsReasonRow() {
        long id = store.insertTasks(List.of(new NewTask("t", "p", "P", 3, null, null)), NOW).get(0);
        store.markDispatched(id, WorkerRole.BUILD, "w-1", NOW);

        Assertions.assertTrue(store.applyTransition(
                TaskStore.Transition.buildBlocked(id, "w-1", "Task blocked: no api key"), NOW + 1));

        TaskRecord task = store.getTask(id).orElseThrow();
        Assertions.assertEquals(TaskStatus.BLOCKED, task.status());
        Assertions.assertEquals("Task blocked: no api key", task.blockedReason());
        Assertions.assertEquals(1, task.attemptCount());
        List<BlockedReasonEntry> reasons = store.listBlockedReasons(id);
        Assertions.assertEquals(1, reasons.size());
        Assertions.assertEquals("Task blocked: no api key", reasons.get(0).reason());
    }

    @Test
    void phaseTransitionIsAllOrNothing() {
        List<Long> ids = store.insertTasks(List.of(
                new NewTask("a", "p", "P", 3, null, null),
                new NewTask("b", "p", "P", 3, null, null)
        ), NOW);
        for (long id : ids) {
            store.markDispatched(id, WorkerRole.BUILD, "b-" + id, NOW);
            store.applyTransition(TaskStore.Transition.buildComplete(id, "b-" + id), NOW);
        }
        Assertions.assertTrue(store.markPhaseDispatched(ids, ids.get(0), "v-1", NOW + 1));
        Assertions.assertEquals(1, store.getTask(ids.get(0)).orElseThrow().attemptCount());
        Assertions.assertEquals(0, store.getTask(ids.get(1)).orElseThrow().attemptCount());

        setColumn(ids.get(1), "worker_handle", "v-stolen");
        Assertions.assertFalse(store.applyTransition(
                TaskStore.Transition.phaseComplete(ids, ids.get(0), "v-1"), NOW + 2));
        Assertions.assertEquals(TaskStatus.IN_PROGRESS, store.getTask(ids.get(0)).orElseThrow().status());
        Assertions.assertNull(store.getTask(ids.get(0)).orElseThrow().completedAtMs());
    }

    @Test
    void staleRecoveryResetsUntilBudgetIsSpent() {
        long id = store.insertTasks(List.of(new NewTask("t", "p", "P", 3, null, null)), NOW).get(0);
        store.markDispatched(id, WorkerRole.BUILD, "w-1", NOW);

        TaskStore.StaleResolution first = store.recoverStale(List.of(id), id, "w-1", "abrupt stop", TaskStatus.TODO, 3, NOW + 1);
        Assertions.assertEquals(TaskStore.StaleOutcome.RESET, first.outcome());
        Assertions.assertEquals(2, first.attemptCount());
        Assertions.assertEquals(TaskStatus.TODO, store.getTask(id).orElseThrow().status());

        store.markDispatched(id, WorkerRole.BUILD, "w-2", NOW + 2);
        TaskStore.StaleResolution second = store.recoverStale(List.of(id), id, "w-2", "stale timeout", TaskStatus.TODO, 3, NOW + 3);
        Assertions.assertEquals(TaskStore.StaleOutcome.ESCALATED, second.outcome());

        TaskRecord task = store.getTask(id).orElseThrow();
        Assertions.assertEquals(TaskStatus.BLOCKED, task.status());
        Assertions.assertEquals(TaskStore.ATTEMPT_LIMIT_REACHED, task.blockedReason());
        Assertions.assertNull(task.workerHandle());
        Assertions.assertEquals(List.of("abrupt stop", "stale timeout", TaskStore.ATTEMPT_LIMIT_REACHED),
                store.listBlockedReasons(id).stream().map(BlockedReasonEntry::reason).toList());

        TaskStore.StaleResolution again = store.recoverStale(List.of(id), id, "w-2", "stale timeout", TaskStatus.TODO, 3, NOW + 4);
        Assertions.assertEquals(TaskStore.StaleOutcome.CONFLICT, again.outcome());
    }

    @Test
    void unblockOnlyTouchesBlockedTasksAndAppendsSolution() {
        long id = store.insertTasks(List.of(new NewTask("t", "p", "P", 3, null, null)), NOW).get(0);
        Assertions.assertFalse(store.unblock(id, TaskStatus.TODO, "x", true, NOW));

        store.markDispatched(id, WorkerRole.BUILD, "w-1", NOW);
        store.applyTransition(TaskStore.Transition.buildBlocked(id, "w-1", "Task blocked: flaky"), NOW);
        Assertions.assertTrue(store.unblock(id, TaskStatus.TODO, "first hint", false, NOW + 1));
        TaskRecord task = store.getTask(id).orElseThrow();
        Assertions.assertEquals(TaskStatus.TODO, task.status());
        Assertions.assertEquals("first hint", task.solution());
        Assertions.assertEquals(1, task.attemptCount());
        Assertions.assertNull(task.blockedReason());
        Assertions.assertNull(task.errorLog());
        Assertions.assertNull(task.assignedRole());
        Assertions.assertNull(task.startedAtMs());

        store.markDispatched(id, WorkerRole.BUILD, "w-2", NOW + 2);
        store.applyTransition(TaskStore.Transition.buildBlocked(id, "w-2", "Task blocked: still flaky"), NOW + 2);
        Assertions.assertTrue(store.unblock(id, TaskStatus.TODO, "second hint", true, NOW + 3));
        task = store.getTask(id).orElseThrow();
        Assertions.assertEquals("first hint\n\nsecond hint", task.solution());
        Assertions.assertEquals(0, task.attemptCount());
        Assertions.assertEquals(2, store.listBlockedReasons(id).size());
    }

    @Test
    void unblockAllRequeuesEveryBlockedTask() {
        List<Long> ids = store.insertTasks(List.of(
                new NewTask("a", "p", "P", 3, null, null),
                new NewTask("b", "p", "P", 3, null, null),
                new NewTask("c", "p", "P", 3, null, null)
        ), NOW);
        for (long id : ids.subList(0, 2)) {
            store.markDispatched(id, WorkerRole.BUILD, "w-" + id, NOW);
            store.applyTransition(TaskStore.Transition.buildBlocked(id, "w-" + id, "Task blocked: x"), NOW);
        }
        List<Long> requeued = store.unblockAll(TaskStatus.TODO, null, true, NOW + 1);
        Assertions.assertEquals(ids.subList(0, 2), requeued);
        Assertions.assertEquals(0, store.countByStatus().get(TaskStatus.BLOCKED));
        Assertions.assertEquals(3, store.countByStatus().get(TaskStatus.TODO));
        Assertions.assertNull(store.getTask(ids.get(0)).orElseThrow().solution());
    }

    @Test
    void normalizeRewritesLegacyStatusesAndBlocksUnknownOnes() {
        List<Long> ids = store.insertTasks(List.of(
                new NewTask("a", "p", "P", 3, null, null),
                new NewTask("b", "p", "P", 3, null, null),
                new NewTask("c", "p", "P", 3, null, null)
        ), NOW);
        setColumn(ids.get(0), "status", "ready-for-testing");
        setColumn(ids.get(1), "status", "todo");
        setColumn(ids.get(2), "status", "parked");

        Assertions.assertEquals(TaskStatus.BLOCKED, store.getTask(ids.get(2)).orElseThrow().status());
        Assertions.assertEquals(3, store.normalizeStatuses(NOW + 1));

        Assertions.assertEquals(TaskStatus.READY_FOR_TESTING, store.getTask(ids.get(0)).orElseThrow().status());
        Assertions.assertEquals(TaskStatus.TODO, store.getTask(ids.get(1)).orElseThrow().status());
        TaskRecord unknown = store.getTask(ids.get(2)).orElseThrow();
        Assertions.assertEquals(TaskStatus.BLOCKED, unknown.status());
        Assertions.assertEquals("unrecognized status 'parked'", unknown.blockedReason());
        Assertions.assertEquals(0, store.normalizeStatuses(NOW + 2));
    }

    @Test
    void phaseSummariesCountUnfinishedAndReadyPerGroup() {
        List<Long> ids = store.insertTasks(List.of(
                new NewTask("a", "p", "P1", 3, null, null),
                new NewTask("b", "p", "P1", 3, null, null),
                new NewTask("c", "p", null, 9, null, null)
        ), NOW);
        store.markDispatched(ids.get(0), WorkerRole.BUILD, "w", NOW);
        store.applyTransition(TaskStore.Transition.buildComplete(ids.get(0), "w"), NOW);

        List<TaskStore.PhaseSummary> summaries = store.phaseSummaries();
        Assertions.assertEquals(2, summaries.size());
        Assertions.assertEquals(new PhaseKey("p", null), summaries.get(0).key());
        TaskStore.PhaseSummary p1 = summaries.get(1);
        Assertions.assertEquals(1, p1.unfinishedBuild());
        Assertions.assertEquals(1, p1.readyForTesting());
        Assertions.assertEquals(1, store.listPhaseTasks(new PhaseKey("p", "P1"), TaskStatus.READY_FOR_TESTING).size());
    }

    @Test
    void answeringLinkedQuestionAppendsToSolution() {
        long id = store.insertTasks(List.of(new NewTask("t", "p", "P", 3, null, null)), NOW).get(0);
        long q1 = store.insertQuestion("coder", id, "which endpoint?", NOW);
        long q2 = store.insertQuestion("tester", null, "staging up?", NOW + 1);

        List<PendingQuestion> pending = store.listPendingQuestions(10);
        Assertions.assertEquals(List.of(q1, q2), pending.stream().map(PendingQuestion::id).toList());

        Optional<PendingQuestion> answered = store.answerQuestion(null, "use the cached one", NOW + 2);
        Assertions.assertTrue(answered.isPresent());
        Assertions.assertEquals(q1, answered.get().id());
        Assertions.assertEquals(QuestionStatus.ANSWERED, answered.get().status());
        Assertions.assertEquals("\n\n--- Owner Answer (Q#" + q1 + ") ---\nQ: which endpoint?\nA: use the cached one",
                store.getTask(id).orElseThrow().solution());

        Assertions.assertEquals(1, store.expireQuestions(NOW + 10));
        Assertions.assertEquals(QuestionStatus.EXPIRED, store.getQuestion(q2).orElseThrow().status());
        Assertions.assertTrue(store.answerQuestion(q2, "late", NOW + 11).isEmpty());
    }

    @Test
    void purgeRemovesOldCompletedTasksWithTheirRows() {
        List<Long> ids = store.insertTasks(List.of(
                new NewTask("a", "p", "P", 3, null, null),
                new NewTask("b", "p", "P", 3, null, null)
        ), NOW);
        long id = ids.get(0);
        store.markDispatched(id, WorkerRole.BUILD, "w", NOW);
        store.applyTransition(TaskStore.Transition.buildComplete(id, "w"), NOW);
        store.markPhaseDispatched(List.of(id), id, "v", NOW);
        store.applyTransition(TaskStore.Transition.phaseComplete(List.of(id), id, "v"), NOW + 10);
        long q = store.insertQuestion("coder", id, "q?", NOW);

        Assertions.assertEquals(List.of(), store.purgeCompletedBefore(NOW + 10));
        Assertions.assertEquals(List.of(id), store.purgeCompletedBefore(NOW + 11));
        Assertions.assertTrue(store.getTask(id).isEmpty());
        Assertions.assertTrue(store.listHistory(id, 10).isEmpty());
        Assertions.assertNull(store.getQuestion(q).orElseThrow().taskId());
        Assertions.assertTrue(store.getTask(ids.get(1)).isPresent());
    }

    @Test
    void leaseIsExclusiveUntilReleasedOrExpired() {
        Assertions.assertTrue(store.tryAcquireLease("dispatch_lock", "a", NOW, 1_000L));
        Assertions.assertFalse(store.tryAcquireLease("dispatch_lock", "b", NOW + 10, 1_000L));
        Assertions.assertTrue(store.tryAcquireLease("dispatch_lock", "a", NOW + 20, 1_000L));
        Assertions.assertTrue(store.tryAcquireLease("dispatch_lock", "b", NOW + 5_000, 1_000L));

        Assertions.assertFalse(store.releaseLease("dispatch_lock", "a"));
        Assertions.assertTrue(store.releaseLease("dispatch_lock", "b"));
        Assertions.assertTrue(store.tryAcquireLease("dispatch_lock", "a", NOW + 5_001, 1_000L));
    }

    @Test
    void countsIncludeEveryStatus() {
        long id = store.insertTasks(List.of(new NewTask("t", "p", "P", 3, null, null)), NOW).get(0);
        store.markDispatched(id, WorkerRole.BUILD, "w", NOW);

        Map<TaskStatus, Integer> counts = store.countByStatus();
        Assertions.assertEquals(TaskStatus.values().length, counts.size());
        Assertions.assertEquals(1, counts.get(TaskStatus.IN_PROGRESS));
        Assertions.assertEquals(1, store.countInProgressByRole().get(WorkerRole.BUILD));
        Assertions.assertEquals(0, store.countInProgressByRole().get(WorkerRole.VALIDATE));
    }

    private void setColumn(long id, String column, String value) {
        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE tasks SET " + column + "=? WHERE id=?")) {
            ps.setString(1, value);
            ps.setLong(2, id);
            ps.executeUpdate();
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }
}
