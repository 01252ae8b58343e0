package io.foreman.dispatch;

import io.foreman.config.DispatcherSettings;
import io.foreman.model.TaskRecord;
import io.foreman.model.TaskStatus;
import io.foreman.model.WorkerRole;
import io.foreman.support.FakeWorkerLauncher;
import io.foreman.support.MutableClock;
import io.foreman.worker.TerminationMode;
import io.foreman.worker.WorkerLaunchException;
import io.foreman.worker.WorkerRequest;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

final class LivenessCheckerTest {
    private static final long START = 1_700_000_000_000L;

    @Test
    void liveWorkerWithinThresholdIsRunning() throws WorkerLaunchException {
        FakeWorkerLauncher launcher = new FakeWorkerLauncher();
        MutableClock clock = new MutableClock(START);
        String handle = launcher.launch(request(1)).id();
        LivenessChecker checker = new LivenessChecker(launcher, DispatcherSettings.defaults(), clock);

        clock.advance(Duration.ofMinutes(10));
        LivenessChecker.Liveness state = checker.check(inProgress(1, handle, START));

        Assertions.assertTrue(state.alive());
        Assertions.assertFalse(state.overThreshold());
        Assertions.assertTrue(state.isRunning());
        Assertions.assertEquals(Duration.ofMinutes(10).toMillis(), state.elapsedMs());
    }

    @Test
    void liveWorkerPastThresholdIsNotRunning() throws WorkerLaunchException {
        FakeWorkerLauncher launcher = new FakeWorkerLauncher();
        MutableClock clock = new MutableClock(START);
        String handle = launcher.launch(request(1)).id();
        DispatcherSettings settings = DispatcherSettings.defaults();
        LivenessChecker checker = new LivenessChecker(launcher, settings, clock);

        clock.advance(Duration.ofMillis(settings.staleThresholdMs() + 1));
        LivenessChecker.Liveness state = checker.check(inProgress(1, handle, START));

        Assertions.assertTrue(state.alive());
        Assertions.assertTrue(state.overThreshold());
        Assertions.assertFalse(state.isRunning());
    }

    @Test
    void missingOrUnknownHandleIsDead() {
        FakeWorkerLauncher launcher = new FakeWorkerLauncher();
        LivenessChecker checker = new LivenessChecker(launcher, DispatcherSettings.defaults(), new MutableClock(START));

        Assertions.assertFalse(checker.check(inProgress(1, null, START)).alive());
        Assertions.assertFalse(checker.check(inProgress(2, "w-404", START)).alive());
    }

    @Test
    void terminateEscalatesOnlyWhenGracefulIsIgnored() throws WorkerLaunchException {
        FakeWorkerLauncher launcher = new FakeWorkerLauncher();
        LivenessChecker checker = new LivenessChecker(launcher, DispatcherSettings.defaults(), new MutableClock(START));
        launcher.launch(request(1));
        launcher.launch(request(2));
        FakeWorkerLauncher.FakeHandle polite = launcher.handleFor(1);
        FakeWorkerLauncher.FakeHandle stubborn = launcher.handleFor(2);
        stubborn.setIgnoreGraceful(true);

        Assertions.assertTrue(checker.terminate(polite));
        Assertions.assertTrue(checker.terminate(stubborn));

        Assertions.assertEquals(List.of(TerminationMode.GRACEFUL), polite.terminations());
        Assertions.assertEquals(List.of(TerminationMode.GRACEFUL, TerminationMode.FORCEFUL), stubborn.terminations());
        Assertions.assertTrue(checker.terminate(polite));
        Assertions.assertEquals(1, polite.terminations().size());
    }

    static WorkerRequest request(long taskId) {
        return new WorkerRequest(WorkerRole.BUILD, taskId, List.of(taskId), 60_000L, "payload");
    }

    static TaskRecord inProgress(long id, String handle, long startedAt) {
        return new TaskRecord(id, "t" + id, "shop", "P", 3, null, null, null, TaskStatus.IN_PROGRESS, WorkerRole.BUILD,
                handle, 1, null, null, startedAt, startedAt, null, startedAt);
    }
}
