package io.foreman.dispatch;

import io.foreman.config.DispatcherSettings;
import io.foreman.model.TaskRecord;
import io.foreman.worker.TerminationMode;
import io.foreman.worker.WorkerHandle;
import io.foreman.worker.WorkerLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Answers, for an IN_PROGRESS task, whether its worker is still alive and whether it has run past the
 * staleness threshold.
 */
public final class LivenessChecker {
    private static final Logger LOG = LoggerFactory.getLogger(LivenessChecker.class);

    private final WorkerLauncher launcher;
    private final DispatcherSettings settings;
    private final Clock clock;

    public LivenessChecker(WorkerLauncher launcher, DispatcherSettings settings, Clock clock) {
        this.launcher = launcher;
        this.settings = settings;
        this.clock = clock;
    }

    public Liveness check(TaskRecord task) {
        WorkerHandle handle = launcher.attach(task.workerHandle());
        boolean alive = task.hasWorkerHandle() && handle.isAlive();
        long startedAt = task.startedAtMs() == null ? task.updatedAtMs() : task.startedAtMs();
        long elapsed = Math.max(0L, clock.millis() - startedAt);
        return new Liveness(handle, alive, elapsed, elapsed > settings.staleThresholdMs());
    }

    /**
     * Graceful request first; forceful once the grace window passes with the worker still alive.
     * Returns true when the worker is gone afterwards.
     */
    public boolean terminate(WorkerHandle handle) {
        if (!handle.isAlive()) {
            return true;
        }
        handle.terminate(TerminationMode.GRACEFUL);
        try {
            if (handle.awaitExit(Duration.ofMillis(settings.terminateGraceMs()))) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("interrupted during grace period for worker {}, forcing", handle.id());
        }
        handle.terminate(TerminationMode.FORCEFUL);
        boolean gone = !handle.isAlive();
        if (!gone) {
            LOG.warn("worker {} still alive after forceful termination", handle.id());
        }
        return gone;
    }

    public record Liveness(WorkerHandle handle, boolean alive, long elapsedMs, boolean overThreshold) {
        public boolean isRunning() {
            return alive && !overThreshold;
        }
    }
}
