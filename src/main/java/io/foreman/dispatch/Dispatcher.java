package io.foreman.dispatch;

import io.foreman.config.DispatcherSettings;
import io.foreman.config.ForemanConfig;
import io.foreman.model.BlockedReasonEntry;
import io.foreman.model.NotificationKind;
import io.foreman.model.TaskRecord;
import io.foreman.model.TaskStatus;
import io.foreman.model.WorkerRole;
import io.foreman.notify.GuardedNotifier;
import io.foreman.notify.NotificationEvent;
import io.foreman.observability.AuditLogger;
import io.foreman.storage.StoreException;
import io.foreman.storage.TaskStore;
import io.foreman.worker.InstructionBuilder;
import io.foreman.worker.TerminationMode;
import io.foreman.worker.WorkerHandle;
import io.foreman.worker.WorkerLaunchException;
import io.foreman.worker.WorkerLauncher;
import io.foreman.worker.WorkerOutcome;
import io.foreman.worker.WorkerOutputException;
import io.foreman.worker.WorkerOutputParser;
import io.foreman.worker.WorkerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * One synchronous reconciliation and dispatch pass over the task store. Nothing is cached between passes;
 * every pass re-reads what it needs.
 */
public final class Dispatcher {
    public static final String PASS_LOCK_KEY = "dispatch_lock";
    static final String STALE_TIMEOUT = "stale timeout";
    static final String ABRUPT_STOP = "abrupt stop";
    static final String UNPUBLISHED = "validation passed without publish confirmation";
    private static final int SUMMARY_REASONS = 5;
    private static final int CONTEXT_CHARS = 300;

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final ForemanConfig config;
    private final TaskStore store;
    private final DispatcherSettings settings;
    private final WorkerLauncher launcher;
    private final GuardedNotifier notifier;
    private final AuditLogger audit;
    private final Clock clock;
    private final LivenessChecker liveness;
    private final SlotAllocator slots;
    private final PhaseGate phaseGate;
    private final BlockedDigest digest;
    private final HeartbeatWriter heartbeat;
    private final String owner;

    public Dispatcher(
            ForemanConfig config,
            TaskStore store,
            DispatcherSettings settings,
            WorkerLauncher launcher,
            GuardedNotifier notifier,
            AuditLogger audit,
            Clock clock
    ) {
        this.config = config;
        this.store = store;
        this.settings = settings;
        this.launcher = launcher;
        this.notifier = notifier;
        this.audit = audit;
        this.clock = clock;
        this.liveness = new LivenessChecker(launcher, settings, clock);
        this.slots = new SlotAllocator(settings, liveness);
        this.phaseGate = new PhaseGate(store);
        this.digest = new BlockedDigest(store, settings);
        this.heartbeat = new HeartbeatWriter(store, config.heartbeatFile());
        this.owner = "pid-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public String owner() {
        return owner;
    }

    /**
     * Runs one pass. Store failures propagate as {@link io.foreman.storage.StoreException}; a worker spawn
     * failure stops the pass and is reported through {@link DispatchReport#abortReason()}.
     */
    public DispatchReport runPass() {
        String passId = "pass_" + UUID.randomUUID().toString().substring(0, 12);
        long startedAt = clock.millis();
        if (!store.tryAcquireLease(PASS_LOCK_KEY, owner, startedAt, settings.passLockTtlMs())) {
            LOG.info("pass {} skipped, dispatch lock held by another orchestrator", passId);
            audit.log(AuditLogger.AuditEvent.of("pass.skipped", owner, "locked", null, null, passId, Map.of()));
            return DispatchReport.skipped(passId);
        }
        DispatchReport.Builder report = new DispatchReport.Builder(passId);
        DispatchMdc.setPass(passId);
        try {
            audit.log(AuditLogger.AuditEvent.of("pass.start", owner, "ok", null, null, passId, Map.of()));
            report.normalized(store.normalizeStatuses(clock.millis()));
            reconcileInProgress(report, passId);
            blockExhaustedTodo(report, passId);
            try {
                dispatchBuild(report, passId);
                dispatchValidation(report, passId);
            } catch (WorkerLaunchException e) {
                LOG.error("pass {} aborted: {}", passId, e.getMessage(), e);
                report.abort(e.getMessage());
                audit.log(AuditLogger.AuditEvent.of("pass.abort", owner, "error", null, null, passId,
                        Map.of("error", String.valueOf(e.getMessage()))));
                return report.build();
            }
            sweep(report, passId);
            DispatchReport done = report.build();
            LOG.info("pass {} done: transitions={} launched={} validations={} stale={} escalated={}",
                    passId, done.transitions(), done.buildLaunched().size(), done.validationLaunched().size(),
                    done.staleRecovered().size(), done.escalated().size());
            return done;
        } finally {
            releasePassLock(passId);
            DispatchMdc.clear();
        }
    }

    private void releasePassLock(String passId) {
        try {
            store.releaseLease(PASS_LOCK_KEY, owner);
        } catch (StoreException e) {
            LOG.warn("pass {} could not release the dispatch lock, it expires after {}ms: {}",
                    passId, settings.passLockTtlMs(), e.getMessage());
        }
    }

    /**
     * Forces a blocked-task digest regardless of when the last one was sent.
     */
    public boolean sendDigestNow() {
        long now = clock.millis();
        return digest.due(now, true).map(event -> {
            boolean delivered = notifier.send(event);
            digest.markSent(now);
            return delivered;
        }).orElse(false);
    }

    public List<Long> purgeCompleted(int retentionDays) {
        long now = clock.millis();
        long cutoff = now - retentionDays * 24L * 60L * 60L * 1000L;
        List<Long> purged = store.purgeCompletedBefore(cutoff);
        for (long id : purged) {
            deleteQuietly(id);
        }
        if (!purged.isEmpty()) {
            audit.log(AuditLogger.AuditEvent.of("sweep.purge", owner, "ok", null, null, null,
                    Map.of("count", purged.size(), "task_ids", purged, "retention_days", retentionDays)));
        }
        return purged;
    }

    private void reconcileInProgress(DispatchReport.Builder report, String passId) {
        for (WorkerGroup group : groupByWorker(store.listByStatus(TaskStatus.IN_PROGRESS))) {
            DispatchMdc.setTask(group.primary().id(), group.role());
            try {
                LivenessChecker.Liveness state = liveness.check(group.primary());
                if (state.isRunning()) {
                    continue;
                }
                if (state.alive()) {
                    LOG.warn("worker {} for task {} exceeded stale threshold after {}ms, terminating",
                            group.handle(), group.primary().id(), state.elapsedMs());
                    liveness.terminate(state.handle());
                    recoverStale(group, STALE_TIMEOUT, report, passId);
                    continue;
                }
                WorkerOutcome outcome = WorkerOutputParser.parse(readOutput(group), group.primary().id());
                if (outcome.hasMarker()) {
                    applyOutcome(group, outcome, report, passId);
                } else {
                    recoverStale(group, ABRUPT_STOP, report, passId);
                }
            } finally {
                DispatchMdc.clearTask();
            }
        }
    }

    private void blockExhaustedTodo(DispatchReport.Builder report, String passId) {
        int cap = settings.maxAttempts(WorkerRole.BUILD);
        for (TaskRecord t : store.listByStatus(TaskStatus.TODO)) {
            if (t.attemptCount() < cap) {
                continue;
            }
            DispatchMdc.setTask(t.id(), WorkerRole.BUILD);
            try {
                if (store.blockExhausted(List.of(t.id()), t.id(), TaskStatus.TODO, clock.millis())) {
                    escalated(t, List.of(t.id()), WorkerRole.BUILD, report, passId);
                }
            } finally {
                DispatchMdc.clearTask();
            }
        }
    }

    private void dispatchBuild(DispatchReport.Builder report, String passId) throws WorkerLaunchException {
        int available = slots.availableSlots(WorkerRole.BUILD, store.listByStatus(TaskStatus.IN_PROGRESS));
        if (available <= 0) {
            LOG.debug("no build slots available");
            return;
        }
        int cap = settings.maxAttempts(WorkerRole.BUILD);
        for (TaskRecord task : store.listByStatus(TaskStatus.TODO)) {
            if (available <= 0) {
                break;
            }
            if (task.attemptCount() >= cap) {
                continue;
            }
            DispatchMdc.setTask(task.id(), WorkerRole.BUILD);
            try {
                WorkerRequest request = new WorkerRequest(WorkerRole.BUILD, task.id(), List.of(task.id()),
                        settings.timeoutMs(WorkerRole.BUILD), InstructionBuilder.forBuild(task));
                WorkerHandle handle = launcher.launch(request);
                if (!store.markDispatched(task.id(), WorkerRole.BUILD, handle.id(), clock.millis())) {
                    LOG.warn("task {} changed before it could be marked dispatched, stopping worker {}", task.id(), handle.id());
                    handle.terminate(TerminationMode.FORCEFUL);
                    continue;
                }
                available--;
                report.buildLaunched(task.id());
                int attempt = task.attemptCount() + 1;
                LOG.info("dispatched task {} to {} worker {} (attempt {}/{})",
                        task.id(), WorkerRole.BUILD.agentId(), handle.id(), attempt, cap);
                audit.log(AuditLogger.AuditEvent.of("task.dispatch", owner, "ok", task.id(), WorkerRole.BUILD.name(), passId,
                        Map.of("worker", handle.id(), "attempt", attempt)));
                notify(report, NotificationEvent.of(NotificationKind.STARTED, task.id(), task.name(),
                        "assigned to " + WorkerRole.BUILD.agentId() + " (attempt " + attempt + "/" + cap + ")"));
                awaitAfterLaunch(new WorkerGroup(WorkerRole.BUILD, handle.id(), refreshed(task), List.of(task.id())),
                        handle, report, passId);
            } finally {
                DispatchMdc.clearTask();
            }
        }
    }

    private void dispatchValidation(DispatchReport.Builder report, String passId) throws WorkerLaunchException {
        int available = slots.availableSlots(WorkerRole.VALIDATE, store.listByStatus(TaskStatus.IN_PROGRESS));
        if (available <= 0) {
            LOG.debug("no validation slots available");
            return;
        }
        int cap = settings.maxAttempts(WorkerRole.VALIDATE);
        for (PhaseGate.PhaseCandidate phase : phaseGate.eligiblePhases()) {
            if (available <= 0) {
                break;
            }
            TaskRecord primary = phase.primary();
            DispatchMdc.setTask(primary.id(), WorkerRole.VALIDATE);
            try {
                if (primary.attemptCount() >= cap) {
                    if (store.blockExhausted(phase.taskIds(), primary.id(), TaskStatus.READY_FOR_TESTING, clock.millis())) {
                        escalated(primary, phase.taskIds(), WorkerRole.VALIDATE, report, passId);
                    }
                    continue;
                }
                WorkerRequest request = new WorkerRequest(WorkerRole.VALIDATE, primary.id(), phase.taskIds(),
                        settings.timeoutMs(WorkerRole.VALIDATE), InstructionBuilder.forValidation(primary, phase.tasks()));
                WorkerHandle handle = launcher.launch(request);
                if (!store.markPhaseDispatched(phase.taskIds(), primary.id(), handle.id(), clock.millis())) {
                    LOG.warn("phase {} changed before it could be marked dispatched, stopping worker {}",
                            phase.key().label(), handle.id());
                    handle.terminate(TerminationMode.FORCEFUL);
                    continue;
                }
                available--;
                report.validationLaunched(primary.id());
                int attempt = primary.attemptCount() + 1;
                LOG.info("dispatched phase {} ({} tasks, primary {}) to {} worker {}",
                        phase.key().label(), phase.tasks().size(), primary.id(), WorkerRole.VALIDATE.agentId(), handle.id());
                audit.log(AuditLogger.AuditEvent.of("phase.dispatch", owner, "ok", primary.id(), WorkerRole.VALIDATE.name(), passId,
                        Map.of("worker", handle.id(), "attempt", attempt, "phase", phase.key().label(), "task_ids", phase.taskIds())));
                notify(report, NotificationEvent.of(NotificationKind.STARTED, primary.id(), primary.name(),
                        "assigned to " + WorkerRole.VALIDATE.agentId() + " for phase " + phase.key().label()
                                + " (" + phase.tasks().size() + " tasks, attempt " + attempt + "/" + cap + ")"));
                awaitAfterLaunch(new WorkerGroup(WorkerRole.VALIDATE, handle.id(), refreshed(primary), phase.taskIds()),
                        handle, report, passId);
            } finally {
                DispatchMdc.clearTask();
            }
        }
    }

    /**
     * Bounded wait right after launch. A worker that exits inside the window is settled now; silence counts as
     * an explicit block. Anything still running is left for a later pass.
     */
    private void awaitAfterLaunch(WorkerGroup group, WorkerHandle handle, DispatchReport.Builder report, String passId) {
        if (settings.launchWaitMs() <= 0L) {
            return;
        }
        try {
            if (!handle.awaitExit(Duration.ofMillis(settings.launchWaitMs()))) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("interrupted waiting for worker {}, leaving it to the next pass", handle.id());
            return;
        }
        WorkerOutcome outcome = WorkerOutputParser.parse(readOutput(group), group.primary().id());
        applyOutcome(group, outcome, report, passId);
    }

    private void applyOutcome(WorkerGroup group, WorkerOutcome outcome, DispatchReport.Builder report, String passId) {
        TaskRecord primary = group.primary();
        TaskStore.Transition transition;
        NotificationEvent event;
        if (group.role() == WorkerRole.BUILD) {
            if (outcome.kind() == WorkerOutcome.Kind.COMPLETE) {
                transition = TaskStore.Transition.buildComplete(primary.id(), group.handle());
                event = NotificationEvent.of(NotificationKind.READY, primary.id(), primary.name(), "ready for testing");
            } else {
                String reason = outcome.kind() == WorkerOutcome.Kind.BLOCKED
                        ? "Task blocked: " + outcome.reason()
                        : WorkerOutcome.NO_MARKER_REASON;
                transition = TaskStore.Transition.buildBlocked(primary.id(), group.handle(), reason);
                event = NotificationEvent.of(NotificationKind.BLOCKER, primary.id(), primary.name(), describe(primary, reason));
            }
        } else {
            if (outcome.kind() == WorkerOutcome.Kind.COMPLETE && outcome.publishConfirmed()) {
                transition = TaskStore.Transition.phaseComplete(group.taskIds(), primary.id(), group.handle());
                event = NotificationEvent.of(NotificationKind.COMPLETE, primary.id(), primary.name(),
                        "phase complete (" + group.taskIds().size() + " tasks, pushed " + outcome.publishRef() + ")");
            } else if (outcome.kind() == WorkerOutcome.Kind.COMPLETE) {
                LOG.warn("validation of task {} reported success without publish confirmation, returning phase to {}",
                        primary.id(), TaskStatus.READY_FOR_TESTING);
                transition = TaskStore.Transition.phaseUnpublished(group.taskIds(), primary.id(), group.handle(), UNPUBLISHED);
                event = NotificationEvent.of(NotificationKind.RESET, primary.id(), primary.name(),
                        UNPUBLISHED + "; phase returned to " + TaskStatus.READY_FOR_TESTING);
            } else {
                String reason = outcome.kind() == WorkerOutcome.Kind.BLOCKED
                        ? "Testing blocked: " + outcome.reason()
                        : WorkerOutcome.NO_MARKER_REASON;
                transition = TaskStore.Transition.phaseBlocked(group.taskIds(), primary.id(), group.handle(), reason);
                event = NotificationEvent.of(NotificationKind.BLOCKER, primary.id(), primary.name(), describe(primary, reason));
            }
        }
        if (!store.applyTransition(transition, clock.millis())) {
            LOG.warn("outcome {} for task {} not applied, tasks changed under worker {}",
                    outcome.kind(), primary.id(), group.handle());
            return;
        }
        report.outcomeApplied(primary.id());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("outcome", outcome.kind().name());
        details.put("status", transition.target().name());
        details.put("task_ids", group.taskIds());
        if (outcome.reason() != null) {
            details.put("reason", outcome.reason());
        }
        if (outcome.publishRef() != null) {
            details.put("publish_ref", outcome.publishRef());
        }
        audit.log(AuditLogger.AuditEvent.of(group.role() == WorkerRole.BUILD ? "task.outcome" : "phase.outcome",
                owner, "ok", primary.id(), group.role().name(), passId, details));
        LOG.info("task {} -> {} ({})", primary.id(), transition.target(), outcome.kind());
        notify(report, event);
    }

    private void recoverStale(WorkerGroup group, String incident, DispatchReport.Builder report, String passId) {
        TaskRecord primary = group.primary();
        TaskStatus retryStatus = group.role() == WorkerRole.BUILD ? TaskStatus.TODO : TaskStatus.READY_FOR_TESTING;
        int cap = settings.maxAttempts(group.role());
        TaskStore.StaleResolution resolution = store.recoverStale(group.taskIds(), primary.id(), group.handle(),
                incident, retryStatus, cap, clock.millis());
        if (resolution.outcome() == TaskStore.StaleOutcome.CONFLICT) {
            LOG.warn("stale recovery of task {} skipped, tasks changed under worker {}", primary.id(), group.handle());
            return;
        }
        report.staleRecovered(primary.id());
        audit.log(AuditLogger.AuditEvent.of("task.stale", owner, resolution.outcome().name().toLowerCase(Locale.ROOT),
                primary.id(), group.role().name(), passId,
                Map.of("incident", incident, "attempt", resolution.attemptCount(), "max_attempts", cap,
                        "worker", String.valueOf(group.handle()), "task_ids", group.taskIds())));
        if (resolution.outcome() == TaskStore.StaleOutcome.ESCALATED) {
            LOG.warn("task {} {} and attempt limit reached ({}/{}), blocking", primary.id(), incident, resolution.attemptCount(), cap);
            escalated(primary, group.taskIds(), group.role(), report, passId);
            return;
        }
        LOG.warn("task {} {}, reset to {} (attempt {}/{})", primary.id(), incident, retryStatus, resolution.attemptCount(), cap);
        notify(report, NotificationEvent.of(NotificationKind.RESET, primary.id(), primary.name(),
                incident + "; reset to " + retryStatus + " (attempt " + resolution.attemptCount() + "/" + cap + ")"));
    }

    private void escalated(TaskRecord primary, List<Long> taskIds, WorkerRole role, DispatchReport.Builder report, String passId) {
        report.escalated(primary.id());
        List<BlockedReasonEntry> failures = store.recentBlockedReasons(primary.id(), SUMMARY_REASONS * 2).stream()
                .filter(entry -> !TaskStore.ATTEMPT_LIMIT_REACHED.equals(entry.reason()))
                .toList();
        List<BlockedReasonEntry> recent = failures.subList(Math.max(0, failures.size() - SUMMARY_REASONS), failures.size());
        StringBuilder summary = new StringBuilder();
        summary.append(TaskStore.ATTEMPT_LIMIT_REACHED)
                .append(" (").append(role.agentId()).append(" cap ").append(settings.maxAttempts(role)).append(")");
        if (!recent.isEmpty()) {
            summary.append("\nRecent failures:");
            for (BlockedReasonEntry entry : recent) {
                summary.append("\n- ").append(entry.reason());
            }
        }
        audit.log(AuditLogger.AuditEvent.of("task.escalate", owner, "blocked", primary.id(), role.name(), passId,
                Map.of("task_ids", taskIds, "incidents", recent.size())));
        notify(report, NotificationEvent.of(NotificationKind.BLOCKER, primary.id(), primary.name(),
                describe(primary, summary.toString())));
    }

    private void sweep(DispatchReport.Builder report, String passId) {
        report.purged(purgeCompleted(settings.completedRetentionDays()));
        long now = clock.millis();
        digest.due(now, false).ifPresent(event -> {
            notify(report, event);
            digest.markSent(now);
            report.digestSent();
        });
        heartbeat.write(now, passId);
    }

    private void notify(DispatchReport.Builder report, NotificationEvent event) {
        report.notification(notifier.send(event));
    }

    /**
     * Unreadable output counts as no output, so the group falls through to the no-marker path.
     */
    private String readOutput(WorkerGroup group) {
        try {
            return launcher.readOutput(group.primary().id());
        } catch (WorkerOutputException e) {
            LOG.warn("output of worker {} for task {} unreadable, treating as no marker: {}",
                    group.handle(), group.primary().id(), e.getMessage());
            return "";
        }
    }

    private TaskRecord refreshed(TaskRecord task) {
        return store.getTask(task.id()).orElse(task);
    }

    private void deleteQuietly(long taskId) {
        try {
            Files.deleteIfExists(config.taskLogFile(taskId));
            Files.deleteIfExists(config.taskPromptFile(taskId));
        } catch (IOException e) {
            LOG.warn("failed to delete worker files of purged task {}: {}", taskId, e.getMessage());
        }
    }

    /**
     * Immediate reason plus the task's accumulated context, trimmed for a chat message.
     */
    static String describe(TaskRecord task, String reason) {
        StringBuilder sb = new StringBuilder(reason);
        appendContext(sb, "Project", task.project());
        appendContext(sb, "Phase", task.phase());
        appendContext(sb, "Plan", task.implementationPlan());
        appendContext(sb, "Notes", task.notes());
        appendContext(sb, "Solution", task.solution());
        return sb.toString();
    }

    private static void appendContext(StringBuilder sb, String label, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        String trimmed = value.strip();
        if (trimmed.length() > CONTEXT_CHARS) {
            trimmed = trimmed.substring(0, CONTEXT_CHARS) + "...";
        }
        sb.append('\n').append(label).append(": ").append(trimmed);
    }

    /**
     * IN_PROGRESS tasks grouped by the worker that owns them. Validation siblings share one handle; every build
     * task, and every task that lost its handle, stands alone.
     */
    static List<WorkerGroup> groupByWorker(List<TaskRecord> inProgress) {
        Map<String, List<TaskRecord>> phases = new LinkedHashMap<>();
        List<WorkerGroup> out = new ArrayList<>();
        for (TaskRecord t : inProgress) {
            if (t.assignedRole() == WorkerRole.VALIDATE && t.hasWorkerHandle()) {
                phases.computeIfAbsent(t.workerHandle(), k -> new ArrayList<>()).add(t);
            } else {
                WorkerRole role = t.assignedRole() == null ? WorkerRole.BUILD : t.assignedRole();
                out.add(new WorkerGroup(role, t.workerHandle(), t, List.of(t.id())));
            }
        }
        for (Map.Entry<String, List<TaskRecord>> e : phases.entrySet()) {
            TaskRecord primary = PhaseGate.primaryOf(e.getValue());
            out.add(new WorkerGroup(WorkerRole.VALIDATE, e.getKey(), primary,
                    e.getValue().stream().map(TaskRecord::id).toList()));
        }
        return out;
    }

    record WorkerGroup(WorkerRole role, String handle, TaskRecord primary, List<Long> taskIds) {
    }
}
