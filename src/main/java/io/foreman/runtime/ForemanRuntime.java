package io.foreman.runtime;

import io.foreman.config.DispatcherSettings;
import io.foreman.config.ForemanConfig;
import io.foreman.dispatch.DispatchReport;
import io.foreman.dispatch.Dispatcher;
import io.foreman.dispatch.OperatorActions;
import io.foreman.model.BlockedReasonEntry;
import io.foreman.model.PendingQuestion;
import io.foreman.model.TaskHistoryEntry;
import io.foreman.model.TaskIntake;
import io.foreman.model.TaskRecord;
import io.foreman.model.TaskStatus;
import io.foreman.model.WorkerRole;
import io.foreman.notify.GuardedNotifier;
import io.foreman.notify.Notifier;
import io.foreman.observability.AuditLogger;
import io.foreman.storage.Database;
import io.foreman.storage.TaskStore;
import io.foreman.worker.ProcessWorkerLauncher;
import io.foreman.worker.WorkerLauncher;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wires one data root into a store, a dispatcher and the operator actions. The CLI builds one per invocation.
 */
public final class ForemanRuntime {
    private static final int RECENT_REASONS = 3;

    private final ForemanConfig config;
    private final Database database;
    private final TaskStore taskStore;
    private final DispatcherSettings settings;
    private final AuditLogger auditLogger;
    private final Dispatcher dispatcher;
    private final OperatorActions actions;

    public ForemanRuntime(ForemanConfig config) {
        this(config, DispatcherSettings.load(config), null, null, Clock.systemUTC());
    }

    /**
     * @param launcher {@code null} selects {@link ProcessWorkerLauncher}
     * @param notifier {@code null} selects the sink described by {@code settings.notifyCommand()}
     */
    public ForemanRuntime(
            ForemanConfig config,
            DispatcherSettings settings,
            WorkerLauncher launcher,
            Notifier notifier,
            Clock clock
    ) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.taskStore = new TaskStore(database);
        this.auditLogger = new AuditLogger(config.auditRoot().resolve("audit.log"), clock);
        GuardedNotifier guarded = new GuardedNotifier(
                notifier == null ? GuardedNotifier.fromCommand(settings.notifyCommand()) : notifier,
                auditLogger
        );
        WorkerLauncher effectiveLauncher = launcher == null ? new ProcessWorkerLauncher(config, settings) : launcher;
        this.dispatcher = new Dispatcher(config, taskStore, settings, effectiveLauncher, guarded, auditLogger, clock);
        this.actions = new OperatorActions(taskStore, settings, guarded, auditLogger, clock);
    }

    public void init() {
        database.init();
    }

    public ForemanConfig config() {
        return config;
    }

    public DispatcherSettings settings() {
        return settings;
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public DispatchReport runPass() {
        return dispatcher.runPass();
    }

    public List<Long> addTasks(TaskIntake intake) {
        return actions.addTasks(intake.toNewTasks());
    }

    public Optional<TaskDetail> task(long taskId) {
        return taskStore.getTask(taskId)
                .map(task -> new TaskDetail(task, taskStore.recentBlockedReasons(taskId, RECENT_REASONS)));
    }

    public List<TaskRecord> tasks(TaskStatus status, int limit) {
        return taskStore.listTasks(status, limit);
    }

    public List<TaskHistoryEntry> history(long taskId, int limit) {
        return taskStore.listHistory(taskId, limit);
    }

    public List<BlockedReasonEntry> blockedReasons(long taskId) {
        return taskStore.listBlockedReasons(taskId);
    }

    public StatsOutcome stats() {
        return new StatsOutcome(
                taskStore.countByStatus(),
                taskStore.countInProgressByRole(),
                Map.of(
                        WorkerRole.BUILD, settings.maxParallelBuild(),
                        WorkerRole.VALIDATE, settings.maxParallelValidate()
                )
        );
    }

    public boolean unblock(long taskId, TaskStatus target, String solution) {
        return actions.unblock(taskId, target, solution);
    }

    public List<Long> unblockAll(TaskStatus target, String note) {
        return actions.unblockAll(target, note);
    }

    public long ask(String agent, Long taskId, String question) {
        return actions.ask(agent, taskId, question);
    }

    public List<PendingQuestion> questions() {
        return actions.pendingQuestions();
    }

    public Optional<PendingQuestion> answer(Long questionId, String text) {
        return actions.answer(questionId, text);
    }

    public boolean digestNow() {
        return dispatcher.sendDigestNow();
    }

    public List<Long> purge(int retentionDays) {
        return dispatcher.purgeCompleted(retentionDays);
    }

    public List<String> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public AuditLogger.VerifyResult auditVerify() {
        return auditLogger.verify();
    }

    public record TaskDetail(TaskRecord task, List<BlockedReasonEntry> recentBlockedReasons) {
    }

    public record StatsOutcome(
            Map<TaskStatus, Integer> byStatus,
            Map<WorkerRole, Integer> inProgressByRole,
            Map<WorkerRole, Integer> parallelCaps
    ) {
    }
}
