package io.foreman.dispatch;

import io.foreman.config.DispatcherSettings;
import io.foreman.model.NewTask;
import io.foreman.model.NotificationKind;
import io.foreman.model.PendingQuestion;
import io.foreman.model.TaskStatus;
import io.foreman.notify.GuardedNotifier;
import io.foreman.notify.NotificationEvent;
import io.foreman.observability.AuditLogger;
import io.foreman.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator-side mutations: intake, unblock and clarification questions. None of these touch a task that is
 * attached to a worker.
 */
public final class OperatorActions {
    static final int QUESTION_LIST_LIMIT = 10;
    private static final Logger LOG = LoggerFactory.getLogger(OperatorActions.class);

    private final TaskStore store;
    private final DispatcherSettings settings;
    private final GuardedNotifier notifier;
    private final AuditLogger audit;
    private final Clock clock;

    public OperatorActions(TaskStore store, DispatcherSettings settings, GuardedNotifier notifier, AuditLogger audit, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.notifier = notifier;
        this.audit = audit;
        this.clock = clock;
    }

    public List<Long> addTasks(List<NewTask> tasks) {
        List<Long> ids = store.insertTasks(tasks, clock.millis());
        audit.log(AuditLogger.AuditEvent.of("task.add", "operator", "ok", null, null, null,
                Map.of("count", ids.size(), "task_ids", ids)));
        LOG.info("added {} tasks: {}", ids.size(), ids);
        return ids;
    }

    public boolean unblock(long taskId, TaskStatus target, String solution) {
        TaskStatus status = requireUnblockTarget(target);
        boolean updated = store.unblock(taskId, status, solution, settings.unblockResetsAttempts(), clock.millis());
        audit.log(AuditLogger.AuditEvent.of("task.unblock", "operator", updated ? "ok" : "not_updated", taskId, null, null,
                Map.of("status", status.name(), "with_solution", solution != null && !solution.isBlank())));
        if (updated) {
            LOG.info("task {} unblocked to {}", taskId, status);
        }
        return updated;
    }

    public List<Long> unblockAll(TaskStatus target, String note) {
        TaskStatus status = requireUnblockTarget(target);
        List<Long> ids = store.unblockAll(status, note, settings.unblockResetsAttempts(), clock.millis());
        audit.log(AuditLogger.AuditEvent.of("task.unblock", "operator", "ok", null, null, null,
                Map.of("status", status.name(), "count", ids.size(), "task_ids", ids)));
        LOG.info("requeued {} blocked tasks to {}", ids.size(), status);
        return ids;
    }

    public long ask(String agent, Long taskId, String question) {
        if (agent == null || agent.isBlank()) {
            throw new IllegalArgumentException("agent is required");
        }
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
        String name = "";
        if (taskId != null) {
            name = store.getTask(taskId)
                    .orElseThrow(() -> new IllegalArgumentException("task not found: " + taskId))
                    .name();
        }
        long now = clock.millis();
        expireQuestions(now);
        long id = store.insertQuestion(agent.trim(), taskId, question.trim(), now);
        notifier.send(NotificationEvent.of(NotificationKind.AGENT_QUESTION, taskId == null ? 0L : taskId, name,
                "Q#" + id + " from " + agent.trim() + ": " + question.trim()));
        audit.log(AuditLogger.AuditEvent.of("question.ask", agent.trim(), "ok", taskId, null, null, Map.of("question_id", id)));
        return id;
    }

    public List<PendingQuestion> pendingQuestions() {
        expireQuestions(clock.millis());
        return store.listPendingQuestions(QUESTION_LIST_LIMIT);
    }

    public Optional<PendingQuestion> answer(Long questionId, String answer) {
        if (answer == null || answer.isBlank()) {
            throw new IllegalArgumentException("answer text is required");
        }
        long now = clock.millis();
        expireQuestions(now);
        Optional<PendingQuestion> answered = store.answerQuestion(questionId, answer.trim(), now);
        answered.ifPresent(q -> audit.log(AuditLogger.AuditEvent.of("question.answer", "operator", "ok", q.taskId(), null,
                null, Map.of("question_id", q.id()))));
        return answered;
    }

    private void expireQuestions(long nowMs) {
        int expired = store.expireQuestions(nowMs - settings.questionExpiryMinutes() * 60_000L);
        if (expired > 0) {
            LOG.info("expired {} pending questions", expired);
        }
    }

    private static TaskStatus requireUnblockTarget(TaskStatus target) {
        TaskStatus status = target == null ? TaskStatus.TODO : target;
        if (status != TaskStatus.TODO && status != TaskStatus.READY_FOR_TESTING) {
            throw new IllegalArgumentException("unblock target must be TODO or READY_FOR_TESTING, got " + status);
        }
        return status;
    }
}
