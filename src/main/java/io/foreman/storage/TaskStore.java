package io.foreman.storage;

import io.foreman.model.BlockedReasonEntry;
import io.foreman.model.NewTask;
import io.foreman.model.PendingQuestion;
import io.foreman.model.PhaseKey;
import io.foreman.model.QuestionStatus;
import io.foreman.model.TaskHistoryEntry;
import io.foreman.model.TaskRecord;
import io.foreman.model.TaskStatus;
import io.foreman.model.WorkerRole;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class TaskStore {
    public static final String ATTEMPT_LIMIT_REACHED = "attempt limit reached";

    private static final String TASK_COLUMNS = "id,name,project,phase,priority,implementation_plan,notes,solution,status,"
            + "assigned_role,worker_handle,attempt_count,blocked_reason,error_log,created_at_ms,started_at_ms,"
            + "completed_at_ms,updated_at_ms";

    private final Database database;

    public TaskStore(Database database) {
        this.database = database;
    }

    public List<Long> insertTasks(List<NewTask> tasks, long nowMs) {
        if (tasks == null || tasks.isEmpty()) {
            return List.of();
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO tasks(name,project,phase,priority,implementation_plan,notes,status,attempt_count,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,0,?,?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                List<Long> ids = new ArrayList<>();
                for (NewTask t : tasks) {
                    ps.setString(1, t.name().trim());
                    setNullableString(ps, 2, t.project());
                    setNullableString(ps, 3, t.phase());
                    ps.setInt(4, t.priority());
                    setNullableString(ps, 5, t.implementationPlan());
                    setNullableString(ps, 6, t.notes());
                    ps.setString(7, TaskStatus.TODO.name());
                    ps.setLong(8, nowMs);
                    ps.setLong(9, nowMs);
                    ps.executeUpdate();
                    try (ResultSet keys = ps.getGeneratedKeys()) {
                        if (!keys.next()) {
                            throw new SQLException("No generated id for task " + t.name());
                        }
                        ids.add(keys.getLong(1));
                    }
                }
                c.commit();
                return ids;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to insert tasks", e);
        }
    }

    public Optional<TaskRecord> getTask(long taskId) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapTask(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load task: " + taskId, e);
        }
    }

    /**
     * Tasks in dispatch order: priority descending, then id ascending. A {@code null} status lists everything.
     */
    public List<TaskRecord> listTasks(TaskStatus status, int limit) {
        String sql = status == null
                ? "SELECT " + TASK_COLUMNS + " FROM tasks ORDER BY priority DESC, id ASC LIMIT ?"
                : "SELECT " + TASK_COLUMNS + " FROM tasks WHERE status=? ORDER BY priority DESC, id ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            return readTasks(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list tasks", e);
        }
    }

    public List<TaskRecord> listByStatus(TaskStatus status) {
        return listTasks(status, Integer.MAX_VALUE);
    }

    public List<TaskRecord> listPhaseTasks(PhaseKey key, TaskStatus status) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE project IS ? AND phase IS ? AND status=? ORDER BY priority DESC, id ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            setNullableString(ps, 1, key.project());
            setNullableString(ps, 2, key.phase());
            ps.setString(3, status.name());
            return readTasks(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list phase tasks: " + key.label(), e);
        }
    }

    /**
     * Per (project, phase) counts used by the phase gate, ordered by the best priority and oldest id in the group.
     */
    public List<PhaseSummary> phaseSummaries() {
        String sql = """
                SELECT project, phase,
                       SUM(CASE WHEN status IN ('TODO','IN_PROGRESS','BLOCKED') THEN 1 ELSE 0 END) AS unfinished,
                       SUM(CASE WHEN status='READY_FOR_TESTING' THEN 1 ELSE 0 END) AS ready,
                       MAX(priority) AS top_priority,
                       MIN(id) AS first_id
                FROM tasks
                WHERE status <> 'COMPLETE'
                GROUP BY project, phase
                ORDER BY top_priority DESC, first_id ASC
                """;
        List<PhaseSummary> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new PhaseSummary(
                        new PhaseKey(rs.getString("project"), rs.getString("phase")),
                        rs.getInt("unfinished"),
                        rs.getInt("ready")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to summarize phases", e);
        }
    }

    /**
     * Rewrites free-text statuses to canonical names. Text that names no known status is escalated to BLOCKED
     * so an operator sees it instead of the row silently never being dispatched.
     */
    public int normalizeStatuses(long nowMs) {
        String select = "SELECT id,status FROM tasks WHERE status NOT IN ('TODO','IN_PROGRESS','READY_FOR_TESTING','COMPLETE','BLOCKED')";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(select);
                 PreparedStatement known = c.prepareStatement(
                         "UPDATE tasks SET status=?,updated_at_ms=? WHERE id=? AND status=?");
                 PreparedStatement unknown = c.prepareStatement(
                         "UPDATE tasks SET status=?,blocked_reason=?,worker_handle=NULL,updated_at_ms=? WHERE id=? AND status=?")) {
                int changed = 0;
                Map<Long, String> rows = new LinkedHashMap<>();
                try (ResultSet rs = sel.executeQuery()) {
                    while (rs.next()) {
                        rows.put(rs.getLong("id"), rs.getString("status"));
                    }
                }
                for (Map.Entry<Long, String> row : rows.entrySet()) {
                    Optional<TaskStatus> parsed = TaskStatus.parse(row.getValue());
                    if (parsed.isPresent()) {
                        known.setString(1, parsed.get().name());
                        known.setLong(2, nowMs);
                        known.setLong(3, row.getKey());
                        known.setString(4, row.getValue());
                        changed += known.executeUpdate();
                    } else {
                        unknown.setString(1, TaskStatus.BLOCKED.name());
                        unknown.setString(2, "unrecognized status '" + row.getValue() + "'");
                        unknown.setLong(3, nowMs);
                        unknown.setLong(4, row.getKey());
                        unknown.setString(5, row.getValue());
                        changed += unknown.executeUpdate();
                    }
                }
                c.commit();
                return changed;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to normalize task statuses", e);
        }
    }

    /**
     * Moves a TODO task to IN_PROGRESS with its worker handle, role and incremented attempt count in one update.
     * Returns false if the task is no longer TODO.
     */
    public boolean markDispatched(long taskId, WorkerRole role, String workerHandle, long nowMs) {
        String sql = "UPDATE tasks SET status=?,assigned_role=?,worker_handle=?,attempt_count=attempt_count+1,"
                + "started_at_ms=?,blocked_reason=NULL,updated_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.IN_PROGRESS.name());
            ps.setString(2, role.name());
            ps.setString(3, workerHandle);
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            ps.setLong(6, taskId);
            ps.setString(7, TaskStatus.TODO.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark task dispatched: " + taskId, e);
        }
    }

    /**
     * Moves every READY_FOR_TESTING task of a phase to IN_PROGRESS under the validator role, sharing one handle.
     * Only the primary task's attempt count is incremented. All or nothing.
     */
    public boolean markPhaseDispatched(List<Long> taskIds, long primaryId, String workerHandle, long nowMs) {
        String sql = "UPDATE tasks SET status=?,assigned_role=?,worker_handle=?,attempt_count=attempt_count+?,"
                + "started_at_ms=?,blocked_reason=NULL,updated_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (long id : taskIds) {
                    ps.setString(1, TaskStatus.IN_PROGRESS.name());
                    ps.setString(2, WorkerRole.VALIDATE.name());
                    ps.setString(3, workerHandle);
                    ps.setInt(4, id == primaryId ? 1 : 0);
                    ps.setLong(5, nowMs);
                    ps.setLong(6, nowMs);
                    ps.setLong(7, id);
                    ps.setString(8, TaskStatus.READY_FOR_TESTING.name());
                    if (ps.executeUpdate() != 1) {
                        c.rollback();
                        return false;
                    }
                }
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to mark phase dispatched, primary=" + primaryId, e);
        }
    }

    /**
     * Applies a worker outcome to every task it covers. Each row must still be IN_PROGRESS under the expected
     * handle; if any is not, nothing changes and false is returned.
     */
    public boolean applyTransition(Transition t, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                for (long id : t.taskIds()) {
                    boolean primary = id == t.primaryId();
                    AttemptChange change = primary ? t.attemptChange() : AttemptChange.KEEP;
                    if (!updateFinishedRow(c, id, t.expectedHandle(), t.target(), t.blockedReason(), t.errorLog(), change, -1, nowMs)) {
                        c.rollback();
                        return false;
                    }
                }
                if (t.recordReason() && t.errorLog() != null) {
                    insertBlockedReason(c, t.primaryId(), t.errorLog(), nowMs);
                }
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to apply transition, primary=" + t.primaryId(), e);
        }
    }

    /**
     * Recovers tasks whose worker stopped without reporting or ran past the staleness threshold. The primary's
     * attempt count is incremented; the tasks go back to {@code retryStatus} while budget remains, otherwise to
     * BLOCKED. One blocked-reason row is recorded for the incident, plus one for the escalation when the budget
     * runs out, so a task blocked at cap N carries N rows.
     */
    public StaleResolution recoverStale(List<Long> taskIds, long primaryId, String expectedHandle, String incident,
                                        TaskStatus retryStatus, int maxAttempts, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                int current;
                try (PreparedStatement ps = c.prepareStatement(
                        "SELECT attempt_count FROM tasks WHERE id=? AND status=? AND worker_handle IS ?")) {
                    ps.setLong(1, primaryId);
                    ps.setString(2, TaskStatus.IN_PROGRESS.name());
                    setNullableString(ps, 3, expectedHandle);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            c.rollback();
                            return StaleResolution.conflict();
                        }
                        current = rs.getInt(1);
                    }
                }
                int next = current + 1;
                boolean exhausted = next >= maxAttempts;
                TaskStatus target = exhausted ? TaskStatus.BLOCKED : retryStatus;
                String reason = exhausted ? ATTEMPT_LIMIT_REACHED : null;
                for (long id : taskIds) {
                    int attempt = id == primaryId ? next : -1;
                    if (!updateFinishedRow(c, id, expectedHandle, target, reason, incident, AttemptChange.KEEP, attempt, nowMs)) {
                        c.rollback();
                        return StaleResolution.conflict();
                    }
                }
                insertBlockedReason(c, primaryId, incident, nowMs);
                if (exhausted) {
                    insertBlockedReason(c, primaryId, ATTEMPT_LIMIT_REACHED, nowMs);
                }
                c.commit();
                return exhausted ? StaleResolution.escalated(next) : StaleResolution.reset(next);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to recover stale task: " + primaryId, e);
        }
    }

    /**
     * Blocks tasks in {@code expected} status without launching anything, used when the attempt budget is already
     * spent. The escalation is recorded as a blocked-reason row on {@code primaryId}.
     */
    public boolean blockExhausted(List<Long> taskIds, long primaryId, TaskStatus expected, long nowMs) {
        String sql = "UPDATE tasks SET status=?,blocked_reason=?,worker_handle=NULL,updated_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (long id : taskIds) {
                    ps.setString(1, TaskStatus.BLOCKED.name());
                    ps.setString(2, ATTEMPT_LIMIT_REACHED);
                    ps.setLong(3, nowMs);
                    ps.setLong(4, id);
                    ps.setString(5, expected.name());
                    if (ps.executeUpdate() != 1) {
                        c.rollback();
                        return false;
                    }
                }
                insertBlockedReason(c, primaryId, ATTEMPT_LIMIT_REACHED, nowMs);
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to block exhausted tasks", e);
        }
    }

    /**
     * Operator unblock: BLOCKED only, so a task attached to a live worker is never touched.
     */
    public boolean unblock(long taskId, TaskStatus target, String solution, boolean resetAttempts, long nowMs) {
        String sql = "UPDATE tasks SET status=?,blocked_reason=NULL,error_log=NULL,assigned_role=NULL,worker_handle=NULL,"
                + "started_at_ms=NULL,attempt_count=CASE WHEN ? THEN 0 ELSE attempt_count END,"
                + "solution=" + appendSql("solution") + ",updated_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bindUnblock(ps, target, solution, resetAttempts, nowMs);
            ps.setLong(7, taskId);
            ps.setString(8, TaskStatus.BLOCKED.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to unblock task: " + taskId, e);
        }
    }

    public List<Long> unblockAll(TaskStatus target, String note, boolean resetAttempts, long nowMs) {
        String select = "SELECT id FROM tasks WHERE status=? ORDER BY priority DESC, id ASC";
        String update = "UPDATE tasks SET status=?,blocked_reason=NULL,error_log=NULL,assigned_role=NULL,worker_handle=NULL,"
                + "started_at_ms=NULL,attempt_count=CASE WHEN ? THEN 0 ELSE attempt_count END,"
                + "solution=" + appendSql("solution") + ",updated_at_ms=? WHERE id=? AND status=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(select);
                 PreparedStatement upd = c.prepareStatement(update)) {
                List<Long> candidates = new ArrayList<>();
                sel.setString(1, TaskStatus.BLOCKED.name());
                try (ResultSet rs = sel.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getLong(1));
                    }
                }
                List<Long> updated = new ArrayList<>();
                for (long id : candidates) {
                    bindUnblock(upd, target, note, resetAttempts, nowMs);
                    upd.setLong(7, id);
                    upd.setString(8, TaskStatus.BLOCKED.name());
                    if (upd.executeUpdate() == 1) {
                        updated.add(id);
                    }
                }
                c.commit();
                return updated;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to unblock all tasks", e);
        }
    }

    public List<TaskHistoryEntry> listHistory(long taskId, int limit) {
        String sql = "SELECT id,task_id,project,status,notes,error_log,changed_at_ms FROM task_history WHERE task_id=? ORDER BY id ASC LIMIT ?";
        List<TaskHistoryEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, taskId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TaskHistoryEntry(
                            rs.getLong("id"),
                            rs.getLong("task_id"),
                            rs.getString("project"),
                            rs.getString("status"),
                            rs.getString("notes"),
                            rs.getString("error_log"),
                            rs.getLong("changed_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list task history: " + taskId, e);
        }
    }

    public List<BlockedReasonEntry> listBlockedReasons(long taskId) {
        return queryBlockedReasons(taskId, Integer.MAX_VALUE, false);
    }

    /**
     * The newest {@code limit} blocked reasons for a task, returned oldest first.
     */
    public List<BlockedReasonEntry> recentBlockedReasons(long taskId, int limit) {
        List<BlockedReasonEntry> newestFirst = queryBlockedReasons(taskId, limit, true);
        List<BlockedReasonEntry> out = new ArrayList<>(newestFirst);
        Collections.reverse(out);
        return out;
    }

    public Map<TaskStatus, Integer> countByStatus() {
        Map<TaskStatus, Integer> out = new LinkedHashMap<>();
        for (TaskStatus s : TaskStatus.values()) {
            out.put(s, 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) AS n FROM tasks GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Optional<TaskStatus> status = TaskStatus.parse(rs.getString("status"));
                if (status.isPresent()) {
                    out.merge(status.get(), rs.getInt("n"), Integer::sum);
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to count tasks by status", e);
        }
    }

    public Map<WorkerRole, Integer> countInProgressByRole() {
        Map<WorkerRole, Integer> out = new LinkedHashMap<>();
        for (WorkerRole r : WorkerRole.values()) {
            out.put(r, 0);
        }
        String sql = "SELECT assigned_role, COUNT(*) AS n FROM tasks WHERE status='IN_PROGRESS' AND assigned_role IS NOT NULL GROUP BY assigned_role";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.merge(WorkerRole.fromString(rs.getString("assigned_role")), rs.getInt("n"), Integer::sum);
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to count tasks by role", e);
        }
    }

    /**
     * Deletes COMPLETE tasks finished before {@code cutoffMs} together with their history and blocked reasons.
     * Questions that referenced them keep their text but lose the link.
     */
    public List<Long> purgeCompletedBefore(long cutoffMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(
                    "SELECT id FROM tasks WHERE status=? AND COALESCE(completed_at_ms, updated_at_ms) < ? ORDER BY id");
                 PreparedStatement history = c.prepareStatement("DELETE FROM task_history WHERE task_id=?");
                 PreparedStatement reasons = c.prepareStatement("DELETE FROM blocked_reasons WHERE task_id=?");
                 PreparedStatement questions = c.prepareStatement("UPDATE pending_questions SET task_id=NULL WHERE task_id=?");
                 PreparedStatement task = c.prepareStatement("DELETE FROM tasks WHERE id=? AND status=?")) {
                sel.setString(1, TaskStatus.COMPLETE.name());
                sel.setLong(2, cutoffMs);
                List<Long> ids = new ArrayList<>();
                try (ResultSet rs = sel.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getLong(1));
                    }
                }
                List<Long> deleted = new ArrayList<>();
                for (long id : ids) {
                    history.setLong(1, id);
                    history.executeUpdate();
                    reasons.setLong(1, id);
                    reasons.executeUpdate();
                    questions.setLong(1, id);
                    questions.executeUpdate();
                    task.setLong(1, id);
                    task.setString(2, TaskStatus.COMPLETE.name());
                    if (task.executeUpdate() == 1) {
                        deleted.add(id);
                    }
                }
                c.commit();
                return deleted;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to purge completed tasks", e);
        }
    }

    public long insertQuestion(String agent, Long taskId, String question, long nowMs) {
        String sql = "INSERT INTO pending_questions(agent,task_id,question,status,created_at_ms) VALUES(?,?,?,?,?)";
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, agent);
            if (taskId == null) {
                ps.setNull(2, Types.INTEGER);
            } else {
                ps.setLong(2, taskId);
            }
            ps.setString(3, question);
            ps.setString(4, QuestionStatus.PENDING.dbValue());
            ps.setLong(5, nowMs);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated id for question");
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to insert pending question", e);
        }
    }

    public int expireQuestions(long createdBeforeMs) {
        String sql = "UPDATE pending_questions SET status=? WHERE status=? AND created_at_ms < ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, QuestionStatus.EXPIRED.dbValue());
            ps.setString(2, QuestionStatus.PENDING.dbValue());
            ps.setLong(3, createdBeforeMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to expire pending questions", e);
        }
    }

    public List<PendingQuestion> listPendingQuestions(int limit) {
        String sql = "SELECT id,agent,task_id,question,answer,status,created_at_ms,answered_at_ms FROM pending_questions "
                + "WHERE status=? ORDER BY created_at_ms ASC, id ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, QuestionStatus.PENDING.dbValue());
            ps.setInt(2, Math.max(1, limit));
            List<PendingQuestion> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapQuestion(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list pending questions", e);
        }
    }

    public Optional<PendingQuestion> getQuestion(long questionId) {
        String sql = "SELECT id,agent,task_id,question,answer,status,created_at_ms,answered_at_ms FROM pending_questions WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, questionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapQuestion(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load question: " + questionId, e);
        }
    }

    /**
     * Answers the given pending question, or the oldest one when {@code questionId} is null. When the question
     * references a task the answer is appended to that task's solution in the same transaction.
     */
    public Optional<PendingQuestion> answerQuestion(Long questionId, String answer, long nowMs) {
        String pick = questionId == null
                ? "SELECT id,task_id,question FROM pending_questions WHERE status=? ORDER BY created_at_ms ASC, id ASC LIMIT 1"
                : "SELECT id,task_id,question FROM pending_questions WHERE status=? AND id=?";
        long answeredId;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(pick);
                 PreparedStatement upd = c.prepareStatement(
                         "UPDATE pending_questions SET status=?,answer=?,answered_at_ms=? WHERE id=? AND status=?");
                 PreparedStatement task = c.prepareStatement(
                         "UPDATE tasks SET solution=COALESCE(solution,'') || ?,updated_at_ms=? WHERE id=?")) {
                sel.setString(1, QuestionStatus.PENDING.dbValue());
                if (questionId != null) {
                    sel.setLong(2, questionId);
                }
                long id;
                Long taskId;
                String question;
                try (ResultSet rs = sel.executeQuery()) {
                    if (!rs.next()) {
                        c.rollback();
                        return Optional.empty();
                    }
                    id = rs.getLong("id");
                    long rawTask = rs.getLong("task_id");
                    taskId = rs.wasNull() ? null : rawTask;
                    question = rs.getString("question");
                }
                upd.setString(1, QuestionStatus.ANSWERED.dbValue());
                upd.setString(2, answer);
                upd.setLong(3, nowMs);
                upd.setLong(4, id);
                upd.setString(5, QuestionStatus.PENDING.dbValue());
                if (upd.executeUpdate() != 1) {
                    c.rollback();
                    return Optional.empty();
                }
                if (taskId != null) {
                    task.setString(1, "\n\n--- Owner Answer (Q#" + id + ") ---\nQ: " + question + "\nA: " + answer);
                    task.setLong(2, nowMs);
                    task.setLong(3, taskId);
                    task.executeUpdate();
                }
                c.commit();
                answeredId = id;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to answer question", e);
        }
        return getQuestion(answeredId);
    }

    public Optional<StateValue> state(String key) {
        String sql = "SELECT state_key,state_value,version,updated_at_ms FROM orchestrator_state WHERE state_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StateValue(
                        rs.getString("state_key"),
                        rs.getString("state_value"),
                        rs.getLong("version"),
                        rs.getLong("updated_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read orchestrator state: " + key, e);
        }
    }

    public void putState(String key, String value, long nowMs) {
        String sql = """
                INSERT INTO orchestrator_state(state_key,state_value,version,updated_at_ms) VALUES(?,?,1,?)
                ON CONFLICT(state_key) DO UPDATE SET state_value=excluded.state_value,
                    version=orchestrator_state.version+1, updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to write orchestrator state: " + key, e);
        }
    }

    /**
     * Takes the named lease for {@code owner} unless another owner holds it and it has not expired.
     * The lease value is {@code owner|expiresAtMs}.
     */
    public boolean tryAcquireLease(String key, String owner, long nowMs, long ttlMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(
                    "SELECT state_value,version FROM orchestrator_state WHERE state_key=?");
                 PreparedStatement ins = c.prepareStatement(
                         "INSERT OR IGNORE INTO orchestrator_state(state_key,state_value,version,updated_at_ms) VALUES(?,?,1,?)");
                 PreparedStatement upd = c.prepareStatement(
                         "UPDATE orchestrator_state SET state_value=?,version=?,updated_at_ms=? WHERE state_key=? AND version=?")) {
                String value = owner + "|" + (nowMs + ttlMs);
                sel.setString(1, key);
                String current = null;
                long version = 0L;
                try (ResultSet rs = sel.executeQuery()) {
                    if (rs.next()) {
                        current = rs.getString("state_value");
                        version = rs.getLong("version");
                    }
                }
                boolean acquired;
                if (current == null) {
                    ins.setString(1, key);
                    ins.setString(2, value);
                    ins.setLong(3, nowMs);
                    acquired = ins.executeUpdate() == 1;
                } else {
                    LeaseValue lease = LeaseValue.parse(current);
                    if (!lease.isFree(owner, nowMs)) {
                        c.rollback();
                        return false;
                    }
                    upd.setString(1, value);
                    upd.setLong(2, version + 1);
                    upd.setLong(3, nowMs);
                    upd.setString(4, key);
                    upd.setLong(5, version);
                    acquired = upd.executeUpdate() == 1;
                }
                if (!acquired) {
                    c.rollback();
                    return false;
                }
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to acquire lease: " + key, e);
        }
    }

    public boolean releaseLease(String key, String owner) {
        String prefix = owner + "|";
        String sql = "DELETE FROM orchestrator_state WHERE state_key=? AND substr(state_value,1,?)=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setInt(2, prefix.length());
            ps.setString(3, prefix);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to release lease: " + key, e);
        }
    }

    private boolean updateFinishedRow(Connection c, long id, String expectedHandle, TaskStatus target, String blockedReason,
                                      String errorLog, AttemptChange change, int explicitAttempt, long nowMs) throws SQLException {
        String attemptSql;
        if (explicitAttempt >= 0) {
            attemptSql = "attempt_count=" + explicitAttempt;
        } else if (change == AttemptChange.RESET) {
            attemptSql = "attempt_count=0";
        } else {
            attemptSql = "attempt_count=attempt_count";
        }
        String sql = "UPDATE tasks SET status=?,worker_handle=NULL," + attemptSql + ",blocked_reason=?,"
                + "error_log=COALESCE(?,error_log),completed_at_ms=CASE WHEN ?='COMPLETE' THEN ? ELSE completed_at_ms END,"
                + "updated_at_ms=? WHERE id=? AND status=? AND worker_handle IS ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, target.name());
            setNullableString(ps, 2, target == TaskStatus.BLOCKED ? blockedReason : null);
            setNullableString(ps, 3, errorLog);
            ps.setString(4, target.name());
            ps.setLong(5, nowMs);
            ps.setLong(6, nowMs);
            ps.setLong(7, id);
            ps.setString(8, TaskStatus.IN_PROGRESS.name());
            setNullableString(ps, 9, expectedHandle);
            return ps.executeUpdate() == 1;
        }
    }

    private void insertBlockedReason(Connection c, long taskId, String reason, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO blocked_reasons(task_id,reason,created_at_ms) VALUES(?,?,?)")) {
            ps.setLong(1, taskId);
            ps.setString(2, reason);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        }
    }

    private List<BlockedReasonEntry> queryBlockedReasons(long taskId, int limit, boolean newestFirst) {
        String sql = "SELECT id,task_id,reason,created_at_ms FROM blocked_reasons WHERE task_id=? ORDER BY id "
                + (newestFirst ? "DESC" : "ASC") + " LIMIT ?";
        List<BlockedReasonEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, taskId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new BlockedReasonEntry(
                            rs.getLong("id"),
                            rs.getLong("task_id"),
                            rs.getString("reason"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list blocked reasons: " + taskId, e);
        }
    }

    private static String appendSql(String column) {
        return "CASE WHEN ?='' THEN " + column + " WHEN " + column + " IS NULL OR " + column + "='' THEN ? ELSE "
                + column + " || char(10) || char(10) || ? END";
    }

    private static void bindUnblock(PreparedStatement ps, TaskStatus target, String text, boolean resetAttempts, long nowMs)
            throws SQLException {
        String safe = text == null ? "" : text.trim();
        ps.setString(1, target.name());
        ps.setBoolean(2, resetAttempts);
        ps.setString(3, safe);
        ps.setString(4, safe);
        ps.setString(5, safe);
        ps.setLong(6, nowMs);
    }

    private List<TaskRecord> readTasks(PreparedStatement ps) throws SQLException {
        List<TaskRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapTask(rs));
            }
        }
        return out;
    }

    private static TaskRecord mapTask(ResultSet rs) throws SQLException {
        String rawRole = rs.getString("assigned_role");
        String rawStatus = rs.getString("status");
        return new TaskRecord(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("project"),
                rs.getString("phase"),
                rs.getInt("priority"),
                rs.getString("implementation_plan"),
                rs.getString("notes"),
                rs.getString("solution"),
                TaskStatus.parse(rawStatus).orElse(TaskStatus.BLOCKED),
                rawRole == null || rawRole.isBlank() ? null : WorkerRole.fromString(rawRole),
                rs.getString("worker_handle"),
                rs.getInt("attempt_count"),
                rs.getString("blocked_reason"),
                rs.getString("error_log"),
                rs.getLong("created_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "completed_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static PendingQuestion mapQuestion(ResultSet rs) throws SQLException {
        return new PendingQuestion(
                rs.getLong("id"),
                rs.getString("agent"),
                nullableLong(rs, "task_id"),
                rs.getString("question"),
                rs.getString("answer"),
                QuestionStatus.fromString(rs.getString("status")),
                rs.getLong("created_at_ms"),
                nullableLong(rs, "answered_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    private static void setNullableString(PreparedStatement ps, int idx, String value) throws SQLException {
        if (value == null || value.isBlank()) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, value);
        }
    }

    public enum AttemptChange {
        KEEP,
        RESET
    }

    /**
     * Outcome applied to one task, or to every task of a phase. The attempt change and blocked-reason row apply
     * to the primary task only.
     */
    public record Transition(
            List<Long> taskIds,
            long primaryId,
            String expectedHandle,
            TaskStatus target,
            String blockedReason,
            String errorLog,
            boolean recordReason,
            AttemptChange attemptChange
    ) {
        public Transition {
            taskIds = List.copyOf(taskIds);
        }

        public static Transition buildComplete(long taskId, String handle) {
            return new Transition(List.of(taskId), taskId, handle, TaskStatus.READY_FOR_TESTING, null, null, false, AttemptChange.RESET);
        }

        public static Transition buildBlocked(long taskId, String handle, String reason) {
            return new Transition(List.of(taskId), taskId, handle, TaskStatus.BLOCKED, reason, reason, true, AttemptChange.KEEP);
        }

        public static Transition phaseComplete(List<Long> taskIds, long primaryId, String handle) {
            return new Transition(taskIds, primaryId, handle, TaskStatus.COMPLETE, null, null, false, AttemptChange.KEEP);
        }

        public static Transition phaseUnpublished(List<Long> taskIds, long primaryId, String handle, String warning) {
            return new Transition(taskIds, primaryId, handle, TaskStatus.READY_FOR_TESTING, null, warning, false, AttemptChange.KEEP);
        }

        public static Transition phaseBlocked(List<Long> taskIds, long primaryId, String handle, String reason) {
            return new Transition(taskIds, primaryId, handle, TaskStatus.BLOCKED, reason, reason, true, AttemptChange.KEEP);
        }
    }

    public enum StaleOutcome {
        RESET,
        ESCALATED,
        CONFLICT
    }

    public record StaleResolution(StaleOutcome outcome, int attemptCount) {
        public static StaleResolution reset(int attemptCount) { return new StaleResolution(StaleOutcome.RESET, attemptCount); }
        public static StaleResolution escalated(int attemptCount) { return new StaleResolution(StaleOutcome.ESCALATED, attemptCount); }
        public static StaleResolution conflict() { return new StaleResolution(StaleOutcome.CONFLICT, 0); }
    }

    public record PhaseSummary(PhaseKey key, int unfinishedBuild, int readyForTesting) {}

    public record StateValue(String key, String value, long version, long updatedAtMs) {}

    record LeaseValue(String owner, long expiresAtMs) {
        static LeaseValue parse(String raw) {
            int sep = raw == null ? -1 : raw.lastIndexOf('|');
            if (sep < 0) {
                return new LeaseValue(raw == null ? "" : raw, 0L);
            }
            try {
                return new LeaseValue(raw.substring(0, sep), Long.parseLong(raw.substring(sep + 1)));
            } catch (NumberFormatException e) {
                return new LeaseValue(raw.substring(0, sep), 0L);
            }
        }

        boolean isFree(String candidate, long nowMs) {
            return owner.equals(candidate) || expiresAtMs <= nowMs;
        }
    }
}
