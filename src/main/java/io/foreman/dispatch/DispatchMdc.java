package io.foreman.dispatch;

import io.foreman.model.WorkerRole;
import org.slf4j.MDC;

/**
 * MDC keys set while a pass acts on a task, so every log line carries the pass and task it belongs to.
 */
public final class DispatchMdc {
    public static final String PASS_ID = "passId";
    public static final String TASK_ID = "taskId";
    public static final String ROLE = "role";

    private DispatchMdc() {}

    public static void setPass(String passId) {
        MDC.put(PASS_ID, passId);
    }

    public static void setTask(long taskId, WorkerRole role) {
        MDC.put(TASK_ID, Long.toString(taskId));
        if (role != null) {
            MDC.put(ROLE, role.name());
        } else {
            MDC.remove(ROLE);
        }
    }

    public static void clearTask() {
        MDC.remove(TASK_ID);
        MDC.remove(ROLE);
    }

    public static void clear() {
        MDC.remove(PASS_ID);
        clearTask();
    }
}
