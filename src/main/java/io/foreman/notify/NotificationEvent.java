package io.foreman.notify;

import io.foreman.model.NotificationKind;

/**
 * One operator-facing event. {@code taskId} is 0 for events that are not about a single task.
 */
public record NotificationEvent(NotificationKind kind, long taskId, String taskName, String details) {
    public static NotificationEvent of(NotificationKind kind, long taskId, String taskName, String details) {
        return new NotificationEvent(kind, taskId, taskName == null ? "" : taskName, details == null ? "" : details);
    }
}
