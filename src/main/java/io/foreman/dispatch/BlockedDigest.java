package io.foreman.dispatch;

import io.foreman.config.DispatcherSettings;
import io.foreman.model.NotificationKind;
import io.foreman.model.TaskRecord;
import io.foreman.model.TaskStatus;
import io.foreman.notify.NotificationEvent;
import io.foreman.storage.TaskStore;

import java.util.List;
import java.util.Optional;

/**
 * Periodic reminder listing blocked tasks. The time of the last digest lives in the store so separate
 * invocations share it.
 */
public final class BlockedDigest {
    public static final String STATE_KEY = "blocked_digest_last_ms";
    static final int MAX_LISTED = 10;

    private final TaskStore store;
    private final DispatcherSettings settings;

    public BlockedDigest(TaskStore store, DispatcherSettings settings) {
        this.store = store;
        this.settings = settings;
    }

    public Optional<NotificationEvent> due(long nowMs, boolean force) {
        int blocked = store.countByStatus().getOrDefault(TaskStatus.BLOCKED, 0);
        if (blocked <= 0) {
            return Optional.empty();
        }
        if (!force) {
            long last = store.state(STATE_KEY)
                    .map(v -> parseLong(v.value()))
                    .orElse(0L);
            if (nowMs - last < settings.blockedDigestIntervalMs()) {
                return Optional.empty();
            }
        }
        List<TaskRecord> listed = store.listTasks(TaskStatus.BLOCKED, MAX_LISTED);
        StringBuilder sb = new StringBuilder();
        sb.append("Blocked tasks: ").append(blocked).append("\n\n");
        for (TaskRecord t : listed) {
            sb.append('#').append(t.id()).append(' ').append(t.name()).append('\n');
            sb.append(t.blockedReason() == null ? "" : t.blockedReason()).append("\n\n");
        }
        return Optional.of(NotificationEvent.of(NotificationKind.BLOCKED_SUMMARY, 0L, "Blocked tasks", sb.toString().strip()));
    }

    public void markSent(long nowMs) {
        store.putState(STATE_KEY, Long.toString(nowMs), nowMs);
    }

    private static long parseLong(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
