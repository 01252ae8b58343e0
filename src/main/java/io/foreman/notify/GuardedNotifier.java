package io.foreman.notify;

import io.foreman.observability.AuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Wraps the configured sink so a delivery failure is logged and audited but never reaches the caller.
 */
public final class GuardedNotifier {
    private static final Logger LOG = LoggerFactory.getLogger(GuardedNotifier.class);

    private final Notifier delegate;
    private final AuditLogger audit;

    public GuardedNotifier(Notifier delegate, AuditLogger audit) {
        this.delegate = delegate;
        this.audit = audit;
    }

    public boolean send(NotificationEvent event) {
        try {
            delegate.notify(event);
            return true;
        } catch (NotificationException | RuntimeException e) {
            LOG.warn("notification {} for task {} failed: {}", event.kind().wireName(), event.taskId(), e.getMessage());
            audit.log(AuditLogger.AuditEvent.of(
                    "notify.failed",
                    "system",
                    "error",
                    event.taskId() == 0L ? null : event.taskId(),
                    null,
                    null,
                    Map.of("kind", event.kind().wireName(), "error", String.valueOf(e.getMessage()))
            ));
            return false;
        }
    }

    public static Notifier fromCommand(List<String> command) {
        if (command == null || command.isEmpty()) {
            return new LoggingNotifier();
        }
        return new ScriptNotifier(command, 30_000L);
    }
}
