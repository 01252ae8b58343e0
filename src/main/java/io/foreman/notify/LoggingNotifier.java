package io.foreman.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingNotifier implements Notifier {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(NotificationEvent event) {
        LOG.info("notify kind={} task={} name={} details={}",
                event.kind().wireName(), event.taskId(), event.taskName(), event.details());
    }
}
