package io.foreman.notify;

/**
 * Delivery sink for operator notifications. Callers treat a failure as non-fatal.
 */
public interface Notifier {
    void notify(NotificationEvent event) throws NotificationException;
}
