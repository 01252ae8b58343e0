package io.foreman.model;

public record BlockedReasonEntry(long id, long taskId, String reason, long createdAtMs) {
}
