package io.foreman.model;

public record TaskHistoryEntry(long id, long taskId, String project, String status, String notes, String errorLog, long changedAtMs) {
}
