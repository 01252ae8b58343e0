package io.foreman.model;

import java.util.Locale;
import java.util.Optional;

public enum TaskStatus {
    TODO,
    IN_PROGRESS,
    READY_FOR_TESTING,
    COMPLETE,
    BLOCKED;

    /**
     * States that keep a phase from being handed to validation.
     */
    public boolean isUnfinishedBuild() {
        return this == TODO || this == IN_PROGRESS || this == BLOCKED;
    }

    public static TaskStatus fromString(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + raw));
    }

    /**
     * Maps legacy spellings ({@code in-progress}, {@code ready for testing}, lower case) to the
     * canonical value. Empty when the text does not name any known status.
     */
    public static Optional<TaskStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String key = raw.trim()
                .toUpperCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
        if ("INPROGRESS".equals(key)) {
            return Optional.of(IN_PROGRESS);
        }
        if ("READY".equals(key) || "READYFORTESTING".equals(key)) {
            return Optional.of(READY_FOR_TESTING);
        }
        if ("COMPLETED".equals(key) || "DONE".equals(key)) {
            return Optional.of(COMPLETE);
        }
        for (TaskStatus value : values()) {
            if (value.name().equals(key)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
