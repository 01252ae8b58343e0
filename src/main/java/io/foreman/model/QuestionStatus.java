package io.foreman.model;

import java.util.Locale;

public enum QuestionStatus {
    PENDING,
    ANSWERED,
    EXPIRED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static QuestionStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
