package io.foreman.model;

import java.util.Locale;

public enum WorkerRole {
    BUILD("coder"),
    VALIDATE("tester");

    private final String agentId;

    WorkerRole(String agentId) {
        this.agentId = agentId;
    }

    /**
     * Agent identifier handed to the execution-agent collaborator.
     */
    public String agentId() {
        return agentId;
    }

    public static WorkerRole fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Worker role must not be blank");
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (WorkerRole value : values()) {
            if (value.name().equalsIgnoreCase(key) || value.agentId.equals(key)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown worker role: " + raw);
    }
}
