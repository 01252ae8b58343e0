package io.foreman.model;

public enum NotificationKind {
    STARTED("started"),
    READY("ready"),
    COMPLETE("complete"),
    BLOCKER("blocker"),
    BLOCKED_SUMMARY("blocked-summary"),
    RESET("reset"),
    AGENT_QUESTION("agent-question");

    private final String wireName;

    NotificationKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
