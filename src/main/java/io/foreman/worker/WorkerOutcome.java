package io.foreman.worker;

/**
 * What a finished worker reported, parsed out of its free-text output.
 */
public record WorkerOutcome(Kind kind, String reason, boolean publishConfirmed, String publishRef) {
    public static final String NO_MARKER_REASON = "no completion marker";

    public enum Kind {
        COMPLETE,
        BLOCKED,
        NO_MARKER
    }

    public static WorkerOutcome complete(boolean publishConfirmed, String publishRef) {
        return new WorkerOutcome(Kind.COMPLETE, null, publishConfirmed, publishRef);
    }

    public static WorkerOutcome blocked(String reason) {
        return new WorkerOutcome(Kind.BLOCKED, reason, false, null);
    }

    public static WorkerOutcome noMarker() {
        return new WorkerOutcome(Kind.NO_MARKER, NO_MARKER_REASON, false, null);
    }

    public boolean hasMarker() {
        return kind != Kind.NO_MARKER;
    }
}
