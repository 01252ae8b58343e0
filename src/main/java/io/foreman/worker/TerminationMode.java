package io.foreman.worker;

public enum TerminationMode {
    GRACEFUL,
    FORCEFUL
}
