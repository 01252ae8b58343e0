package io.foreman.model;

import java.util.Objects;

/**
 * Gating group of tasks: the (project, phase) pair. Either part may be absent.
 */
public record PhaseKey(String project, String phase) {
    public PhaseKey {
        project = blankToNull(project);
        phase = blankToNull(phase);
    }

    public String label() {
        String p = project == null ? "<no project>" : project;
        String ph = phase == null ? "<no phase>" : phase;
        return p + "/" + ph;
    }

    public boolean matches(String otherProject, String otherPhase) {
        return Objects.equals(project, blankToNull(otherProject)) && Objects.equals(phase, blankToNull(otherPhase));
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
