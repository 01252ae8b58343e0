package io.foreman.dispatch;

import java.util.ArrayList;
import java.util.List;

/**
 * What one pass did. {@code skipped} means another orchestrator held the pass lock; {@code abortReason} is set
 * when the pass stopped early on a launch failure.
 */
public record DispatchReport(
        String passId,
        boolean skipped,
        String abortReason,
        int normalized,
        List<Long> outcomesApplied,
        List<Long> staleRecovered,
        List<Long> escalated,
        List<Long> buildLaunched,
        List<Long> validationLaunched,
        List<Long> purged,
        boolean digestSent,
        int notificationsSent,
        int notificationsFailed
) {
    public static DispatchReport skipped(String passId) {
        return new DispatchReport(passId, true, null, 0, List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), false, 0, 0);
    }

    public boolean aborted() {
        return abortReason != null;
    }

    /**
     * Number of task state changes this pass caused.
     */
    public int transitions() {
        return normalized + outcomesApplied.size() + staleRecovered.size() + escalated.size()
                + buildLaunched.size() + validationLaunched.size();
    }

    static final class Builder {
        private final String passId;
        private String abortReason;
        private int normalized;
        private final List<Long> outcomesApplied = new ArrayList<>();
        private final List<Long> staleRecovered = new ArrayList<>();
        private final List<Long> escalated = new ArrayList<>();
        private final List<Long> buildLaunched = new ArrayList<>();
        private final List<Long> validationLaunched = new ArrayList<>();
        private final List<Long> purged = new ArrayList<>();
        private boolean digestSent;
        private int notificationsSent;
        private int notificationsFailed;

        Builder(String passId) {
            this.passId = passId;
        }

        void abort(String reason) {
            this.abortReason = reason;
        }

        void normalized(int count) {
            this.normalized = count;
        }

        void outcomeApplied(long taskId) {
            outcomesApplied.add(taskId);
        }

        void staleRecovered(long taskId) {
            staleRecovered.add(taskId);
        }

        void escalated(long taskId) {
            escalated.add(taskId);
        }

        void buildLaunched(long taskId) {
            buildLaunched.add(taskId);
        }

        void validationLaunched(long primaryId) {
            validationLaunched.add(primaryId);
        }

        void purged(List<Long> taskIds) {
            purged.addAll(taskIds);
        }

        void digestSent() {
            this.digestSent = true;
        }

        void notification(boolean delivered) {
            if (delivered) {
                notificationsSent++;
            } else {
                notificationsFailed++;
            }
        }

        DispatchReport build() {
            return new DispatchReport(passId, false, abortReason, normalized, List.copyOf(outcomesApplied),
                    List.copyOf(staleRecovered), List.copyOf(escalated), List.copyOf(buildLaunched),
                    List.copyOf(validationLaunched), List.copyOf(purged), digestSent, notificationsSent,
                    notificationsFailed);
        }
    }
}
