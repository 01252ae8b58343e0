package io.foreman.worker;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the completion markers a worker echoes in its output:
 * <pre>
 * TASK_COMPLETE:&lt;id&gt;
 * TASK_BLOCKED:&lt;id&gt;:&lt;reason&gt;
 * GIT_PUSHED:&lt;id&gt;:&lt;ref&gt;:&lt;short_id&gt;
 * </pre>
 * Only markers naming the given task count. A completion marker wins over a block marker.
 */
public final class WorkerOutputParser {
    private static final String NO_REASON = "no reason given";

    private WorkerOutputParser() {
    }

    public static WorkerOutcome parse(String output, long taskId) {
        if (output == null || output.isBlank()) {
            return WorkerOutcome.noMarker();
        }
        String id = Long.toString(taskId);
        if (Pattern.compile("TASK_COMPLETE:" + id + "(?![0-9])").matcher(output).find()) {
            Matcher pushed = Pattern.compile("GIT_PUSHED:" + id + ":([^:\\s]+):([^\\s]+)").matcher(output);
            if (pushed.find()) {
                return WorkerOutcome.complete(true, pushed.group(1) + "@" + pushed.group(2));
            }
            return WorkerOutcome.complete(false, null);
        }
        Matcher blocked = Pattern.compile("TASK_BLOCKED:" + id + ":(.*)$", Pattern.MULTILINE).matcher(output);
        if (blocked.find()) {
            String reason = blocked.group(1).strip();
            return WorkerOutcome.blocked(reason.isEmpty() ? NO_REASON : reason);
        }
        return WorkerOutcome.noMarker();
    }
}
