package io.foreman.worker;

import io.foreman.model.TaskRecord;

import java.util.List;

/**
 * Text handed to a worker on stdin: what to do, the accumulated context, and the markers to echo back.
 */
public final class InstructionBuilder {
    private InstructionBuilder() {
    }

    public static String forBuild(TaskRecord task) {
        StringBuilder sb = new StringBuilder();
        sb.append("Task ID: ").append(task.id()).append('\n');
        sb.append("Task Name: ").append(task.name()).append('\n');
        sb.append("Project: ").append(orNone(task.project())).append('\n');
        sb.append("Phase: ").append(orNone(task.phase())).append('\n');
        sb.append("Attempt: ").append(task.attemptCount() + 1).append('\n');
        appendSection(sb, "Plan", task.implementationPlan());
        appendSection(sb, "Notes", task.notes());
        appendSection(sb, "Solution from owner", task.solution());
        sb.append('\n');
        sb.append("Update task notes with:\n");
        sb.append("- Files changed\n");
        sb.append("- Tests run (command + result)\n");
        sb.append('\n');
        sb.append("Return one of these markers in your final response:\n");
        sb.append("- TASK_COMPLETE:").append(task.id()).append('\n');
        sb.append("- TASK_BLOCKED:").append(task.id()).append(":<reason>\n");
        return sb.toString();
    }

    public static String forValidation(TaskRecord primary, List<TaskRecord> phaseTasks) {
        StringBuilder sb = new StringBuilder();
        sb.append("Primary Task ID: ").append(primary.id()).append('\n');
        sb.append("Project: ").append(orNone(primary.project())).append('\n');
        sb.append("Phase: ").append(orNone(primary.phase())).append('\n');
        sb.append("Tasks in phase:\n");
        for (TaskRecord t : phaseTasks) {
            sb.append("- #").append(t.id()).append(' ').append(t.name());
            if (t.implementationPlan() != null && !t.implementationPlan().isBlank()) {
                sb.append(": ").append(t.implementationPlan().strip());
            }
            sb.append('\n');
            if (t.solution() != null && !t.solution().isBlank()) {
                sb.append("  Solution: ").append(t.solution().strip()).append('\n');
            }
        }
        sb.append('\n');
        sb.append("Run E2E + data validation for this phase.\n");
        sb.append("If failures occur, create coder tasks with repro steps and logs.\n");
        sb.append("Publish the validated changes and report the pushed ref.\n");
        sb.append('\n');
        sb.append("Return one of these markers in your final response:\n");
        sb.append("- TASK_COMPLETE:").append(primary.id()).append('\n');
        sb.append("- GIT_PUSHED:").append(primary.id()).append(":<ref>:<short_id>\n");
        sb.append("- TASK_BLOCKED:").append(primary.id()).append(":<reason>\n");
        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, String label, String body) {
        if (body == null || body.isBlank()) {
            return;
        }
        sb.append(label).append(":\n").append(body.strip()).append('\n');
    }

    private static String orNone(String value) {
        return value == null || value.isBlank() ? "<none>" : value;
    }
}
