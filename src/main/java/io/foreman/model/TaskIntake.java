package io.foreman.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch of tasks for one project, as read from an intake JSON document.
 */
public record TaskIntake(String project, List<Item> tasks) {
    public record Item(String name, String phase, Integer priority, String plan, String notes) {
    }

    public List<NewTask> toNewTasks() {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("project is required");
        }
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("at least one task is required");
        }
        List<NewTask> out = new ArrayList<>(tasks.size());
        for (Item item : tasks) {
            if (item == null) {
                throw new IllegalArgumentException("task entry must not be null");
            }
            int priority = item.priority() == null ? NewTask.DEFAULT_PRIORITY : item.priority();
            out.add(new NewTask(item.name(), project.trim(), item.phase(), priority, item.plan(), item.notes()));
        }
        return out;
    }
}
