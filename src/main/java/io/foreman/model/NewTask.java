package io.foreman.model;

public record NewTask(String name, String project, String phase, int priority, String implementationPlan, String notes) {
    public static final int DEFAULT_PRIORITY = 3;

    public NewTask {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("task name must not be blank");
        }
    }
}
