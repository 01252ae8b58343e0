package io.foreman.model;

public record PendingQuestion(
        long id,
        String agent,
        Long taskId,
        String question,
        String answer,
        QuestionStatus status,
        long createdAtMs,
        Long answeredAtMs
) {
}
