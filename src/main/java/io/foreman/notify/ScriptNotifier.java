package io.foreman.notify;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Hands each event to an external command as {@code <command...> <kind> <task_id> <task_name> <details>}.
 */
public final class ScriptNotifier implements Notifier {
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> command;
    private final long timeoutMs;

    public ScriptNotifier(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("notify command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public void notify(NotificationEvent event) throws NotificationException {
        List<String> argv = new ArrayList<>(command);
        argv.add(event.kind().wireName());
        argv.add(Long.toString(event.taskId()));
        argv.add(event.taskName());
        argv.add(event.details());
        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new NotificationException("notify spawn failed: " + command.get(0), e);
        }
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new NotificationException("notify command timed out after " + timeoutMs + "ms");
            }
            if (process.exitValue() != 0) {
                String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
                throw new NotificationException("notify exit=" + process.exitValue() + " output=" + truncate(output));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new NotificationException("interrupted while notifying", e);
        } catch (IOException e) {
            throw new NotificationException("failed to read notify output", e);
        }
    }

    private String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
