package io.foreman.dispatch;

import io.foreman.model.TaskStatus;
import io.foreman.storage.TaskStore;
import io.foreman.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status summary for external monitoring: counts per state, in the store and in {@code HEARTBEAT.md}.
 */
public final class HeartbeatWriter {
    public static final String STATE_KEY = "heartbeat";
    private static final Logger LOG = LoggerFactory.getLogger(HeartbeatWriter.class);

    private final TaskStore store;
    private final Path file;

    public HeartbeatWriter(TaskStore store, Path file) {
        this.store = store;
        this.file = file;
    }

    public Map<String, Object> write(long nowMs, String passId) {
        Map<TaskStatus, Integer> counts = store.countByStatus();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("updated_at", Instant.ofEpochMilli(nowMs).toString());
        summary.put("pass_id", passId);
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        counts.forEach((k, v) -> byStatus.put(k.name(), v));
        summary.put("counts", byStatus);
        store.putState(STATE_KEY, Jsons.toCompactJson(summary), nowMs);

        StringBuilder md = new StringBuilder();
        md.append("# Foreman heartbeat\n\n");
        md.append("Updated: ").append(summary.get("updated_at")).append("\n");
        md.append("Pass: ").append(passId).append("\n\n");
        md.append("| status | count |\n|---|---|\n");
        byStatus.forEach((k, v) -> md.append("| ").append(k).append(" | ").append(v).append(" |\n"));
        try {
            Files.writeString(file, md.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("failed to write heartbeat file {}: {}", file, e.getMessage());
        }
        return summary;
    }
}
