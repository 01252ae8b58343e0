package io.foreman.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.foreman.util.Hashing;
import io.foreman.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Every row carries the hash of the previous row so edits or deletions
 * show up in {@link #verify()}.
 */
public final class AuditLogger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log directory: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("role", event.role());
        row.put("pass_id", event.passId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public List<String> tail(int lines) {
        List<String> all = readLines();
        int from = Math.max(0, all.size() - Math.max(1, lines));
        return new ArrayList<>(all.subList(from, all.size()));
    }

    /**
     * Recomputes the chain from the first row.
     */
    public VerifyResult verify() {
        String expectedPrev = "";
        int checked = 0;
        for (String line : readLines()) {
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (JsonProcessingException e) {
                return new VerifyResult(false, checked, "unparseable row " + (checked + 1));
            }
            String prev = node.path("prev_hash").asText("");
            String hash = node.path("hash").asText("");
            if (!prev.equals(expectedPrev)) {
                return new VerifyResult(false, checked, "prev_hash mismatch at row " + (checked + 1));
            }
            Map<String, Object> body = Jsons.mapper().convertValue(node, Jsons.MAP_TYPE);
            body.remove("hash");
            if (!Hashing.sha256Hex(toCompactJson(body)).equals(hash)) {
                return new VerifyResult(false, checked, "hash mismatch at row " + (checked + 1));
            }
            expectedPrev = hash;
            checked++;
        }
        return new VerifyResult(true, checked, "ok");
    }

    private List<String> readLines() {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        String last = lines.get(lines.size() - 1);
        try {
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (JsonProcessingException e) {
            LOG.warn("last audit row in {} is not valid JSON, starting a new chain", auditFile);
            return "";
        }
    }

    private String toCompactJson(Map<String, Object> row) {
        return Jsons.toCompactJson(row);
    }

    public record AuditEvent(
            String action,
            String actor,
            String result,
            Long taskId,
            String role,
            String passId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String result, Long taskId, String role, String passId,
                                    Map<String, Object> details) {
            return new AuditEvent(action, actor, result, taskId, role, passId, details == null ? Map.of() : details);
        }

        public static AuditEvent system(String action, String result, Map<String, Object> details) {
            return of(action, "system", result, null, null, null, details);
        }
    }

    public record VerifyResult(boolean valid, int rows, String message) {
    }
}
