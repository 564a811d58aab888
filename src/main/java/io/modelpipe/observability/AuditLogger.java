package io.modelpipe.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelpipe.util.Hashing;
import io.modelpipe.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail. Each row carries the hash of the previous row so truncation or edits
 * break the chain.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this(auditFile, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("project_id", event.projectId());
        row.put("job_id", event.jobId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
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

    /**
     * Recomputes the hash chain over the whole file.
     */
    public synchronized ChainVerification verify() {
        List<String> lines = readLines();
        String expectedPrev = "";
        int rows = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            rows++;
            ObjectNode row;
            try {
                JsonNode parsed = Jsons.mapper().readTree(line);
                if (!parsed.isObject()) {
                    return new ChainVerification(false, rows, i + 1, "row is not an object");
                }
                row = (ObjectNode) parsed;
            } catch (JsonProcessingException e) {
                return new ChainVerification(false, rows, i + 1, "row is not valid JSON");
            }
            String recordedHash = row.path("hash").asText("");
            if (!expectedPrev.equals(row.path("prev_hash").asText(""))) {
                return new ChainVerification(false, rows, i + 1, "prev_hash mismatch");
            }
            row.remove("hash");
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(recordedHash)) {
                return new ChainVerification(false, rows, i + 1, "hash mismatch");
            }
            expectedPrev = recordedHash;
        }
        return new ChainVerification(true, rows, 0, "");
    }

    private String loadLastHash() {
        String last = "";
        for (String line : readLines()) {
            if (line != null && !line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (JsonProcessingException e) {
            // A torn final row starts a new chain segment.
            return "";
        }
    }

    private List<String> readLines() {
        try {
            if (!Files.exists(auditFile)) {
                return List.of();
            }
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String projectId,
            String jobId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String projectId,
                String jobId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, projectId, jobId, details == null ? Map.of() : details);
        }
    }

    public record ChainVerification(boolean valid, int rows, int brokenLine, String reason) {
    }
}
