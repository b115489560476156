package io.agentrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentrelay.security.SensitiveDataMasker;
import io.agentrelay.util.Hashing;
import io.agentrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash-chained JSON-lines audit file. Each row carries the previous row's hash,
 * and an HMAC signature when a signing secret is configured.
 */
public final class JsonlAuditSink implements AuditSink {
    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private String previousHash;

    public JsonlAuditSink(Path auditFile, String namespace, String signingSecret) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.toAbsolutePath().getParent());
            Files.writeString(auditFile, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    @Override
    public synchronized void record(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.ofEpochMilli(event.timestampMs()).toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("kind", event.kind());
        row.put("targets", event.targets());
        row.put("outcomes", event.outcomes());
        row.put("validation", event.validation());
        row.put("violations", event.violations());
        row.put("conversation_id", event.conversationId());
        row.put("details", SensitiveDataMasker.masked(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
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

    public Path auditFile() {
        return auditFile;
    }

    public synchronized List<String> tail(int lines) {
        List<String> rows = readRows();
        int from = Math.max(0, rows.size() - Math.max(1, lines));
        return new ArrayList<>(rows.subList(from, rows.size()));
    }

    /**
     * Re-walks the chain from the first row and stops at the first mismatch.
     */
    public synchronized IntegrityReport verify() {
        String expectedPrev = "";
        int checked = 0;
        for (String line : readRows()) {
            checked++;
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return IntegrityReport.broken(checked, "unparseable row");
            }
            if (!(node instanceof ObjectNode row)) {
                return IntegrityReport.broken(checked, "row is not an object");
            }
            String storedHash = row.path("hash").asText("");
            String storedSignature = row.path("signature").asText("");
            if (!expectedPrev.equals(row.path("prev_hash").asText(""))) {
                return IntegrityReport.broken(checked, "prev_hash mismatch");
            }
            ObjectNode unsigned = row.deepCopy();
            unsigned.remove("hash");
            unsigned.remove("signature");
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(unsigned));
            if (!recomputed.equals(storedHash)) {
                return IntegrityReport.broken(checked, "hash mismatch");
            }
            if (!signingSecret.isBlank() && !Hashing.hmacSha256Hex(signingSecret, storedHash).equals(storedSignature)) {
                return IntegrityReport.broken(checked, "signature mismatch");
            }
            expectedPrev = storedHash;
        }
        return new IntegrityReport(true, checked, -1, "ok");
    }

    private String loadLastHash() {
        List<String> rows = readRows();
        if (rows.isEmpty()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(rows.get(rows.size() - 1)).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Audit log tail is corrupt: " + auditFile, e);
        }
    }

    private List<String> readRows() {
        List<String> rows = new ArrayList<>();
        try {
            if (!Files.exists(auditFile)) {
                return rows;
            }
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    rows.add(line);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        return rows;
    }

    public record IntegrityReport(boolean ok, int checkedRows, int brokenAtRow, String message) {
        static IntegrityReport broken(int row, String message) {
            return new IntegrityReport(false, row, row, message);
        }
    }
}
