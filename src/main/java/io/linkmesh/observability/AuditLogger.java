package io.linkmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.linkmesh.security.SensitiveDataMasker;
import io.linkmesh.util.Hashing;
import io.linkmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only JSON-lines audit trail of CLI runs. Each row carries the hash of the previous
 * row, and an HMAC of its own hash when a signing secret is configured.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace, String signingSecret, Clock clock) {
        this.auditFile = Objects.requireNonNull(auditFile, "auditFile").toAbsolutePath().normalize();
        this.namespace = namespace == null || namespace.isBlank() ? "linkmesh" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            if (this.auditFile.getParent() != null) {
                Files.createDirectories(this.auditFile.getParent());
            }
            if (!Files.exists(this.auditFile)) {
                try {
                    Files.createFile(this.auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + this.auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
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
            throw new RuntimeException("Failed to write audit log: " + auditFile, e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    private static JsonNode sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        return SensitiveDataMasker.masked(Jsons.mapper().valueToTree(input));
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(
                    action,
                    System.getProperty("user.name", "unknown"),
                    resource,
                    result,
                    details == null ? Map.of() : details
            );
        }
    }
}
