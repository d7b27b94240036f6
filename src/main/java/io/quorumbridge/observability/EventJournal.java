package io.quorumbridge.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quorumbridge.util.Hashing;
import io.quorumbridge.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL journal of ledger events. Each row carries the hash of the previous row and an
 * HMAC over its own hash, so truncation, reordering and edits are all detectable.
 */
public final class EventJournal {
    private final Path journalFile;
    private final String namespace;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public EventJournal(Path journalFile, String namespace, String signingSecret, Clock clock) {
        this.journalFile = journalFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // created concurrently
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize event journal: " + journalFile, e);
        }
        this.previousHash = loadLastHash();
    }

    /**
     * Sink that journals every event under {@code deployment}.
     */
    public EventSink sinkFor(String deployment) {
        return event -> append(deployment, event);
    }

    public synchronized void append(String deployment, LedgerEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("deployment", deployment);
        row.put("event", event.name());
        row.put("event_time", event.timestamp());
        row.put("fields", event.fields());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write event journal", e);
        }
    }

    public synchronized void appendAll(String deployment, List<LedgerEvent> events) {
        for (LedgerEvent event : events) {
            append(deployment, event);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path file() {
        return journalFile;
    }

    public synchronized IntegrityOutcome verifyIntegrity() {
        int totalRows = 0;
        int checkedRows = 0;
        int brokenLine = 0;
        String reason = "";
        String expectedPrev = "";
        try {
            List<String> lines = Files.readAllLines(journalFile, StandardCharsets.UTF_8);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                totalRows++;
                JsonNode parsed;
                try {
                    parsed = Jsons.compact().readTree(line);
                } catch (IOException e) {
                    brokenLine = i + 1;
                    reason = "invalid_json";
                    break;
                }
                if (!parsed.isObject()) {
                    brokenLine = i + 1;
                    reason = "invalid_json";
                    break;
                }
                String hash = parsed.path("hash").asText("");
                String prevHash = parsed.path("prev_hash").asText("");
                if (!prevHash.equals(expectedPrev)) {
                    brokenLine = i + 1;
                    reason = "prev_hash_mismatch";
                    break;
                }
                ObjectNode canonical = (ObjectNode) parsed.deepCopy();
                canonical.remove("hash");
                canonical.remove("signature");
                String expectedHash = Hashing.sha256Hex(Jsons.toCompactJson(canonical));
                if (!expectedHash.equals(hash)) {
                    brokenLine = i + 1;
                    reason = "hash_mismatch";
                    break;
                }
                if (!signingSecret.isBlank()) {
                    String signature = parsed.path("signature").asText("");
                    if (!Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                        brokenLine = i + 1;
                        reason = "signature_mismatch";
                        break;
                    }
                }
                checkedRows++;
                expectedPrev = hash;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify event journal", e);
        }
        return new IntegrityOutcome(brokenLine == 0, totalRows, checkedRows, brokenLine, reason, expectedPrev);
    }

    public static String loadOrCreateSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize journal signing secret: " + keyFile, e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.compact().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read event journal tail: " + journalFile, e);
        }
    }

    public record IntegrityOutcome(
            boolean ok,
            int totalRows,
            int checkedRows,
            int brokenLine,
            String reason,
            String tailHash
    ) {
    }
}
