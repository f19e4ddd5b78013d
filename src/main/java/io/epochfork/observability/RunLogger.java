package io.epochfork.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.epochfork.util.Hashing;
import io.epochfork.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL log of run activity. Each row stores the hash of the previous row, so
 * truncation or in-place edits are visible to {@link #verify()}.
 */
public final class RunLogger {
    private final Path logFile;
    private final String runId;
    private String previousHash;

    public RunLogger(Path logFile, String runId) {
        this.logFile = logFile;
        this.runId = runId == null || runId.isBlank() ? "" : runId.trim();
        try {
            Files.createDirectories(logFile.getParent());
            if (!Files.exists(logFile)) {
                try {
                    Files.createFile(logFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize run log file: " + logFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(RunEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("run_id", runId);
        row.put("action", event.action());
        row.put("scenario_id", event.scenarioId());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public VerifyOutcome verify() {
        return verify(logFile);
    }

    public static VerifyOutcome verify(Path file) {
        if (!Files.exists(file)) {
            return new VerifyOutcome(true, 0, 0, "");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read run log: " + file, e);
        }
        int checkedRows = 0;
        String expectedPrev = "";
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new VerifyOutcome(false, checkedRows, i + 1, "invalid_json");
            }
            if (!parsed.isObject()) {
                return new VerifyOutcome(false, checkedRows, i + 1, "invalid_json");
            }
            String hash = parsed.path("hash").asText("");
            String prevHash = parsed.path("prev_hash").asText("");
            if (!prevHash.equals(expectedPrev)) {
                return new VerifyOutcome(false, checkedRows, i + 1, "prev_hash_mismatch");
            }
            ObjectNode canonical = ((ObjectNode) parsed).deepCopy();
            canonical.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                return new VerifyOutcome(false, checkedRows, i + 1, "hash_mismatch");
            }
            checkedRows++;
            expectedPrev = hash;
        }
        return new VerifyOutcome(true, checkedRows, 0, "");
    }

    private String loadLastHash() {
        String last = "";
        try {
            for (String line : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new UncheckedIOException("Run log is unreadable: " + logFile, e);
        }
    }

    public record RunEvent(
            String action,
            String scenarioId,
            String result,
            Map<String, Object> details
    ) {
        public static RunEvent of(String action, String scenarioId, String result, Map<String, Object> details) {
            return new RunEvent(action, scenarioId, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(
            boolean ok,
            int checkedRows,
            int brokenLine,
            String reason
    ) {
    }
}
