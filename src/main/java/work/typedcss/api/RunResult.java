package work.typedcss.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a {@link TypegenRunner} run (usable by the CLI and embedding apps).
 */
public record RunResult(Status status, List<FileReport> files, Instant startedAt, Instant finishedAt) {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter PRETTY_WRITER = JSON.writerWithDefaultPrettyPrinter();

    public RunResult {
        files = List.copyOf(files);
    }

    /** Fails the run when at least one file failed. */
    public static RunResult of(List<FileReport> files, Instant startedAt) {
        boolean failed = files.stream().anyMatch(report -> !report.ok());
        return new RunResult(failed ? Status.FAILURE : Status.SUCCESS, files, startedAt, Instant.now());
    }

    public long failedCount() {
        return files.stream().filter(report -> !report.ok()).count();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("files", files.stream().map(FileReport::toSerializableMap).toList());
        serializable.put("failed", failedCount());
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toJson(boolean pretty) {
        try {
            return pretty ? PRETTY_WRITER.writeValueAsString(toSerializableMap()) : JSON.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getOriginalMessage() + "\"}";
        }
    }

    public String toPrettyJson() {
        return toJson(true);
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
