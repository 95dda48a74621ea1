package work.typedcss.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.typedcss.model.FileIdentity;
import work.typedcss.model.LoadResult;
import work.typedcss.model.SourceLocation;
import work.typedcss.model.Token;

/**
 * Outcome for one input file of a batch run: its tokens and dependencies, or the error that stopped it.
 */
public record FileReport(
    FileIdentity file,
    Status status,
    Optional<LoadResult> result,
    Optional<String> errorType,
    Optional<String> error,
    List<String> causes
) {
    public FileReport {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(errorType, "errorType");
        Objects.requireNonNull(error, "error");
        causes = List.copyOf(causes);
    }

    public static FileReport ok(FileIdentity file, LoadResult result) {
        return new FileReport(file, Status.OK, Optional.of(result), Optional.empty(), Optional.empty(), List.of());
    }

    public static FileReport failed(FileIdentity file, Throwable error) {
        var causes = new ArrayList<String>();
        for (Throwable cause = error.getCause(); cause != null && cause != cause.getCause(); cause = cause.getCause()) {
            causes.add(describe(cause));
        }
        return new FileReport(
            file,
            Status.FAILED,
            Optional.empty(),
            Optional.of(error.getClass().getSimpleName()),
            Optional.of(describe(error)),
            causes
        );
    }

    public boolean ok() {
        return status == Status.OK;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("file", file.value());
        serializable.put("status", status.name().toLowerCase());
        result.ifPresent(loaded -> {
            var tokens = new ArrayList<Map<String, Object>>();
            for (Token token : loaded.tokens()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", token.name());
                entry.put("locations", token.originalLocations().stream().map(FileReport::location).toList());
                tokens.add(entry);
            }
            serializable.put("tokens", tokens);
            serializable.put("dependencies", loaded.dependencies().stream().map(FileIdentity::value).toList());
        });
        if (error.isPresent()) {
            Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("type", errorType.orElse("Exception"));
            failure.put("message", error.get());
            if (!causes.isEmpty()) {
                failure.put("causes", causes);
            }
            serializable.put("error", failure);
        }
        return serializable;
    }

    private static Map<String, Object> location(SourceLocation location) {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("file", location.file().value());
        serializable.put("start", Map.of("line", location.start().line(), "column", location.start().column()));
        serializable.put("end", Map.of("line", location.end().line(), "column", location.end().column()));
        return serializable;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    public enum Status {
        OK,
        FAILED
    }
}
