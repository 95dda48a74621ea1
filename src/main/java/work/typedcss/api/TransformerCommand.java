package work.typedcss.api;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * External compiler configured for one file extension, with an optional timeout overriding the run default.
 */
public record TransformerCommand(List<String> command, Optional<Duration> timeout) {
    public TransformerCommand {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Transformer command must not be empty.");
        }
        command = List.copyOf(command);
    }

    /** Splits a command line on whitespace; quoting is not supported. */
    public static TransformerCommand parse(String commandLine) {
        Objects.requireNonNull(commandLine, "commandLine");
        var parts = Arrays.stream(commandLine.trim().split("\\s+")).filter(part -> !part.isEmpty()).toList();
        return new TransformerCommand(parts, Optional.empty());
    }
}
