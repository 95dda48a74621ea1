package work.typedcss.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import work.typedcss.resolve.IgnoredSpecifiers;

/**
 * Immutable configuration of one batch run over a set of style sheets.
 */
public record TypegenConfiguration(
    Path workingDirectory,
    List<Path> inputFiles,
    Map<String, String> aliases,
    List<Path> loadPaths,
    Map<String, TransformerCommand> transformers,
    Duration transformTimeout,
    List<String> ignoredPrefixes,
    LogLevel logLevel,
    boolean prettyOutput
) {
    public static final Duration DEFAULT_TRANSFORM_TIMEOUT = Duration.ofSeconds(30);

    public TypegenConfiguration {
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(inputFiles, "inputFiles");
        Objects.requireNonNull(aliases, "aliases");
        Objects.requireNonNull(loadPaths, "loadPaths");
        Objects.requireNonNull(transformers, "transformers");
        Objects.requireNonNull(transformTimeout, "transformTimeout");
        Objects.requireNonNull(ignoredPrefixes, "ignoredPrefixes");
        Objects.requireNonNull(logLevel, "logLevel");
        inputFiles = List.copyOf(inputFiles);
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        loadPaths = List.copyOf(loadPaths);
        transformers = Collections.unmodifiableMap(new LinkedHashMap<>(transformers));
        ignoredPrefixes = List.copyOf(ignoredPrefixes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path workingDirectory = Path.of("").toAbsolutePath();
        private final List<Path> inputFiles = new ArrayList<>();
        private final Map<String, String> aliases = new LinkedHashMap<>();
        private final List<Path> loadPaths = new ArrayList<>();
        private final Map<String, TransformerCommand> transformers = new LinkedHashMap<>();
        private Duration transformTimeout = DEFAULT_TRANSFORM_TIMEOUT;
        private List<String> ignoredPrefixes = IgnoredSpecifiers.DEFAULT_PREFIXES;
        private LogLevel logLevel = LogLevel.WARN;
        private boolean prettyOutput = true;

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder inputFiles(List<Path> inputFiles) {
            this.inputFiles.addAll(inputFiles);
            return this;
        }

        public Builder inputFile(Path inputFile) {
            this.inputFiles.add(inputFile);
            return this;
        }

        public Builder alias(String alias, String target) {
            this.aliases.put(alias, target);
            return this;
        }

        public Builder aliases(Map<String, String> aliases) {
            this.aliases.putAll(aliases);
            return this;
        }

        public Builder loadPath(Path loadPath) {
            this.loadPaths.add(loadPath);
            return this;
        }

        public Builder loadPaths(List<Path> loadPaths) {
            this.loadPaths.addAll(loadPaths);
            return this;
        }

        /** Extensions are matched case-insensitively, with or without the leading dot. */
        public Builder transformer(String extension, TransformerCommand command) {
            String key = extension.startsWith(".") ? extension.substring(1) : extension;
            this.transformers.put(key.toLowerCase(Locale.ROOT), command);
            return this;
        }

        public Builder transformTimeout(Duration transformTimeout) {
            this.transformTimeout = transformTimeout;
            return this;
        }

        public Builder ignoredPrefixes(List<String> ignoredPrefixes) {
            this.ignoredPrefixes = ignoredPrefixes;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder prettyOutput(boolean prettyOutput) {
            this.prettyOutput = prettyOutput;
            return this;
        }

        public TypegenConfiguration build() {
            return new TypegenConfiguration(
                workingDirectory,
                inputFiles,
                aliases,
                loadPaths,
                transformers,
                transformTimeout,
                ignoredPrefixes,
                logLevel,
                prettyOutput
            );
        }
    }
}
