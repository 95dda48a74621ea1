package work.typedcss.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.typedcss.api.TransformerCommand;
import work.typedcss.shared.DurationParser;

/**
 * Reads {@code typed-css.toml}:
 * <pre>
 * loadPaths = ["src/styles"]
 * [alias]
 * "@" = "src"
 * [transformers.scss]
 * command = ["sass", "--stdin"]
 * timeout = "30s"
 * [ignore]
 * prefixes = ["http://", "https://"]
 * </pre>
 */
public final class ProjectConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ProjectConfigLoader.class);
    public static final String DEFAULT_FILE_NAME = "typed-css.toml";

    private ProjectConfigLoader() {}

    /**
     * Loads {@code typed-css.toml} from {@code workingDirectory} when it exists.
     */
    public static Optional<ProjectConfig> findDefault(Path workingDirectory) throws IOException {
        var candidate = workingDirectory.resolve(DEFAULT_FILE_NAME);
        if (!Files.isRegularFile(candidate)) {
            LOG.debug("No {} in {}", DEFAULT_FILE_NAME, workingDirectory);
            return Optional.empty();
        }
        return Optional.of(load(candidate));
    }

    public static ProjectConfig load(Path file) throws IOException {
        LOG.debug("Reading project configuration {}", file);
        return parse(Files.readString(file), file.toString());
    }

    /**
     * @throws IllegalArgumentException when the document is not valid TOML or a value has the wrong type
     */
    public static ProjectConfig parse(String raw, String origin) {
        TomlParseResult toml = Toml.parse(raw);
        if (toml.hasErrors()) {
            String errors = toml.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration " + origin + ": " + errors);
        }
        var loadPaths = new ArrayList<Path>();
        for (String entry : strings(toml.get(List.of("loadPaths")), origin, "loadPaths")) {
            loadPaths.add(Path.of(entry));
        }
        var aliases = new LinkedHashMap<String, String>();
        var aliasTable = table(toml.get(List.of("alias")), origin, "alias");
        if (aliasTable != null) {
            for (String key : aliasTable.keySet()) {
                Object value = aliasTable.get(List.of(key));
                if (!(value instanceof String target)) {
                    throw new IllegalArgumentException("Invalid configuration " + origin + ": alias '" + key + "' must be a string");
                }
                aliases.put(key, target);
            }
        }
        var transformers = new LinkedHashMap<String, TransformerCommand>();
        var transformerTable = table(toml.get(List.of("transformers")), origin, "transformers");
        if (transformerTable != null) {
            for (String extension : transformerTable.keySet()) {
                var section = table(transformerTable.get(List.of(extension)), origin, "transformers." + extension);
                transformers.put(extension, transformer(section, origin, extension));
            }
        }
        Optional<Duration> timeout = duration(toml.get(List.of("transformTimeout")), origin, "transformTimeout");
        Optional<List<String>> ignored = Optional.empty();
        var ignoreTable = table(toml.get(List.of("ignore")), origin, "ignore");
        if (ignoreTable != null && ignoreTable.get(List.of("prefixes")) != null) {
            ignored = Optional.of(strings(ignoreTable.get(List.of("prefixes")), origin, "ignore.prefixes"));
        }
        return new ProjectConfig(loadPaths, aliases, transformers, timeout, ignored);
    }

    private static TransformerCommand transformer(TomlTable section, String origin, String extension) {
        String key = "transformers." + extension;
        if (section == null) {
            throw new IllegalArgumentException("Invalid configuration " + origin + ": " + key + " must be a table");
        }
        Object command = section.get(List.of("command"));
        var timeout = duration(section.get(List.of("timeout")), origin, key + ".timeout");
        if (command instanceof String line) {
            return new TransformerCommand(TransformerCommand.parse(line).command(), timeout);
        }
        var parts = strings(command, origin, key + ".command");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Invalid configuration " + origin + ": " + key + ".command is required");
        }
        return new TransformerCommand(parts, timeout);
    }

    private static List<String> strings(Object value, String origin, String key) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof TomlArray array)) {
            throw new IllegalArgumentException("Invalid configuration " + origin + ": " + key + " must be an array of strings");
        }
        var result = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            if (!(array.get(i) instanceof String item)) {
                throw new IllegalArgumentException("Invalid configuration " + origin + ": " + key + " must be an array of strings");
            }
            result.add(item);
        }
        return result;
    }

    private static TomlTable table(Object value, String origin, String key) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof TomlTable table)) {
            throw new IllegalArgumentException("Invalid configuration " + origin + ": " + key + " must be a table");
        }
        return table;
    }

    private static Optional<Duration> duration(Object value, String origin, String key) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Long millis) {
            return Optional.of(Duration.ofMillis(millis));
        }
        if (value instanceof String text) {
            return DurationParser.parse(text);
        }
        throw new IllegalArgumentException("Invalid configuration " + origin + ": " + key + " must be a duration such as \"30s\"");
    }
}
