package work.typedcss.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.typedcss.api.TransformerCommand;
import work.typedcss.api.TypegenConfiguration;

/**
 * Settings read from a {@code typed-css.toml} project file. Relative paths are kept as written and
 * resolved against the working directory by the resolver.
 */
public record ProjectConfig(
    List<Path> loadPaths,
    Map<String, String> aliases,
    Map<String, TransformerCommand> transformers,
    Optional<Duration> transformTimeout,
    Optional<List<String>> ignoredPrefixes
) {
    public ProjectConfig {
        loadPaths = List.copyOf(loadPaths);
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        transformers = Collections.unmodifiableMap(new LinkedHashMap<>(transformers));
        ignoredPrefixes = ignoredPrefixes.map(List::copyOf);
    }

    public static ProjectConfig empty() {
        return new ProjectConfig(List.of(), Map.of(), Map.of(), Optional.empty(), Optional.empty());
    }

    /**
     * Copies these settings into {@code builder}. Call before applying command line values so those win.
     */
    public TypegenConfiguration.Builder applyTo(TypegenConfiguration.Builder builder) {
        builder.loadPaths(loadPaths);
        builder.aliases(aliases);
        transformers.forEach(builder::transformer);
        transformTimeout.ifPresent(builder::transformTimeout);
        ignoredPrefixes.ifPresent(builder::ignoredPrefixes);
        return builder;
    }
}
