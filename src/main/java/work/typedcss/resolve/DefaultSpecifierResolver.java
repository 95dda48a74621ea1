package work.typedcss.resolve;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.typedcss.model.FileIdentity;

/**
 * Resolver chain used when the host does not supply its own: ignored specifiers, absolute paths and
 * {@code file:} URIs, aliases, paths relative to the requesting file, {@code #subpath} imports,
 * {@code node_modules} packages and finally extra load paths.
 */
public final class DefaultSpecifierResolver implements SpecifierResolver {
    private static final Logger LOG = LoggerFactory.getLogger(DefaultSpecifierResolver.class);

    private final Predicate<String> ignored;
    private final List<ResolverStrategy> strategies;

    private DefaultSpecifierResolver(Builder builder) {
        this.ignored = builder.ignored;
        var packages = new PackageResolver();
        var chain = new ArrayList<ResolverStrategy>();
        chain.add(DefaultSpecifierResolver::resolveAbsolute);
        chain.add(aliasStrategy(builder.workingDirectory, builder.aliases));
        chain.add(DefaultSpecifierResolver::resolveRelative);
        chain.add(packages::resolveSubpathImport);
        chain.add(packages::resolvePackage);
        chain.add(loadPathStrategy(builder.workingDirectory, builder.loadPaths));
        this.strategies = List.copyOf(chain);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public FileIdentity resolve(String specifier, ResolveContext context) {
        Objects.requireNonNull(specifier, "specifier");
        Objects.requireNonNull(context, "context");
        if (ignored.test(specifier)) {
            LOG.debug("Ignoring specifier '{}' from {}", specifier, context.requestingFile());
            return FileIdentity.IGNORED;
        }
        Path requestingFile = context.requestingFile().toPath().orElse(null);
        for (ResolverStrategy strategy : strategies) {
            Optional<Path> hit;
            try {
                hit = strategy.resolve(specifier, requestingFile);
            } catch (IllegalArgumentException ex) {
                throw new NotResolvableException(specifier, context.requestingFile());
            }
            if (hit.isPresent()) {
                var resolved = FileIdentity.of(hit.get());
                LOG.trace("Resolved '{}' from {} to {}", specifier, context.requestingFile(), resolved);
                return resolved;
            }
        }
        throw new NotResolvableException(specifier, context.requestingFile());
    }

    private static Optional<Path> resolveAbsolute(String specifier, Path requestingFile) {
        if (specifier.startsWith("file:")) {
            return Candidates.firstExisting(Paths.get(URI.create(specifier)), requestingFile);
        }
        Path path = Paths.get(specifier);
        return path.isAbsolute() ? Candidates.firstExisting(path, requestingFile) : Optional.empty();
    }

    private static Optional<Path> resolveRelative(String specifier, Path requestingFile) {
        if (requestingFile == null || requestingFile.getParent() == null || specifier.startsWith("#")) {
            return Optional.empty();
        }
        return Candidates.firstExisting(requestingFile.getParent().resolve(specifier), requestingFile);
    }

    private static ResolverStrategy aliasStrategy(Path workingDirectory, Map<String, String> aliases) {
        var ordered = new ArrayList<Map.Entry<String, Path>>();
        aliases.forEach((alias, target) -> ordered.add(Map.entry(alias, workingDirectory.resolve(target).normalize())));
        ordered.sort(Comparator.comparingInt((Map.Entry<String, Path> entry) -> entry.getKey().length()).reversed());
        return (specifier, requestingFile) -> {
            for (var entry : ordered) {
                String alias = entry.getKey();
                if (specifier.equals(alias)) {
                    return Candidates.firstExisting(entry.getValue(), requestingFile);
                }
                if (specifier.startsWith(alias + "/")) {
                    String rest = specifier.substring(alias.length() + 1);
                    return Candidates.firstExisting(entry.getValue().resolve(rest), requestingFile);
                }
            }
            return Optional.empty();
        };
    }

    private static ResolverStrategy loadPathStrategy(Path workingDirectory, List<Path> loadPaths) {
        var roots = loadPaths.stream().map(path -> workingDirectory.resolve(path).normalize()).toList();
        return (specifier, requestingFile) -> {
            for (Path root : roots) {
                var hit = Candidates.firstExisting(root.resolve(specifier), requestingFile);
                if (hit.isPresent()) {
                    return hit;
                }
            }
            return Optional.empty();
        };
    }

    public static final class Builder {
        private Path workingDirectory = Paths.get("").toAbsolutePath().normalize();
        private final Map<String, String> aliases = new LinkedHashMap<>();
        private final List<Path> loadPaths = new ArrayList<>();
        private Predicate<String> ignored = IgnoredSpecifiers.defaults();

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
            return this;
        }

        /** Alias targets are relative to the working directory unless absolute. */
        public Builder aliases(Map<String, String> aliases) {
            this.aliases.putAll(aliases);
            return this;
        }

        public Builder alias(String alias, String target) {
            this.aliases.put(alias, target);
            return this;
        }

        public Builder loadPaths(List<Path> loadPaths) {
            this.loadPaths.addAll(loadPaths);
            return this;
        }

        public Builder ignored(Predicate<String> ignored) {
            this.ignored = Objects.requireNonNull(ignored, "ignored");
            return this;
        }

        public DefaultSpecifierResolver build() {
            return new DefaultSpecifierResolver(this);
        }
    }
}
