package work.typedcss.loader;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.typedcss.error.CyclicCompositionException;
import work.typedcss.error.FileReadException;
import work.typedcss.error.NotFoundException;
import work.typedcss.error.PermissionDeniedException;
import work.typedcss.error.TransformException;
import work.typedcss.error.UnresolvedComposesTargetException;
import work.typedcss.error.UnresolvedImportTargetException;
import work.typedcss.extract.ExtractionResult;
import work.typedcss.extract.TokenExtractor;
import work.typedcss.model.ComposesReference;
import work.typedcss.model.FileIdentity;
import work.typedcss.model.ImportReference;
import work.typedcss.model.LoadResult;
import work.typedcss.model.Position;
import work.typedcss.model.SourceLocation;
import work.typedcss.model.Token;
import work.typedcss.resolve.IgnoredSpecifiers;
import work.typedcss.resolve.NotResolvableException;
import work.typedcss.resolve.ResolveContext;
import work.typedcss.resolve.SpecifierResolver;
import work.typedcss.transform.SourceMap;
import work.typedcss.transform.SourceTransformer;
import work.typedcss.transform.TransformContext;
import work.typedcss.transform.TransformResult;
import work.typedcss.transform.TransformerRegistry;

/**
 * Loads a style sheet together with everything it imports or composes from, sharing one {@link LoadCache}
 * across all recursive loads of a run.
 * <p>
 * Each file is read, transformed and extracted at most once per cache lifetime. The files a style sheet
 * references are loaded concurrently, but their results are merged in declaration order, so the output
 * never depends on I/O timing. Cycles fail with {@link CyclicCompositionException}.
 */
public final class DependencyGraphLoader {
    private static final Logger LOG = LoggerFactory.getLogger(DependencyGraphLoader.class);

    private final LoadCache cache;
    private final ContentReader reader;
    private final SourceTransformer transformer;
    private final SpecifierResolver resolver;
    private final Predicate<String> ignoredSpecifier;
    private final TokenExtractor extractor;
    private final Executor executor;

    private DependencyGraphLoader(Builder builder) {
        this.cache = builder.cache;
        this.reader = builder.reader;
        this.transformer = builder.transformer;
        this.resolver = Objects.requireNonNull(builder.resolver, "resolver");
        this.ignoredSpecifier = builder.ignoredSpecifier;
        this.extractor = builder.extractor;
        this.executor = builder.executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public LoadCache cache() {
        return cache;
    }

    /**
     * Blocking variant of {@link #loadAsync}; rethrows the typed {@link work.typedcss.error.LoadException}.
     */
    public LoadResult load(FileIdentity file) {
        try {
            return loadAsync(file).join();
        } catch (CompletionException ex) {
            throw unwrap(ex);
        }
    }

    /**
     * Loads {@code file} as a new top-level request. Cancelling the returned future does not affect
     * other callers sharing the same attempt.
     */
    public CompletableFuture<LoadResult> loadAsync(FileIdentity file) {
        Objects.requireNonNull(file, "file");
        return load(file, List.of(), null).copy();
    }

    private CompletableFuture<LoadResult> load(FileIdentity file, List<FileIdentity> chain, FileIdentity waiter) {
        if (file.isIgnored()) {
            return CompletableFuture.completedFuture(LoadResult.empty());
        }
        if (chain.contains(file)) {
            return CompletableFuture.failedFuture(new CyclicCompositionException(file, chain));
        }
        LoadCache.Claim claim;
        try {
            claim = cache.claim(file, waiter);
        } catch (CyclicCompositionException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        if (!claim.owner()) {
            return claim.future();
        }

        LOG.debug("Loading {}", file);
        var nextChain = new ArrayList<FileIdentity>(chain.size() + 1);
        nextChain.addAll(chain);
        nextChain.add(file);
        var chainSnapshot = List.copyOf(nextChain);

        CompletableFuture
            .supplyAsync(() -> parse(file), executor)
            .thenCompose(parsed -> loadReferences(file, parsed, chainSnapshot))
            .whenComplete((result, error) -> {
                if (error == null) {
                    LOG.debug("Loaded {} ({} tokens, {} dependencies)", file, result.tokens().size(), result.dependencies().size());
                    cache.complete(file, result);
                } else {
                    var cause = unwrap(error);
                    LOG.debug("Failed to load {}: {}", file, cause.getMessage());
                    cache.completeExceptionally(file, cause);
                }
            });
        return claim.future();
    }

    private record Parsed(
        ExtractionResult extraction,
        List<FileIdentity> preBundled,
        List<FileIdentity> importTargets,
        List<FileIdentity> composesTargets
    ) {}

    /**
     * Read, transform, extract and resolve: everything that happens before the referenced files are loaded.
     */
    private Parsed parse(FileIdentity file) {
        String source = read(file);
        TransformResult transformed = transform(file, source);
        ExtractionResult extraction = extractor.extract(file, transformed.css());
        if (transformed.sourceMap().isPresent()) {
            extraction = applySourceMap(file, extraction, transformed.sourceMap().get());
        }

        var importTargets = new ArrayList<FileIdentity>();
        for (ImportReference ref : extraction.importReferences()) {
            try {
                importTargets.add(resolver.resolve(ref.specifier(), new ResolveContext(file)));
            } catch (NotResolvableException ex) {
                throw new UnresolvedImportTargetException(ref.specifier(), file, ex);
            }
        }
        var composesTargets = new ArrayList<FileIdentity>();
        for (ComposesReference ref : extraction.composesReferences()) {
            if (ref.isLocal()) {
                composesTargets.add(null);
                continue;
            }
            String specifier = ref.specifier().get();
            try {
                composesTargets.add(resolver.resolve(specifier, new ResolveContext(file)));
            } catch (NotResolvableException ex) {
                throw new UnresolvedComposesTargetException(specifier, file, ex);
            }
        }
        return new Parsed(extraction, transformed.preBundledDependencies(), importTargets, composesTargets);
    }

    private String read(FileIdentity file) {
        try {
            return reader.read(file);
        } catch (NoSuchFileException | FileNotFoundException ex) {
            throw new NotFoundException(file, ex);
        } catch (AccessDeniedException ex) {
            throw new PermissionDeniedException(file, ex);
        } catch (IOException ex) {
            throw new FileReadException(file, ex);
        }
    }

    private TransformResult transform(FileIdentity file, String source) {
        try {
            return transformer.transform(source, new TransformContext(file, resolver, ignoredSpecifier));
        } catch (TransformException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new TransformException(file, ex.getMessage(), null, ex);
        }
    }

    private CompletableFuture<LoadResult> loadReferences(FileIdentity file, Parsed parsed, List<FileIdentity> chain) {
        var targets = new LinkedHashSet<FileIdentity>(parsed.importTargets());
        for (FileIdentity target : parsed.composesTargets()) {
            if (target != null) {
                targets.add(target);
            }
        }
        var pending = new LinkedHashMap<FileIdentity, CompletableFuture<LoadResult>>();
        for (FileIdentity target : targets) {
            pending.put(target, load(target, chain, file));
        }
        return CompletableFuture
            .allOf(pending.values().toArray(new CompletableFuture<?>[0]))
            .handle((ignored, error) -> {
                // report the first failure in declaration order, whichever finished first
                var loaded = new LinkedHashMap<FileIdentity, LoadResult>();
                for (var entry : pending.entrySet()) {
                    try {
                        loaded.put(entry.getKey(), entry.getValue().join());
                    } catch (CompletionException ex) {
                        throw unwrap(ex);
                    }
                }
                return merge(file, parsed, loaded);
            });
    }

    private LoadResult merge(FileIdentity file, Parsed parsed, Map<FileIdentity, LoadResult> loaded) {
        var exported = new LinkedHashMap<String, Token>();
        for (Token token : parsed.extraction().localTokens()) {
            exported.put(token.name(), token);
        }
        var localNames = new LinkedHashSet<>(exported.keySet());

        for (FileIdentity target : parsed.importTargets()) {
            for (Token imported : resultOf(target, loaded).tokens()) {
                exported.merge(imported.name(), imported, (existing, incoming) -> localNames.contains(existing.name())
                    ? existing.prepend(incoming.originalLocations())
                    : existing.append(incoming.originalLocations()));
            }
        }

        Map<String, List<CompositionEdge>> edges = new HashMap<>();
        var references = parsed.extraction().composesReferences();
        for (int i = 0; i < references.size(); i++) {
            var ref = references.get(i);
            var referenced = new ArrayList<CompositionEdge>();
            if (ref.isLocal()) {
                for (String name : ref.tokenNames()) {
                    if (localNames.contains(name)) {
                        referenced.add(CompositionEdge.local(name));
                    } else {
                        LOG.warn("{}: composed class '{}' is not declared in this file, skipping", file, name);
                    }
                }
            } else {
                var target = parsed.composesTargets().get(i);
                var result = resultOf(target, loaded);
                for (String name : ref.tokenNames()) {
                    var found = result.token(name);
                    if (found.isEmpty()) {
                        if (!target.isIgnored()) {
                            LOG.warn("{}: composed class '{}' is not exported by {}, skipping", file, name, target);
                        }
                        continue;
                    }
                    var token = found.get();
                    var edge = CompositionEdge.external(token.originalLocations());
                    referenced.add(edge);
                    if (localNames.contains(name)) {
                        edges.computeIfAbsent(name, key -> new ArrayList<>()).add(edge);
                    } else {
                        exported.merge(name, token, (existing, incoming) -> existing.append(incoming.originalLocations()));
                    }
                }
            }
            for (String owner : ref.ownerNames()) {
                if (localNames.contains(owner)) {
                    edges.computeIfAbsent(owner, key -> new ArrayList<>()).addAll(referenced);
                }
            }
        }

        // local compositions may point forward, so prefixes are expanded only once every edge is known
        var prefixes = new HashMap<String, List<SourceLocation>>();
        for (String name : localNames) {
            compositionPrefix(file, name, edges, exported, prefixes, new LinkedHashSet<>());
        }
        for (String name : localNames) {
            var prefix = prefixes.get(name);
            if (!prefix.isEmpty()) {
                exported.put(name, exported.get(name).prepend(prefix));
            }
        }

        var dependencies = new LinkedHashSet<FileIdentity>(parsed.preBundled());
        for (var entry : loaded.entrySet()) {
            if (!entry.getKey().isIgnored()) {
                dependencies.add(entry.getKey());
                dependencies.addAll(entry.getValue().dependencies());
            }
        }
        dependencies.remove(file);
        dependencies.remove(FileIdentity.IGNORED);
        return new LoadResult(new ArrayList<>(exported.values()), dependencies);
    }

    /**
     * A local class composes either another local class, expanded transitively, or the locations of a token
     * found in another file.
     */
    private record CompositionEdge(String localName, List<SourceLocation> external) {
        static CompositionEdge local(String name) {
            return new CompositionEdge(name, List.of());
        }

        static CompositionEdge external(List<SourceLocation> locations) {
            return new CompositionEdge(null, locations);
        }
    }

    /**
     * Locations that precede {@code name}'s own: each composed class's prefix and own locations, in edge order.
     * A local cycle stops at the class already being expanded.
     */
    private static List<SourceLocation> compositionPrefix(
        FileIdentity file,
        String name,
        Map<String, List<CompositionEdge>> edges,
        Map<String, Token> exported,
        Map<String, List<SourceLocation>> prefixes,
        Set<String> visiting
    ) {
        var done = prefixes.get(name);
        if (done != null) {
            return done;
        }
        visiting.add(name);
        var prefix = new LinkedHashSet<SourceLocation>();
        for (CompositionEdge edge : edges.getOrDefault(name, List.of())) {
            if (edge.localName() == null) {
                prefix.addAll(edge.external());
                continue;
            }
            String target = edge.localName();
            if (visiting.contains(target)) {
                LOG.warn("{}: class '{}' composes '{}' which already composes it, not following the cycle", file, name, target);
            } else {
                prefix.addAll(compositionPrefix(file, target, edges, exported, prefixes, visiting));
            }
            prefix.addAll(exported.get(target).originalLocations());
        }
        visiting.remove(name);
        var result = List.copyOf(prefix);
        prefixes.put(name, result);
        return result;
    }

    private static LoadResult resultOf(FileIdentity target, Map<FileIdentity, LoadResult> loaded) {
        if (target.isIgnored()) {
            return LoadResult.empty();
        }
        return Objects.requireNonNull(loaded.get(target), () -> "missing result for " + target);
    }

    private ExtractionResult applySourceMap(FileIdentity file, ExtractionResult extraction, String rawMap) {
        SourceMap map;
        try {
            map = SourceMap.parse(rawMap);
        } catch (IOException ex) {
            LOG.warn("{}: ignoring unreadable source map: {}", file, ex.getMessage());
            return extraction;
        }
        var tokens = new ArrayList<Token>(extraction.localTokens().size());
        for (Token token : extraction.localTokens()) {
            var mapped = token.originalLocations().stream().map(location -> traceBack(file, map, location)).toList();
            tokens.add(new Token(token.name(), mapped));
        }
        return new ExtractionResult(tokens, extraction.composesReferences(), extraction.importReferences());
    }

    private static SourceLocation traceBack(FileIdentity file, SourceMap map, SourceLocation generated) {
        var original = map.originalPositionFor(generated.start());
        if (original.isEmpty()) {
            return generated;
        }
        var start = original.get().position();
        var end = generated.end().line() == generated.start().line()
            ? new Position(start.line(), start.column() + generated.end().column() - generated.start().column())
            : start;
        return new SourceLocation(sourceIdentity(file, original.get().source()), start, end);
    }

    private static FileIdentity sourceIdentity(FileIdentity file, String source) {
        if (source.startsWith("file:") || Path.of(source).isAbsolute()) {
            return FileIdentity.of(source);
        }
        Optional<Path> parent = file.toPath().map(Path::getParent);
        return parent.map(dir -> FileIdentity.of(dir.resolve(source))).orElse(file);
    }

    static RuntimeException unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof RuntimeException runtime) {
            return runtime;
        }
        if (current instanceof Error fatal) {
            throw fatal;
        }
        return new IllegalStateException(current.getMessage(), current);
    }

    public static final class Builder {
        private LoadCache cache = new LoadCache();
        private ContentReader reader = new FileSystemContentReader();
        private SourceTransformer transformer = new TransformerRegistry();
        private SpecifierResolver resolver;
        private Predicate<String> ignoredSpecifier = IgnoredSpecifiers.defaults();
        private TokenExtractor extractor = new TokenExtractor();
        private Executor executor = ForkJoinPool.commonPool();

        public Builder cache(LoadCache cache) {
            this.cache = Objects.requireNonNull(cache, "cache");
            return this;
        }

        public Builder reader(ContentReader reader) {
            this.reader = Objects.requireNonNull(reader, "reader");
            return this;
        }

        public Builder transformer(SourceTransformer transformer) {
            this.transformer = Objects.requireNonNull(transformer, "transformer");
            return this;
        }

        public Builder resolver(SpecifierResolver resolver) {
            this.resolver = Objects.requireNonNull(resolver, "resolver");
            return this;
        }

        public Builder ignoredSpecifier(Predicate<String> ignoredSpecifier) {
            this.ignoredSpecifier = Objects.requireNonNull(ignoredSpecifier, "ignoredSpecifier");
            return this;
        }

        public Builder extractor(TokenExtractor extractor) {
            this.extractor = Objects.requireNonNull(extractor, "extractor");
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public DependencyGraphLoader build() {
            return new DependencyGraphLoader(this);
        }
    }
}
