package work.typedcss.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.typedcss.loader.ContentReader;
import work.typedcss.loader.DependencyGraphLoader;
import work.typedcss.loader.FileSystemContentReader;
import work.typedcss.loader.LoadCache;
import work.typedcss.model.FileIdentity;
import work.typedcss.model.LoadResult;
import work.typedcss.resolve.DefaultSpecifierResolver;
import work.typedcss.resolve.IgnoredSpecifiers;
import work.typedcss.transform.ExternalCommandTransformer;
import work.typedcss.transform.TransformerRegistry;

/**
 * Public entry point for embedding the loader as a batch job: every input file of a run shares one
 * {@link LoadCache}, and one file's failure never aborts the others.
 */
public final class TypegenRunner {
    private static final Logger LOG = LoggerFactory.getLogger(TypegenRunner.class);

    private final ContentReader reader;

    public TypegenRunner() {
        this(new FileSystemContentReader());
    }

    public TypegenRunner(ContentReader reader) {
        this.reader = reader;
    }

    public RunResult run(TypegenConfiguration configuration) {
        var started = Instant.now();
        var executor = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()), new LoaderThreads());
        try {
            var loader = createLoader(configuration, new LoadCache(), executor);
            Map<FileIdentity, CompletableFuture<LoadResult>> pending = new LinkedHashMap<>();
            for (var input : configuration.inputFiles()) {
                var file = FileIdentity.of(configuration.workingDirectory().resolve(input));
                pending.putIfAbsent(file, loader.loadAsync(file));
            }
            List<FileReport> reports = new ArrayList<>(pending.size());
            for (var entry : pending.entrySet()) {
                reports.add(report(entry.getKey(), entry.getValue()));
            }
            var result = RunResult.of(reports, started);
            LOG.info("Loaded {} file(s), {} failed, in {} ms", reports.size(), result.failedCount(), result.elapsed().toMillis());
            return result;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Wires the default resolver chain and the configured transformers around {@code cache}.
     */
    public DependencyGraphLoader createLoader(TypegenConfiguration configuration, LoadCache cache, ExecutorService executor) {
        Predicate<String> ignored = IgnoredSpecifiers.prefixes(configuration.ignoredPrefixes());
        var resolver = DefaultSpecifierResolver.builder()
            .workingDirectory(configuration.workingDirectory())
            .aliases(configuration.aliases())
            .loadPaths(configuration.loadPaths())
            .ignored(ignored)
            .build();
        var transformers = new TransformerRegistry();
        configuration.transformers().forEach((extension, command) -> transformers.register(
            extension,
            new ExternalCommandTransformer(command.command(), command.timeout().orElse(configuration.transformTimeout()))
        ));
        return DependencyGraphLoader.builder()
            .cache(cache)
            .reader(reader)
            .resolver(resolver)
            .ignoredSpecifier(ignored)
            .transformer(transformers)
            .executor(executor)
            .build();
    }

    private static FileReport report(FileIdentity file, CompletableFuture<LoadResult> future) {
        try {
            return FileReport.ok(file, future.join());
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            LOG.error("Failed to load {}: {}", file, cause.getMessage());
            LOG.debug("Failure details for {}", file, cause);
            return FileReport.failed(file, cause);
        }
    }

    private static final class LoaderThreads implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            var thread = new Thread(task, "typed-css-loader-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
