package work.typedcss.loader;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.typedcss.error.CyclicCompositionException;
import work.typedcss.model.FileIdentity;
import work.typedcss.model.LoadResult;

/**
 * Per-run memo of load attempts, shared by every recursive load. Claiming a file is atomic: of all
 * concurrent callers that find a file unrequested, exactly one becomes its owner and the others share
 * the owner's future.
 * <p>
 * The cache also tracks which in-flight files each in-flight file is waiting for, so that a cycle
 * closed across two independent call chains fails instead of waiting forever.
 */
public final class LoadCache {
    private static final Logger LOG = LoggerFactory.getLogger(LoadCache.class);

    private final Map<FileIdentity, CacheEntry> entries = new HashMap<>();
    private final Map<FileIdentity, Set<FileIdentity>> awaiting = new HashMap<>();
    private final Set<FileIdentity> stale = new HashSet<>();

    /**
     * Outcome of a claim: the caller either owns the load and must complete it, or shares an existing attempt.
     */
    public record Claim(boolean owner, CompletableFuture<LoadResult> future) {}

    public synchronized CacheEntry get(FileIdentity file) {
        return entries.getOrDefault(file, CacheEntry.unrequested());
    }

    /**
     * Claims {@code file} for a top-level request.
     */
    public Claim beginLoad(FileIdentity file) {
        return claim(file, null);
    }

    /**
     * Claims {@code file} on behalf of {@code waiter} (the file whose load needs it, or null for a
     * top-level request). Unrequested and failed entries are claimed afresh; resolved and in-flight
     * entries are shared.
     *
     * @throws CyclicCompositionException when waiting would close a cycle of in-flight files
     */
    public synchronized Claim claim(FileIdentity file, FileIdentity waiter) {
        Objects.requireNonNull(file, "file");
        var entry = entries.get(file);
        if (entry != null && entry.state() == CacheEntry.State.RESOLVED) {
            LOG.trace("Cache hit for {}", file);
            return new Claim(false, entry.future());
        }
        if (entry != null && entry.state() == CacheEntry.State.IN_FLIGHT) {
            if (waiter != null) {
                var cycle = waitPath(file, waiter);
                if (cycle != null) {
                    throw new CyclicCompositionException(file, cycle);
                }
                awaiting.computeIfAbsent(waiter, key -> new LinkedHashSet<>()).add(file);
            }
            LOG.trace("Joining in-flight load of {}", file);
            return new Claim(false, entry.future());
        }
        var future = new CompletableFuture<LoadResult>();
        entries.put(file, new CacheEntry(future));
        if (waiter != null) {
            awaiting.computeIfAbsent(waiter, key -> new LinkedHashSet<>()).add(file);
        }
        return new Claim(true, future);
    }

    public void complete(FileIdentity file, LoadResult result) {
        finish(file).complete(result);
    }

    /**
     * Fails the attempt for every caller sharing it. The entry stays {@code FAILED} until the next claim retries it.
     */
    public void completeExceptionally(FileIdentity file, Throwable error) {
        finish(file).completeExceptionally(error);
    }

    /**
     * Drops a file so the next load re-reads it. An in-flight attempt keeps running for the callers already sharing it.
     */
    public synchronized void evict(FileIdentity file) {
        var entry = entries.get(file);
        if (entry != null && entry.state() == CacheEntry.State.IN_FLIGHT) {
            stale.add(file);
        } else {
            entries.remove(file);
        }
    }

    public synchronized void clear() {
        for (var file : List.copyOf(entries.keySet())) {
            evict(file);
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    private synchronized CompletableFuture<LoadResult> finish(FileIdentity file) {
        awaiting.remove(file);
        var entry = entries.get(file);
        if (entry == null || entry.state() != CacheEntry.State.IN_FLIGHT) {
            throw new IllegalStateException("No load in flight for " + file);
        }
        if (stale.remove(file)) {
            entries.remove(file);
        }
        return entry.future();
    }

    /**
     * Path of in-flight files from {@code from} to {@code target} along wait edges, or null when there is none.
     */
    private List<FileIdentity> waitPath(FileIdentity from, FileIdentity target) {
        var parents = new HashMap<FileIdentity, FileIdentity>();
        Deque<FileIdentity> queue = new ArrayDeque<>();
        queue.add(from);
        parents.put(from, from);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            if (current.equals(target)) {
                var path = new ArrayList<FileIdentity>();
                for (var step = current; !step.equals(from); step = parents.get(step)) {
                    path.add(0, step);
                }
                path.add(0, from);
                return path;
            }
            for (var next : awaiting.getOrDefault(current, Set.of())) {
                var nextEntry = entries.get(next);
                boolean inFlight = nextEntry != null && nextEntry.state() == CacheEntry.State.IN_FLIGHT;
                if (inFlight && parents.putIfAbsent(next, current) == null) {
                    queue.add(next);
                }
            }
        }
        return null;
    }
}
