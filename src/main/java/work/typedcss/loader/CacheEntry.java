package work.typedcss.loader;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import work.typedcss.model.LoadResult;

/**
 * Snapshot of the cache state for one file. The state follows the shared future of the load attempt.
 */
public final class CacheEntry {
    private static final CacheEntry UNREQUESTED = new CacheEntry(null);

    public enum State {
        UNREQUESTED,
        IN_FLIGHT,
        RESOLVED,
        FAILED
    }

    private final CompletableFuture<LoadResult> future;

    CacheEntry(CompletableFuture<LoadResult> future) {
        this.future = future;
    }

    static CacheEntry unrequested() {
        return UNREQUESTED;
    }

    public State state() {
        if (future == null) {
            return State.UNREQUESTED;
        }
        if (!future.isDone()) {
            return State.IN_FLIGHT;
        }
        return future.isCompletedExceptionally() ? State.FAILED : State.RESOLVED;
    }

    public Optional<LoadResult> result() {
        return state() == State.RESOLVED ? Optional.of(future.join()) : Optional.empty();
    }

    public Optional<Throwable> error() {
        if (state() != State.FAILED) {
            return Optional.empty();
        }
        return Optional.of(future.handle((result, error) -> DependencyGraphLoader.unwrap(error)).join());
    }

    CompletableFuture<LoadResult> future() {
        return future;
    }
}
