package work.typedcss.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.typedcss.support.InMemoryFiles.file;

import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import work.typedcss.error.CyclicCompositionException;
import work.typedcss.error.NotFoundException;
import work.typedcss.model.LoadResult;

class LoadCacheTest {
    @Test
    void unknownFileIsUnrequested() {
        var cache = new LoadCache();
        assertEquals(CacheEntry.State.UNREQUESTED, cache.get(file("a.css")).state());
        assertEquals(0, cache.size());
    }

    @Test
    void firstClaimOwnsLaterClaimsShare() {
        var cache = new LoadCache();
        var first = cache.beginLoad(file("a.css"));
        var second = cache.beginLoad(file("a.css"));

        assertTrue(first.owner());
        assertFalse(second.owner());
        assertSame(first.future(), second.future());
        assertEquals(CacheEntry.State.IN_FLIGHT, cache.get(file("a.css")).state());

        var result = LoadResult.empty();
        cache.complete(file("a.css"), result);

        assertEquals(CacheEntry.State.RESOLVED, cache.get(file("a.css")).state());
        assertSame(result, cache.get(file("a.css")).result().orElseThrow());
        assertSame(result, second.future().join());
    }

    @Test
    void concurrentClaimsElectExactlyOneOwner() throws Exception {
        var cache = new LoadCache();
        var pool = Executors.newFixedThreadPool(8);
        var start = new CountDownLatch(1);
        var owners = new ConcurrentLinkedQueue<Boolean>();
        try {
            for (int i = 0; i < 32; i++) {
                pool.submit(() -> {
                    start.await();
                    owners.add(cache.beginLoad(file("race.css")).owner());
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(32, owners.size());
        assertEquals(1, owners.stream().filter(Boolean::booleanValue).count());
    }

    @Test
    void failedEntryIsClaimedAfresh() {
        var cache = new LoadCache();
        cache.beginLoad(file("a.css"));
        var failure = new NotFoundException(file("a.css"), new NoSuchFileException("a.css"));
        cache.completeExceptionally(file("a.css"), failure);

        var entry = cache.get(file("a.css"));
        assertEquals(CacheEntry.State.FAILED, entry.state());
        assertSame(failure, entry.error().orElseThrow());

        assertTrue(cache.beginLoad(file("a.css")).owner());
    }

    @Test
    void waitingOnAFileThatWaitsOnUsIsACycle() {
        var cache = new LoadCache();
        cache.beginLoad(file("a.css"));
        cache.beginLoad(file("b.css"));
        cache.claim(file("b.css"), file("a.css"));

        var error = assertThrows(CyclicCompositionException.class, () -> cache.claim(file("a.css"), file("b.css")));
        assertEquals(List.of(file("a.css"), file("b.css")), error.chain());
    }

    @Test
    void waitingOnResolvedFilesIsNeverACycle() {
        var cache = new LoadCache();
        cache.beginLoad(file("a.css"));
        cache.beginLoad(file("b.css"));
        cache.claim(file("b.css"), file("a.css"));
        cache.complete(file("b.css"), LoadResult.empty());

        var claim = cache.claim(file("b.css"), file("a.css"));
        assertFalse(claim.owner());
        var shared = cache.claim(file("a.css"), file("c.css"));
        assertFalse(shared.owner());
    }

    @Test
    void evictingAnInFlightEntryLetsItsWaitersFinish() {
        var cache = new LoadCache();
        var claim = cache.beginLoad(file("a.css"));
        cache.evict(file("a.css"));
        assertEquals(1, cache.size());

        cache.complete(file("a.css"), LoadResult.empty());

        assertTrue(claim.future().isDone());
        assertEquals(0, cache.size());
        assertTrue(cache.beginLoad(file("a.css")).owner());
    }

    @Test
    void clearDropsSettledEntries() {
        var cache = new LoadCache();
        var names = List.of("a.css", "b.css", "c.css");
        for (String name : names) {
            cache.beginLoad(file(name));
            cache.complete(file(name), LoadResult.empty());
        }
        assertEquals(3, cache.size());

        cache.clear();

        assertEquals(0, cache.size());
        for (String name : names) {
            assertEquals(CacheEntry.State.UNREQUESTED, cache.get(file(name)).state());
        }
    }

    @Test
    void completingAnUnclaimedFileIsAnError() {
        var cache = new LoadCache();
        assertThrows(IllegalStateException.class, () -> cache.complete(file("a.css"), LoadResult.empty()));
    }
}
