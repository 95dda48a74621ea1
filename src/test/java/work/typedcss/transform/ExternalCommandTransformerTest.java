package work.typedcss.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import work.typedcss.error.TransformException;
import work.typedcss.model.FileIdentity;
import work.typedcss.resolve.IgnoredSpecifiers;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ExternalCommandTransformerTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path dir;

    private TransformContext contextFor(String name) {
        return new TransformContext(
            FileIdentity.of(dir.resolve(name)),
            (specifier, context) -> FileIdentity.IGNORED,
            IgnoredSpecifiers.defaults()
        );
    }

    @Test
    void readsCompiledCssFromStdout() {
        var transformer = new ExternalCommandTransformer(List.of("cat"), TIMEOUT);

        var result = transformer.transform(".a { color: red; }", contextFor("a.scss"));

        assertEquals(".a { color: red; }", result.css());
        assertTrue(result.preBundledDependencies().isEmpty());
    }

    @Test
    void substitutesTheFilePlaceholder() {
        var transformer = new ExternalCommandTransformer(
            List.of("sh", "-c", "printf '.%s {}' \"$(basename \"$1\" .scss)\"", "sh", "{file}"),
            TIMEOUT
        );

        assertEquals(".card {}", transformer.transform("", contextFor("card.scss")).css());
    }

    @Test
    void largeOutputIsReadWhileEveryCommonPoolWorkerIsBusy() throws InterruptedException {
        int workers = ForkJoinPool.getCommonPoolParallelism();
        var busy = new CountDownLatch(workers);
        var release = new CountDownLatch(1);
        for (int i = 0; i < workers; i++) {
            ForkJoinPool.commonPool().execute(() -> {
                busy.countDown();
                try {
                    release.await();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        try {
            assertTrue(busy.await(5, TimeUnit.SECONDS));
            var transformer = new ExternalCommandTransformer(
                List.of("sh", "-c", "head -c 200000 /dev/zero | tr '\\0' a; head -c 100000 /dev/zero | tr '\\0' b >&2"),
                TIMEOUT
            );

            var result = transformer.transform("", contextFor("big.scss"));

            assertEquals(200_000, result.css().length());
        } finally {
            release.countDown();
        }
    }

    @Test
    void nonZeroExitReportsStderr() {
        var transformer = new ExternalCommandTransformer(List.of("sh", "-c", "echo 'Undefined mixin' >&2; exit 3"), TIMEOUT);

        var error = assertThrows(TransformException.class, () -> transformer.transform(".a {}", contextFor("a.scss")));

        assertEquals("Undefined mixin", error.diagnostic().strip());
        assertEquals(FileIdentity.of(dir.resolve("a.scss")), error.file());
    }

    @Test
    void slowCompilerTimesOut() {
        var transformer = new ExternalCommandTransformer(List.of("sleep", "5"), Duration.ofMillis(200));

        var error = assertThrows(TransformException.class, () -> transformer.transform("", contextFor("slow.scss")));

        assertTrue(error.getMessage().contains("timed out"));
    }

    @Test
    void missingCompilerFails() {
        var transformer = new ExternalCommandTransformer(List.of("typed-css-no-such-compiler"), TIMEOUT);

        assertThrows(TransformException.class, () -> transformer.transform("", contextFor("a.scss")));
    }

    @Test
    void emptyCommandIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExternalCommandTransformer(List.of(), TIMEOUT));
    }
}
