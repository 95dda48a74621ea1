package work.typedcss.transform;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.typedcss.error.TransformException;

/**
 * Runs a dialect compiler as a subprocess: source on stdin, normalized CSS on stdout, diagnostics on
 * stderr. The argument {@code {file}} is replaced by the path of the file being compiled.
 */
public final class ExternalCommandTransformer implements SourceTransformer {
    private static final Logger LOG = LoggerFactory.getLogger(ExternalCommandTransformer.class);
    static final String FILE_PLACEHOLDER = "{file}";

    private final List<String> command;
    private final Duration timeout;

    public ExternalCommandTransformer(List<String> command, Duration timeout) {
        Objects.requireNonNull(command, "command");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Transformer command must not be empty.");
        }
        this.command = List.copyOf(command);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public List<String> command() {
        return command;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public TransformResult transform(String source, TransformContext context) {
        var file = context.originalLocation();
        Path path = file.toPath().orElse(null);
        var args = new ArrayList<String>(command.size());
        for (String arg : command) {
            args.add(path == null ? arg : arg.replace(FILE_PLACEHOLDER, path.toString()));
        }
        var builder = new ProcessBuilder(args);
        if (path != null && path.getParent() != null) {
            builder.directory(path.getParent().toFile());
        }
        LOG.debug("Running {} for {}", args, file);

        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new TransformException(file, "Cannot start " + args.get(0) + ": " + ex.getMessage(), null, ex);
        }
        var stdout = OutputReader.start(process.getInputStream(), "typed-css-compiler-stdout");
        var stderr = OutputReader.start(process.getErrorStream(), "typed-css-compiler-stderr");
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(source.getBytes(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            // the compiler may exit before consuming stdin; its exit status decides below
            LOG.debug("Compiler closed stdin early for {}: {}", file, ex.getMessage());
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TransformException(file, args.get(0) + " timed out after " + timeout, null);
            }
            if (process.exitValue() != 0) {
                throw new TransformException(file, stderr.await(timeout), null);
            }
            return TransformResult.of(stdout.await(timeout));
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new TransformException(file, "Interrupted while running " + args.get(0), null, ex);
        } catch (IOException ex) {
            throw new TransformException(file, "Cannot read output of " + args.get(0) + ": " + ex.getMessage(), null, ex);
        }
    }

    /**
     * Collects one output stream of the compiler on its own daemon thread.
     */
    private static final class OutputReader {
        private final InputStream stream;
        private final Thread thread;
        private volatile byte[] bytes;
        private volatile IOException failure;

        private OutputReader(InputStream stream, String name) {
            this.stream = stream;
            this.thread = new Thread(this::drain, name);
            this.thread.setDaemon(true);
        }

        static OutputReader start(InputStream stream, String name) {
            var reader = new OutputReader(stream, name);
            reader.thread.start();
            return reader;
        }

        private void drain() {
            try (InputStream in = stream) {
                bytes = in.readAllBytes();
            } catch (IOException ex) {
                failure = ex;
            }
        }

        String await(Duration timeout) throws InterruptedException, IOException {
            thread.join(Math.max(1, timeout.toMillis()));
            if (thread.isAlive()) {
                throw new IOException("output still open after the process exited");
            }
            if (failure != null) {
                throw failure;
            }
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }
}
