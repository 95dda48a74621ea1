package work.typedcss.error;

import java.util.Objects;
import work.typedcss.model.FileIdentity;

/**
 * Base class of every failure raised while loading a style-sheet graph.
 */
public abstract class LoadException extends RuntimeException {
    private final FileIdentity file;

    protected LoadException(FileIdentity file, String message) {
        this(file, message, null);
    }

    protected LoadException(FileIdentity file, String message, Throwable cause) {
        super(message, cause);
        this.file = Objects.requireNonNull(file, "file");
    }

    /** File whose load failed. */
    public FileIdentity file() {
        return file;
    }
}
