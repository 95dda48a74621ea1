package work.typedcss.error;

import work.typedcss.model.FileIdentity;
import work.typedcss.model.Position;

/**
 * Normalized CSS could not be tokenized.
 */
public final class ExtractionException extends LoadException {
    private final Position position;

    public ExtractionException(FileIdentity file, String message, Position position) {
        this(file, message, position, null);
    }

    public ExtractionException(FileIdentity file, String message, Position position, Throwable cause) {
        super(file, message + " at " + file + ":" + position, cause);
        this.position = position;
    }

    public Position position() {
        return position;
    }
}
