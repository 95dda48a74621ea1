package work.typedcss.error;

import work.typedcss.model.FileIdentity;

/**
 * I/O failure other than a missing file or a denied permission.
 */
public final class FileReadException extends LoadException {
    public FileReadException(FileIdentity file, Throwable cause) {
        super(file, "Cannot read " + file + ": " + cause.getMessage(), cause);
    }
}
