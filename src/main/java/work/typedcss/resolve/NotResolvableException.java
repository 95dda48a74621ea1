package work.typedcss.resolve;

import work.typedcss.model.FileIdentity;

/**
 * No file matches a specifier.
 */
public final class NotResolvableException extends RuntimeException {
    private final String specifier;
    private final FileIdentity requestingFile;

    public NotResolvableException(String specifier, FileIdentity requestingFile) {
        super("Cannot find '" + specifier + "' from " + requestingFile);
        this.specifier = specifier;
        this.requestingFile = requestingFile;
    }

    public String specifier() {
        return specifier;
    }

    public FileIdentity requestingFile() {
        return requestingFile;
    }
}
