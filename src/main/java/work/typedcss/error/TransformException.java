package work.typedcss.error;

import java.util.Optional;
import work.typedcss.model.FileIdentity;
import work.typedcss.model.SourceLocation;

/**
 * Diagnostic reported by a dialect compiler, with the location it points at when known.
 */
public final class TransformException extends LoadException {
    private final String diagnostic;
    private final SourceLocation location;

    public TransformException(FileIdentity file, String diagnostic, SourceLocation location) {
        this(file, diagnostic, location, null);
    }

    public TransformException(FileIdentity file, String diagnostic, SourceLocation location, Throwable cause) {
        super(file, format(file, diagnostic, location), cause);
        this.diagnostic = diagnostic == null ? "" : diagnostic;
        this.location = location;
    }

    public String diagnostic() {
        return diagnostic;
    }

    public Optional<SourceLocation> location() {
        return Optional.ofNullable(location);
    }

    private static String format(FileIdentity file, String diagnostic, SourceLocation location) {
        String where = location == null ? file.toString() : location.file() + ":" + location.start();
        String text = diagnostic == null || diagnostic.isBlank() ? "transform failed" : diagnostic.strip();
        return "Failed to transform " + where + ": " + text;
    }
}
