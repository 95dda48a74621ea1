package work.typedcss.model;

import java.util.Objects;

/**
 * Span inside a file; {@code end} is exclusive.
 */
public record SourceLocation(FileIdentity file, Position start, Position end) {
    public SourceLocation {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.compareTo(start) < 0) {
            throw new IllegalArgumentException("Location ends before it starts: " + start + "-" + end);
        }
    }

    public SourceLocation withFile(FileIdentity other) {
        return new SourceLocation(other, start, end);
    }

    @Override
    public String toString() {
        return file + ":" + start + "-" + end;
    }
}
