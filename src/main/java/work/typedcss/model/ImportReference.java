package work.typedcss.model;

import java.util.Objects;

/**
 * Top-level {@code @import} left in the normalized CSS.
 */
public record ImportReference(String specifier, Position position) {
    public ImportReference {
        Objects.requireNonNull(specifier, "specifier");
        Objects.requireNonNull(position, "position");
    }
}
