package work.typedcss.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Exported class token and every source location that contributed to it.
 */
public record Token(String name, List<SourceLocation> originalLocations) {
    public Token {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(originalLocations, "originalLocations");
        if (originalLocations.isEmpty()) {
            throw new IllegalArgumentException("Token '" + name + "' has no locations.");
        }
        originalLocations = List.copyOf(new LinkedHashSet<>(originalLocations));
    }

    public static Token of(String name, SourceLocation location) {
        return new Token(name, List.of(location));
    }

    /**
     * Returns a token whose locations are {@code prefix} followed by this token's own, deduplicated in first-seen order.
     */
    public Token prepend(List<SourceLocation> prefix) {
        var merged = new ArrayList<SourceLocation>(prefix.size() + originalLocations.size());
        merged.addAll(prefix);
        merged.addAll(originalLocations);
        return new Token(name, merged);
    }

    public Token append(List<SourceLocation> suffix) {
        var merged = new ArrayList<SourceLocation>(originalLocations);
        merged.addAll(suffix);
        return new Token(name, merged);
    }
}
