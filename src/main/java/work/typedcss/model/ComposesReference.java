package work.typedcss.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One {@code composes:} declaration: the composing rule's class names, the composed names in written order,
 * and either a local source or the specifier of another file.
 */
public record ComposesReference(
    List<String> ownerNames,
    List<String> tokenNames,
    Optional<String> specifier,
    Position position
) {
    public ComposesReference {
        ownerNames = List.copyOf(ownerNames);
        tokenNames = List.copyOf(tokenNames);
        Objects.requireNonNull(specifier, "specifier");
        Objects.requireNonNull(position, "position");
    }

    public static ComposesReference local(List<String> ownerNames, List<String> tokenNames, Position position) {
        return new ComposesReference(ownerNames, tokenNames, Optional.empty(), position);
    }

    public static ComposesReference from(List<String> ownerNames, List<String> tokenNames, String specifier, Position position) {
        return new ComposesReference(ownerNames, tokenNames, Optional.of(specifier), position);
    }

    public boolean isLocal() {
        return specifier.isEmpty();
    }
}
