package work.typedcss.error;

import java.util.List;
import java.util.stream.Collectors;
import work.typedcss.model.FileIdentity;

/**
 * Raised instead of waiting forever when a file (transitively) composes from itself.
 */
public final class CyclicCompositionException extends LoadException {
    private final List<FileIdentity> chain;

    public CyclicCompositionException(FileIdentity file, List<FileIdentity> chain) {
        super(file, "Cyclic composition: " + describe(file, chain));
        this.chain = List.copyOf(chain);
    }

    /** Files on the path that led back to {@link #file()}, outermost first. */
    public List<FileIdentity> chain() {
        return chain;
    }

    private static String describe(FileIdentity file, List<FileIdentity> chain) {
        return chain.stream().map(FileIdentity::toString).collect(Collectors.joining(" -> ")) + " -> " + file;
    }
}
