package work.typedcss.resolve;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One step of the default resolver chain. Returns an existing file or empty when the strategy does not apply.
 */
@FunctionalInterface
interface ResolverStrategy {
    Optional<Path> resolve(String specifier, Path requestingFile);
}
