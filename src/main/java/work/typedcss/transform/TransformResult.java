package work.typedcss.transform;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.typedcss.model.FileIdentity;

/**
 * Normalized CSS, an optional source map (v3 JSON) back to the dialect source, and the files that
 * were inlined while compiling.
 */
public record TransformResult(String css, Optional<String> sourceMap, List<FileIdentity> preBundledDependencies) {
    public TransformResult {
        Objects.requireNonNull(css, "css");
        Objects.requireNonNull(sourceMap, "sourceMap");
        preBundledDependencies = List.copyOf(preBundledDependencies);
    }

    public static TransformResult of(String css) {
        return new TransformResult(css, Optional.empty(), List.of());
    }
}
