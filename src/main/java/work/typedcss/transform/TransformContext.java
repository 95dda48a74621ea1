package work.typedcss.transform;

import java.util.Objects;
import java.util.function.Predicate;
import work.typedcss.model.FileIdentity;
import work.typedcss.resolve.SpecifierResolver;

/**
 * What a transformer may use besides the source text: where it came from and how to resolve the
 * specifiers it inlines.
 */
public record TransformContext(
    FileIdentity originalLocation,
    SpecifierResolver resolver,
    Predicate<String> isIgnoredSpecifier
) {
    public TransformContext {
        Objects.requireNonNull(originalLocation, "originalLocation");
        Objects.requireNonNull(resolver, "resolver");
        Objects.requireNonNull(isIgnoredSpecifier, "isIgnoredSpecifier");
    }
}
