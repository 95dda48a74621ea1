package work.typedcss.resolve;

import java.util.List;
import java.util.function.Predicate;

/**
 * Predicates for specifiers that are never read (remote style sheets by default).
 */
public final class IgnoredSpecifiers {
    public static final List<String> DEFAULT_PREFIXES = List.of("http://", "https://", "//");

    private IgnoredSpecifiers() {}

    public static Predicate<String> defaults() {
        return prefixes(DEFAULT_PREFIXES);
    }

    public static Predicate<String> prefixes(List<String> prefixes) {
        var copy = List.copyOf(prefixes);
        return specifier -> specifier != null && copy.stream().anyMatch(specifier::startsWith);
    }

    public static Predicate<String> none() {
        return specifier -> false;
    }
}
