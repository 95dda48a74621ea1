package work.typedcss.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tokens exported by one file plus the transitive closure of files it depends on. Immutable.
 */
public record LoadResult(List<Token> tokens, Set<FileIdentity> dependencies) {
    private static final LoadResult EMPTY = new LoadResult(List.of(), Set.of());

    public LoadResult {
        tokens = List.copyOf(tokens);
        dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public static LoadResult empty() {
        return EMPTY;
    }

    public Optional<Token> token(String name) {
        return tokens.stream().filter(token -> token.name().equals(name)).findFirst();
    }

    public List<String> tokenNames() {
        return tokens.stream().map(Token::name).toList();
    }
}
