package work.typedcss.extract;

import java.util.List;
import work.typedcss.model.ComposesReference;
import work.typedcss.model.ImportReference;
import work.typedcss.model.Token;

/**
 * Tokens declared by one normalized style sheet plus the references it makes, all in document order.
 */
public record ExtractionResult(
    List<Token> localTokens,
    List<ComposesReference> composesReferences,
    List<ImportReference> importReferences
) {
    public ExtractionResult {
        localTokens = List.copyOf(localTokens);
        composesReferences = List.copyOf(composesReferences);
        importReferences = List.copyOf(importReferences);
    }
}
