package work.typedcss.transform;

/**
 * Compiles one dialect source into normalized CSS. Inline-now directives of the dialect must be
 * resolved and inlined here; the files read for them are reported as pre-bundled dependencies.
 */
@FunctionalInterface
public interface SourceTransformer {
    /**
     * @throws work.typedcss.error.TransformException when the dialect compiler reports an error
     */
    TransformResult transform(String source, TransformContext context);
}
