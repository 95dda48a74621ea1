package work.typedcss.transform;

/**
 * Plain CSS needs no compilation.
 */
public final class PassthroughTransformer implements SourceTransformer {
    @Override
    public TransformResult transform(String source, TransformContext context) {
        return TransformResult.of(source);
    }
}
