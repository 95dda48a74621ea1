package work.typedcss.transform;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.typedcss.model.FileIdentity;

/**
 * Picks a transformer by file extension; extensions without a registration are treated as plain CSS.
 */
public final class TransformerRegistry implements SourceTransformer {
    private static final Logger LOG = LoggerFactory.getLogger(TransformerRegistry.class);

    private final Map<String, SourceTransformer> byExtension = new ConcurrentHashMap<>();
    private final SourceTransformer fallback;

    public TransformerRegistry() {
        this(new PassthroughTransformer());
    }

    public TransformerRegistry(SourceTransformer fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        byExtension.put("css", new PassthroughTransformer());
    }

    public TransformerRegistry register(String extension, SourceTransformer transformer) {
        Objects.requireNonNull(transformer, "transformer");
        byExtension.put(normalize(extension), transformer);
        return this;
    }

    public SourceTransformer forFile(FileIdentity file) {
        var transformer = byExtension.get(file.extension());
        if (transformer == null) {
            LOG.debug("No transformer registered for '.{}', treating {} as plain CSS", file.extension(), file);
            return fallback;
        }
        return transformer;
    }

    public Map<String, SourceTransformer> registrations() {
        return Collections.unmodifiableMap(byExtension);
    }

    @Override
    public TransformResult transform(String source, TransformContext context) {
        return forFile(context.originalLocation()).transform(source, context);
    }

    private static String normalize(String extension) {
        Objects.requireNonNull(extension, "extension");
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }
}
