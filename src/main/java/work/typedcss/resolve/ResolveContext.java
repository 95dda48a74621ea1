package work.typedcss.resolve;

import java.util.Objects;
import work.typedcss.model.FileIdentity;

public record ResolveContext(FileIdentity requestingFile) {
    public ResolveContext {
        Objects.requireNonNull(requestingFile, "requestingFile");
    }
}
