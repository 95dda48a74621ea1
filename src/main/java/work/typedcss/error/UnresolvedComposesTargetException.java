package work.typedcss.error;

import work.typedcss.model.FileIdentity;

/**
 * A {@code composes: ... from '<specifier>'} target could not be resolved to a file.
 */
public final class UnresolvedComposesTargetException extends LoadException {
    private final String specifier;

    public UnresolvedComposesTargetException(String specifier, FileIdentity referringFile, Throwable cause) {
        super(referringFile, "Cannot resolve composes target '" + specifier + "' from " + referringFile, cause);
        this.specifier = specifier;
    }

    public String specifier() {
        return specifier;
    }
}
