package work.typedcss.error;

import work.typedcss.model.FileIdentity;

/**
 * An {@code @import} left in normalized CSS could not be resolved to a file.
 */
public final class UnresolvedImportTargetException extends LoadException {
    private final String specifier;

    public UnresolvedImportTargetException(String specifier, FileIdentity referringFile, Throwable cause) {
        super(referringFile, "Cannot resolve @import '" + specifier + "' from " + referringFile, cause);
        this.specifier = specifier;
    }

    public String specifier() {
        return specifier;
    }
}
