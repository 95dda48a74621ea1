package work.typedcss.error;

import work.typedcss.model.FileIdentity;

public final class PermissionDeniedException extends LoadException {
    public PermissionDeniedException(FileIdentity file, Throwable cause) {
        super(file, "Permission denied: " + file, cause);
    }
}
