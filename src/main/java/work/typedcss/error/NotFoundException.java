package work.typedcss.error;

import work.typedcss.model.FileIdentity;

public final class NotFoundException extends LoadException {
    public NotFoundException(FileIdentity file, Throwable cause) {
        super(file, "No such file: " + file, cause);
    }
}
