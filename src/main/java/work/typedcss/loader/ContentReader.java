package work.typedcss.loader;

import java.io.IOException;
import work.typedcss.model.FileIdentity;

/**
 * Reads the raw source of a file.
 */
@FunctionalInterface
public interface ContentReader {
    /**
     * @throws java.nio.file.NoSuchFileException when the file does not exist
     * @throws java.nio.file.AccessDeniedException when it cannot be read
     */
    String read(FileIdentity file) throws IOException;
}
