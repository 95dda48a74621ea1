package work.typedcss.loader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import work.typedcss.model.FileIdentity;

/**
 * Reads UTF-8 files from the local filesystem.
 */
public final class FileSystemContentReader implements ContentReader {
    @Override
    public String read(FileIdentity file) throws IOException {
        var path = file.toPath().orElseThrow(() -> new NoSuchFileException(file.value(), null, "not a local file"));
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
