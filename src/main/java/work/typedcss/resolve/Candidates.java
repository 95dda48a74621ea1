package work.typedcss.resolve;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Expands a base path into the file names a style-sheet specifier may refer to.
 */
final class Candidates {
    private Candidates() {}

    /**
     * Tries {@code base} verbatim, then with the requesting file's extension, then both again as a
     * {@code _partial}. The first regular file wins.
     */
    static Optional<Path> firstExisting(Path base, Path requestingFile) {
        for (Path candidate : expand(base.normalize(), extensionOf(requestingFile))) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate.toAbsolutePath().normalize());
            }
        }
        return Optional.empty();
    }

    static List<Path> expand(Path base, String extension) {
        var out = new ArrayList<Path>(4);
        Path fileName = base.getFileName();
        out.add(base);
        boolean hasExtension = fileName != null && fileName.toString().lastIndexOf('.') > 0;
        if (!extension.isEmpty() && !hasExtension) {
            out.add(base.resolveSibling(fileName + "." + extension));
        }
        if (fileName != null && !fileName.toString().startsWith("_")) {
            Path partial = base.resolveSibling("_" + fileName);
            out.add(partial);
            if (!extension.isEmpty() && !hasExtension) {
                out.add(partial.resolveSibling(partial.getFileName() + "." + extension));
            }
        }
        return out;
    }

    static String extensionOf(Path file) {
        if (file == null || file.getFileName() == null) {
            return "";
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1) : "";
    }
}
