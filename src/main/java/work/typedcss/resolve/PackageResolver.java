package work.typedcss.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Node-style lookups: {@code #subpath} import maps from the nearest {@code package.json} and packages
 * under {@code node_modules}.
 */
final class PackageResolver {
    private static final Logger LOG = LoggerFactory.getLogger(PackageResolver.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String[] CONDITION_KEYS = {"style", "import", "default"};

    private final Map<Path, Optional<JsonNode>> manifests = new ConcurrentHashMap<>();

    Optional<Path> resolveSubpathImport(String specifier, Path requestingFile) {
        if (!specifier.startsWith("#") || requestingFile == null) {
            return Optional.empty();
        }
        Path dir = requestingFile.getParent();
        while (dir != null) {
            Path manifestPath = dir.resolve("package.json");
            var manifest = readManifest(manifestPath);
            if (manifest.isPresent()) {
                JsonNode imports = manifest.get().path("imports");
                if (imports.isObject()) {
                    Path root = dir;
                    return matchImport(imports, specifier)
                        .flatMap(target -> Candidates.firstExisting(root.resolve(target), requestingFile));
                }
            }
            dir = dir.getParent();
        }
        return Optional.empty();
    }

    Optional<Path> resolvePackage(String specifier, Path requestingFile) {
        if (requestingFile == null || specifier.startsWith(".") || specifier.startsWith("#") || specifier.isBlank()) {
            return Optional.empty();
        }
        String[] segments = specifier.split("/");
        int nameSegments = specifier.startsWith("@") ? 2 : 1;
        if (segments.length < nameSegments) {
            return Optional.empty();
        }
        String packageName = String.join("/", Arrays.copyOfRange(segments, 0, nameSegments));
        String subpath = String.join("/", Arrays.copyOfRange(segments, nameSegments, segments.length));

        Path dir = requestingFile.getParent();
        while (dir != null) {
            Path packageDir = dir.resolve("node_modules").resolve(packageName);
            if (Files.isDirectory(packageDir)) {
                Optional<Path> hit = subpath.isEmpty()
                    ? resolvePackageEntry(packageDir, requestingFile)
                    : Candidates.firstExisting(packageDir.resolve(subpath), requestingFile);
                if (hit.isPresent()) {
                    return hit;
                }
            }
            dir = dir.getParent();
        }
        return Optional.empty();
    }

    private Optional<Path> resolvePackageEntry(Path packageDir, Path requestingFile) {
        var manifest = readManifest(packageDir.resolve("package.json"));
        if (manifest.isPresent()) {
            for (String field : new String[] {"style", "sass", "less"}) {
                String entry = manifest.get().path(field).asText("");
                if (!entry.isBlank()) {
                    var hit = Candidates.firstExisting(packageDir.resolve(entry), requestingFile);
                    if (hit.isPresent()) {
                        return hit;
                    }
                }
            }
        }
        String extension = Candidates.extensionOf(requestingFile);
        var index = Candidates.firstExisting(packageDir.resolve("index." + (extension.isEmpty() ? "css" : extension)), requestingFile);
        return index.isPresent() ? index : Candidates.firstExisting(packageDir.resolve("index.css"), requestingFile);
    }

    private Optional<String> matchImport(JsonNode imports, String specifier) {
        JsonNode exact = imports.get(specifier);
        if (exact != null) {
            return targetOf(exact);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = imports.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            String key = entry.getKey();
            int star = key.indexOf('*');
            if (star < 0) {
                continue;
            }
            String prefix = key.substring(0, star);
            String suffix = key.substring(star + 1);
            if (specifier.length() >= prefix.length() + suffix.length()
                && specifier.startsWith(prefix)
                && specifier.endsWith(suffix)) {
                String captured = specifier.substring(prefix.length(), specifier.length() - suffix.length());
                return targetOf(entry.getValue()).map(target -> target.replace("*", captured));
            }
        }
        return Optional.empty();
    }

    private Optional<String> targetOf(JsonNode node) {
        if (node.isTextual()) {
            return Optional.of(node.asText());
        }
        if (node.isObject()) {
            for (String key : CONDITION_KEYS) {
                if (node.has(key)) {
                    return targetOf(node.get(key));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<JsonNode> readManifest(Path path) {
        return manifests.computeIfAbsent(path.toAbsolutePath().normalize(), key -> {
            if (!Files.isRegularFile(key)) {
                return Optional.empty();
            }
            try {
                return Optional.ofNullable(JSON.readTree(key.toFile()));
            } catch (IOException ex) {
                LOG.warn("Ignoring unreadable {}: {}", key, ex.getMessage());
                return Optional.empty();
            }
        });
    }
}
