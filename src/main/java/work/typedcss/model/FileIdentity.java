package work.typedcss.model;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical identity of a style-sheet file. Two identities are equal when their canonical strings are.
 */
public record FileIdentity(String value) implements Comparable<FileIdentity> {
    private static final String IGNORED_VALUE = "ignored:";

    /** Sentinel returned by resolvers for specifiers the host asked to skip (remote URLs and the like). */
    public static final FileIdentity IGNORED = new FileIdentity(IGNORED_VALUE);

    public FileIdentity {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("File identity must not be blank.");
        }
    }

    public static FileIdentity of(Path path) {
        Objects.requireNonNull(path, "path");
        return new FileIdentity(path.toAbsolutePath().normalize().toString());
    }

    /**
     * Canonicalizes a path string or {@code file:} URI. Other URIs are kept verbatim.
     */
    public static FileIdentity of(String raw) {
        Objects.requireNonNull(raw, "raw");
        String trimmed = raw.trim();
        if (trimmed.startsWith("file:")) {
            return of(Paths.get(URI.create(trimmed)));
        }
        if (hasUriScheme(trimmed)) {
            return new FileIdentity(trimmed);
        }
        return of(Paths.get(trimmed));
    }

    public boolean isIgnored() {
        return IGNORED_VALUE.equals(value);
    }

    public Optional<Path> toPath() {
        if (isIgnored() || hasUriScheme(value)) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(value));
    }

    /**
     * Lower-case extension without the dot, or an empty string.
     */
    public String extension() {
        int slash = Math.max(value.lastIndexOf('/'), value.lastIndexOf('\\'));
        int dot = value.lastIndexOf('.');
        if (dot <= slash || dot == value.length() - 1) {
            return "";
        }
        return value.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    @Override
    public int compareTo(FileIdentity other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }

    private static boolean hasUriScheme(String raw) {
        int colon = raw.indexOf(':');
        // single letter prefixes are Windows drive letters
        if (colon <= 1) {
            return false;
        }
        for (int i = 0; i < colon; i++) {
            char c = raw.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '+' && c != '-' && c != '.') {
                return false;
            }
        }
        return true;
    }
}
