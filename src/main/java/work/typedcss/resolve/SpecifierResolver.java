package work.typedcss.resolve;

import work.typedcss.model.FileIdentity;

/**
 * Maps a specifier written in a style sheet to the file it names.
 */
@FunctionalInterface
public interface SpecifierResolver {
    /**
     * @return the canonical identity, or {@link FileIdentity#IGNORED} for specifiers the host chose to skip
     * @throws NotResolvableException when no file matches
     */
    FileIdentity resolve(String specifier, ResolveContext context);
}
