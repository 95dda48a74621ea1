package work.typedcss.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.typedcss.model.FileIdentity;

class DefaultSpecifierResolverTest {
    @TempDir
    Path project;

    private ResolveContext fromApp;

    @BeforeEach
    void setUp() throws IOException {
        fromApp = new ResolveContext(FileIdentity.of(write("src/app/app.module.css", ".app {}")));
    }

    private Path write(String relative, String content) throws IOException {
        Path path = project.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
        return path;
    }

    private DefaultSpecifierResolver.Builder builder() {
        return DefaultSpecifierResolver.builder().workingDirectory(project);
    }

    private FileIdentity expected(String relative) {
        return FileIdentity.of(project.resolve(relative));
    }

    @Test
    void resolvesRelativeToRequestingFile() throws IOException {
        write("src/shared/colors.css", ".red {}");

        var resolved = builder().build().resolve("../shared/colors.css", fromApp);

        assertEquals(expected("src/shared/colors.css"), resolved);
    }

    @Test
    void bareNamesAreRelativeFirst() throws IOException {
        write("src/app/buttons.css", ".b {}");

        assertEquals(expected("src/app/buttons.css"), builder().build().resolve("buttons.css", fromApp));
    }

    @Test
    void triesRequestingExtensionAndPartials() throws IOException {
        write("src/app/theme.css", ".t {}");
        write("src/app/_mixins.css", ".m {}");
        var resolver = builder().build();

        assertEquals(expected("src/app/theme.css"), resolver.resolve("./theme", fromApp));
        assertEquals(expected("src/app/_mixins.css"), resolver.resolve("./mixins", fromApp));
    }

    @Test
    void resolvesAbsolutePathsAndFileUris() throws IOException {
        Path target = write("elsewhere/abs.css", ".x {}");
        var resolver = builder().build();

        assertEquals(FileIdentity.of(target), resolver.resolve(target.toString(), fromApp));
        assertEquals(FileIdentity.of(target), resolver.resolve(target.toUri().toString(), fromApp));
    }

    @Test
    void longestAliasWins() throws IOException {
        write("src/design/tokens.css", ".t {}");
        write("src/design/system/tokens.css", ".s {}");
        var resolver = builder()
            .alias("@design", "src/design")
            .alias("@design/system", "src/design/system")
            .build();

        assertEquals(expected("src/design/tokens.css"), resolver.resolve("@design/tokens.css", fromApp));
        assertEquals(expected("src/design/system/tokens.css"), resolver.resolve("@design/system/tokens.css", fromApp));
    }

    @Test
    void resolvesSubpathImportsFromNearestManifest() throws IOException {
        write("package.json", """
            {"name": "app", "imports": {"#theme": "./src/theme/main.css", "#ui/*": {"style": "./src/ui/*.css"}}}
            """);
        write("src/theme/main.css", ".main {}");
        write("src/ui/card.css", ".card {}");
        var resolver = builder().build();

        assertEquals(expected("src/theme/main.css"), resolver.resolve("#theme", fromApp));
        assertEquals(expected("src/ui/card.css"), resolver.resolve("#ui/card", fromApp));
    }

    @Test
    void resolvesPackagesFromNodeModules() throws IOException {
        write("node_modules/normalize/package.json", "{\"name\": \"normalize\", \"style\": \"dist/normalize.css\"}");
        write("node_modules/normalize/dist/normalize.css", "html {}");
        write("node_modules/@acme/ui/index.css", ".acme {}");
        write("node_modules/@acme/ui/buttons/primary.css", ".primary {}");
        var resolver = builder().build();

        assertEquals(expected("node_modules/normalize/dist/normalize.css"), resolver.resolve("normalize", fromApp));
        assertEquals(expected("node_modules/@acme/ui/index.css"), resolver.resolve("@acme/ui", fromApp));
        assertEquals(
            expected("node_modules/@acme/ui/buttons/primary.css"),
            resolver.resolve("@acme/ui/buttons/primary", fromApp)
        );
    }

    @Test
    void fallsBackToLoadPaths() throws IOException {
        write("vendor/styles/grid.css", ".grid {}");
        var resolver = builder().loadPaths(List.of(Path.of("vendor/styles"))).build();

        assertEquals(expected("vendor/styles/grid.css"), resolver.resolve("grid", fromApp));
    }

    @Test
    void ignoredSpecifiersNeverTouchTheFileSystem() {
        var resolver = builder().build();

        assertEquals(FileIdentity.IGNORED, resolver.resolve("https://cdn.example.com/reset.css", fromApp));
        assertEquals(FileIdentity.IGNORED, resolver.resolve("//cdn.example.com/reset.css", fromApp));
    }

    @Test
    void customIgnoredPredicateReplacesDefaults() {
        var resolver = builder().ignored(IgnoredSpecifiers.prefixes(List.of("virtual:"))).build();

        assertEquals(FileIdentity.IGNORED, resolver.resolve("virtual:tokens", fromApp));
        assertThrows(NotResolvableException.class, () -> resolver.resolve("https://cdn.example.com/x.css", fromApp));
    }

    @Test
    void unknownSpecifierIsNotResolvable() {
        var error = assertThrows(NotResolvableException.class, () -> builder().build().resolve("./missing.css", fromApp));

        assertEquals("./missing.css", error.specifier());
        assertEquals(fromApp.requestingFile(), error.requestingFile());
    }
}
