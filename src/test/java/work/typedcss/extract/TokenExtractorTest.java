package work.typedcss.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.typedcss.error.ExtractionException;
import work.typedcss.model.ComposesReference;
import work.typedcss.model.FileIdentity;
import work.typedcss.model.Position;
import work.typedcss.model.SourceLocation;
import work.typedcss.model.Token;

class TokenExtractorTest {
    private static final FileIdentity FILE = FileIdentity.of(Path.of("/styles/button.css"));

    private final TokenExtractor extractor = new TokenExtractor();

    private ExtractionResult extract(String css) {
        return extractor.extract(FILE, css);
    }

    private static List<String> names(ExtractionResult result) {
        return result.localTokens().stream().map(Token::name).toList();
    }

    private static SourceLocation at(int line, int column, int endColumn) {
        return new SourceLocation(FILE, new Position(line, column), new Position(line, endColumn));
    }

    @Test
    void tokensFollowDocumentOrderWithOneLocationEach() {
        var result = extract(".a {}\n.b { color: red; }\n.c {}");
        assertEquals(List.of("a", "b", "c"), names(result));
        assertEquals(List.of(at(2, 1, 3)), result.localTokens().get(1).originalLocations());
        result.localTokens().forEach(token -> assertEquals(1, token.originalLocations().size()));
    }

    @Test
    void duplicateDeclarationsCollapseIntoOneToken() {
        var result = extract(".a{} .a{}");
        assertEquals(List.of("a"), names(result));
        assertEquals(List.of(at(1, 1, 3), at(1, 6, 8)), result.localTokens().get(0).originalLocations());
    }

    @Test
    void compoundAndListSelectorsDefineEveryClass() {
        var result = extract(".a.b > .c, .d:hover {}");
        assertEquals(List.of("a", "b", "c", "d"), names(result));
    }

    @Test
    void nonClassSelectorsAreIgnored() {
        var result = extract("div, #main, a[href$='.css'], [class~=\".fake\"] { margin: 0; }");
        assertTrue(result.localTokens().isEmpty());
    }

    @Test
    void nestedSuffixDefinesTopLevelToken() {
        var result = extract(".btn { &--primary { color: red; } }");
        assertEquals(List.of("btn", "btn--primary"), names(result));
        assertEquals(List.of(at(1, 8, 18)), result.localTokens().get(1).originalLocations());
    }

    @Test
    void nestedSuffixUsesInnermostParentClass() {
        var result = extract(".card { .title { &-large {} } }");
        assertEquals(List.of("card", "title", "title-large"), names(result));
    }

    @Test
    void nestedDescendantRuleDefinesItsOwnClass() {
        var result = extract(".list { .item { } & > .icon {} }");
        assertEquals(List.of("list", "item", "icon"), names(result));
    }

    @Test
    void globalClassesAreNotExported() {
        var result = extract(":global(.legacy) .scoped {}\n:global .also-global {}\n.local-again {}");
        assertEquals(List.of("scoped", "local-again"), names(result));
    }

    @Test
    void commentsDoNotDefineTokens() {
        var result = extract("/* .fake {} */\n.real { /* .inner */ color: blue; }");
        assertEquals(List.of("real"), names(result));
    }

    @Test
    void escapedCharactersAreUnescaped() {
        var result = extract(".sm\\:p-4 {} .\\@wide {}");
        assertEquals(List.of("sm:p-4", "@wide"), names(result));
    }

    @Test
    void hexEscapeConsumesOneTrailingWhitespace() {
        var result = extract(".\\31 a {}\n.b\\31  .c {}");
        assertEquals(List.of("1a", "b1", "c"), names(result));
    }

    @Test
    void outOfRangeHexEscapesBecomeReplacementCharacter() {
        var result = extract(".a\\110000 {}\n.s\\D800 {}\n.z\\0 {}");
        assertEquals(List.of("a\uFFFD", "s\uFFFD", "z\uFFFD"), names(result));
    }

    @Test
    void containerAtRulesAreEntered() {
        var result = extract("@media (min-width: 600px) { .wide {} }\n@supports (display: grid) { @layer base { .grid {} } }");
        assertEquals(List.of("wide", "grid"), names(result));
    }

    @Test
    void otherAtRuleBlocksAreSkipped() {
        var result = extract("@keyframes spin { from { opacity: 0 } to { opacity: 1 } }\n@font-face { font-family: x; }\n.spinner {}");
        assertEquals(List.of("spinner"), names(result));
    }

    @Test
    void composesDeclarationsKeepNameAndDocumentOrder() {
        var result = extract(".a {\n  composes: c b from './other.css';\n  composes: d;\n}\n.e { compose-with: f, g from \"pkg/x.css\"; }");
        var refs = result.composesReferences();
        assertEquals(3, refs.size());

        assertEquals(List.of("c", "b"), refs.get(0).tokenNames());
        assertEquals(Optional.of("./other.css"), refs.get(0).specifier());
        assertEquals(List.of("a"), refs.get(0).ownerNames());
        assertEquals(new Position(2, 3), refs.get(0).position());

        assertTrue(refs.get(1).isLocal());
        assertEquals(List.of("d"), refs.get(1).tokenNames());

        assertEquals(List.of("f", "g"), refs.get(2).tokenNames());
        assertEquals(Optional.of("pkg/x.css"), refs.get(2).specifier());
        assertEquals(List.of("e"), refs.get(2).ownerNames());
    }

    @Test
    void composesFromGlobalIsNotAReference() {
        var result = extract(".a { composes: reset from global; }");
        assertEquals(List.of("a"), names(result));
        assertTrue(result.composesReferences().isEmpty());
    }

    @Test
    void nestedRuleWithoutClassesInheritsOwners() {
        var result = extract(".a { &:hover { composes: b; } }");
        ComposesReference ref = result.composesReferences().get(0);
        assertEquals(List.of("a"), ref.ownerNames());
    }

    @Test
    void topLevelImportsAreReported() {
        var result = extract("@import './base.css';\n@import url(\"theme.css\") screen;\n@import url(reset.css);\n.a {}");
        var specifiers = result.importReferences().stream().map(ref -> ref.specifier()).toList();
        assertEquals(List.of("./base.css", "theme.css", "reset.css"), specifiers);
        assertEquals(new Position(2, 1), result.importReferences().get(1).position());
    }

    @Test
    void unclosedBlockIsReportedAtItsBrace() {
        var error = assertThrows(ExtractionException.class, () -> extract(".a { color: red;"));
        assertEquals(new Position(1, 4), error.position());
        assertEquals(FILE, error.file());
        assertTrue(error.getMessage().contains("Unclosed block"));
    }

    @Test
    void malformedInputFailsExtraction() {
        assertThrows(ExtractionException.class, () -> extract(".a {} }"));
        assertThrows(ExtractionException.class, () -> extract("color: red;"));
        assertThrows(ExtractionException.class, () -> extract(".a { color }"));
        assertThrows(ExtractionException.class, () -> extract("/* never closed"));
        assertThrows(ExtractionException.class, () -> extract(".a[title='oops {}"));
        assertThrows(ExtractionException.class, () -> extract("@import ;"));
    }

    @Test
    void unquotedComposesSourceIsRejected() {
        var error = assertThrows(ExtractionException.class, () -> extract(".a {\n composes: b from other.css;\n}"));
        assertEquals(new Position(2, 2), error.position());
        assertFalse(error.getMessage().isBlank());
    }
}
