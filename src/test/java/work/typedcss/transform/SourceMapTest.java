package work.typedcss.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.typedcss.model.Position;

class SourceMapTest {
    @Test
    void mapsGeneratedPositionsToOriginalOnes() throws IOException {
        // line 1: col 0 -> src 0 (1,1); col 5 -> src 0 (3,3)
        // line 2: col 0 -> src 1 (1,1); col 4 -> src 1 (1,5)
        var map = SourceMap.parse("""
            {"version": 3, "sources": ["a.scss", "b.scss"], "mappings": "AAAA,KAEE;ACFF,IAAI"}
            """);

        assertEquals(List.of("a.scss", "b.scss"), map.sources());
        assertEquals(new SourceMap.Mapping("a.scss", new Position(1, 1)), map.originalPositionFor(new Position(1, 1)).orElseThrow());
        assertEquals(new SourceMap.Mapping("a.scss", new Position(1, 1)), map.originalPositionFor(new Position(1, 5)).orElseThrow());
        assertEquals(new SourceMap.Mapping("a.scss", new Position(3, 3)), map.originalPositionFor(new Position(1, 6)).orElseThrow());
        assertEquals(new SourceMap.Mapping("b.scss", new Position(1, 1)), map.originalPositionFor(new Position(2, 1)).orElseThrow());
        assertEquals(new SourceMap.Mapping("b.scss", new Position(1, 5)), map.originalPositionFor(new Position(2, 9)).orElseThrow());
    }

    @Test
    void unmappedLinesHaveNoOriginal() throws IOException {
        var map = SourceMap.parse("{\"version\": 3, \"sources\": [\"a.scss\"], \"mappings\": \";AAAA\"}");

        assertTrue(map.originalPositionFor(new Position(1, 1)).isEmpty());
        assertTrue(map.originalPositionFor(new Position(9, 1)).isEmpty());
    }

    @Test
    void sourceRootIsPrefixed() throws IOException {
        var map = SourceMap.parse("{\"version\": 3, \"sourceRoot\": \"src\", \"sources\": [\"a.scss\"], \"mappings\": \"AAAA\"}");

        assertEquals(List.of("src/a.scss"), map.sources());
    }

    @Test
    void rejectsUnsupportedOrCorruptMaps() {
        assertThrows(IOException.class, () -> SourceMap.parse("{\"version\": 2, \"sources\": [], \"mappings\": \"\"}"));
        assertThrows(IOException.class, () -> SourceMap.parse("{\"version\": 3, \"sources\": [\"a\"], \"mappings\": \"A!AA\"}"));
        assertThrows(IOException.class, () -> SourceMap.parse("{\"version\": 3, \"sources\": [\"a\"], \"mappings\": \"AAAg\"}"));
        assertThrows(IOException.class, () -> SourceMap.parse("not json at all"));
    }
}
