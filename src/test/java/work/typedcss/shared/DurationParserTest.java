package work.typedcss.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesMilliseconds() {
        assertEquals(Optional.of(Duration.ofMillis(500)), DurationParser.parse("500ms"));
    }

    @Test
    void parsesSecondsMinutesAndHours() {
        assertEquals(Optional.of(Duration.ofSeconds(30)), DurationParser.parse("30s"));
        assertEquals(Optional.of(Duration.ofMinutes(2)), DurationParser.parse("2M"));
        assertEquals(Optional.of(Duration.ofHours(1)), DurationParser.parse(" 1h "));
    }

    @Test
    void bareNumbersAreMilliseconds() {
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationParser.parse("1500"));
    }

    @Test
    void handlesZero() {
        assertEquals(Optional.of(Duration.ZERO), DurationParser.parse("0"));
    }

    @Test
    void blankMeansUnset() {
        assertTrue(DurationParser.parse(null).isEmpty());
        assertTrue(DurationParser.parse("  ").isEmpty());
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-5s"));
    }
}
