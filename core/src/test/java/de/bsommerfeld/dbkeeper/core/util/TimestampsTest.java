package de.bsommerfeld.dbkeeper.core.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimestampsTest {

    @Test
    void format_shouldAlwaysCarryMilliseconds() {
        assertEquals("2024-01-15T10:30:00.000Z", Timestamps.format(Instant.parse("2024-01-15T10:30:00Z")));
    }

    @Test
    void format_shouldOrderLexicallyLikeChronologically() {
        String whole = Timestamps.format(Instant.parse("2024-01-15T10:30:00Z"));
        String fraction = Timestamps.format(Instant.parse("2024-01-15T10:30:00.500Z"));
        assertTrue(whole.compareTo(fraction) < 0);
    }

    @Test
    void parse_shouldRoundTripFormattedValue() {
        Instant now = Instant.parse("2024-03-01T08:15:42.123Z");
        assertEquals(now, Timestamps.parse(Timestamps.format(now)));
    }

    @Test
    void parse_shouldReturnNullForNull() {
        assertNull(Timestamps.parse(null));
    }

    @Test
    void compact_shouldStripSeparatorsForIds() {
        String id = Timestamps.compact(Instant.parse("2024-01-15T10:30:00Z"));
        assertEquals("2024-01-15T10-30-00-000Z", id);
    }
}
