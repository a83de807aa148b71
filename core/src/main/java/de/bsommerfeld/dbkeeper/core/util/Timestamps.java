package de.bsommerfeld.dbkeeper.core.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Fixed-width ISO-8601 UTC timestamps for TEXT columns. {@link Instant#toString()}
 * drops zero fractions, which breaks lexical ordering in SQL comparisons; this
 * format always carries milliseconds.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return FORMAT.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    /**
     * Parses the stored format, plus anything {@link Instant#parse} accepts.
     *
     * @return {@code null} for {@code null} input
     */
    public static Instant parse(String text) {
        if (text == null)
            return null;
        return Instant.parse(text);
    }

    /** Backup ids embed the timestamp with {@code :} and {@code .} replaced. */
    public static String compact(Instant instant) {
        return format(instant).replace(':', '-').replace('.', '-');
    }
}
