// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ferrite.core.codec;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.Locale;

/**
 * Wire representations shared by the encoder, the decoder and the built-in parsers.
 */
final class WireFormats {

    /**
     * Local date-time with the zone offset in effect, e.g. {@code 2024-03-05T07:08:09+08:00}.
     * A zero offset renders as {@code +00:00}, never {@code Z}.
     */
    static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx", Locale.ROOT);

    /** Durations travel as ticks of 100 nanoseconds. */
    static final long TICKS_PER_SECOND = 10_000_000L;

    private static final long NANOS_PER_TICK = 100L;

    private WireFormats() {
    }

    static String formatDateTime(final LocalDateTime value) {
        return value.atZone(ZoneId.systemDefault()).format(DATE_TIME);
    }

    static String formatDateTime(final Date value) {
        return value.toInstant().atZone(ZoneId.systemDefault()).format(DATE_TIME);
    }

    static LocalDateTime parseLocalDateTime(final String text) {
        if (hasOffset(text)) {
            return OffsetDateTime.parse(text, DATE_TIME)
                    .atZoneSameInstant(ZoneId.systemDefault())
                    .toLocalDateTime();
        }
        return LocalDateTime.parse(text);
    }

    static Date parseDate(final String text) {
        if (hasOffset(text)) {
            return Date.from(OffsetDateTime.parse(text, DATE_TIME).toInstant());
        }
        return Date.from(LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toInstant());
    }

    /**
     * Converts a duration to ticks.
     *
     * @throws ArithmeticException if the duration exceeds the tick range (about 29,000 years)
     */
    static long toTicks(final Duration value) {
        return Math.addExact(
                Math.multiplyExact(value.getSeconds(), TICKS_PER_SECOND),
                value.getNano() / NANOS_PER_TICK);
    }

    static Duration fromTicks(final long ticks) {
        return Duration.ofSeconds(
                Math.floorDiv(ticks, TICKS_PER_SECOND),
                Math.floorMod(ticks, TICKS_PER_SECOND) * NANOS_PER_TICK);
    }

    private static boolean hasOffset(final String text) {
        // yyyy-MM-ddTHH:mm:ss is 19 chars; anything after it is the offset
        return text.length() > 19 && (text.charAt(19) == '+' || text.charAt(19) == '-');
    }
}
