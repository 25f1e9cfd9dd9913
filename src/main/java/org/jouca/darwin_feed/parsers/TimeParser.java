package org.jouca.darwin_feed.parsers;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

import org.jouca.darwin_feed.exceptions.TimeFormatException;

/**
 * Parses the time-of-day strings carried by train status updates.
 *
 * <p>Two layouts are recognised, chosen by length: five characters are read as
 * {@code HH:mm}, anything else as {@code HH:mm:ss}. Scheduled and actual times share the
 * same layouts, so a value with seconds parses identically on both sides of a delay.
 *
 * @author Jouca
 * @since 1.0
 */
public final class TimeParser {

    /** Layout for minute-precision times such as "10:07" */
    private static final DateTimeFormatter MINUTE_LAYOUT =
            DateTimeFormatter.ofPattern("HH:mm").withResolverStyle(ResolverStyle.STRICT);

    /** Layout for second-precision times such as "10:07:30" */
    private static final DateTimeFormatter SECOND_LAYOUT =
            DateTimeFormatter.ofPattern("HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private TimeParser() {
    }

    /**
     * Parses a time-of-day value.
     *
     * @param value a non-empty time string in {@code HH:mm} or {@code HH:mm:ss} layout
     * @return the parsed time of day
     * @throws IllegalArgumentException if {@code value} is null or empty; callers are expected
     *         to treat empty fields as absent before parsing
     * @throws TimeFormatException if {@code value} matches neither layout
     */
    public static LocalTime parse(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Time value must not be empty");
        }

        DateTimeFormatter layout = value.length() == 5 ? MINUTE_LAYOUT : SECOND_LAYOUT;
        try {
            return LocalTime.parse(value, layout);
        } catch (DateTimeParseException e) {
            throw new TimeFormatException("Unrecognised time of day '" + value + "'", e);
        }
    }
}
