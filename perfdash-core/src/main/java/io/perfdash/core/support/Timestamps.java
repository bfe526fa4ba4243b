package io.perfdash.core.support;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;

/**
 * Canonical timestamp representation.
 * <p>
 * Collectors write {@code yyyy-MM-dd HH:mm:ss}; browsers send
 * {@code yyyy-MM-ddTHH:mm}. Both are normalised to {@link LocalDateTime} at the
 * boundary so ordering is always chronological, never textual. Dates that do
 * not exist on the calendar, such as {@code 2024-02-30}, are rejected.
 * <p>
 * Formatting writes seconds always and the fraction only when it is non-zero,
 * so a formatted timestamp parses back to the same instant.
 */
public final class Timestamps {

    public static final DateTimeFormatter CANONICAL = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter PARSER = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm")
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private Timestamps() {}

    /**
     * @throws DateTimeParseException if the text is not a timestamp
     */
    public static LocalDateTime parse(String text) {
        if (text == null) {
            throw new DateTimeParseException("Timestamp is missing", "", 0);
        }
        String normalized = text.trim().replace('T', ' ');
        return LocalDateTime.parse(normalized, PARSER);
    }

    public static String format(LocalDateTime timestamp) {
        return timestamp.format(CANONICAL);
    }
}
