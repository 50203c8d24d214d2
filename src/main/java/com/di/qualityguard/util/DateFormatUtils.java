package com.di.qualityguard.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Recognises date and timestamp cells under a fixed list of patterns. The list is ordered and
 * the first pattern that parses wins, so a given string always maps to the same instant.
 */
public final class DateFormatUtils {

    private DateFormatUtils() {}

    /** A parsed cell; {@code hasTime} is false for date-only values. */
    public record ParsedDateTime(LocalDateTime value, boolean hasTime) {}

    private static final List<DateTimeFormatter> DATE_PATTERNS = List.of(
            strict("uuuu-MM-dd"),   // ISO standard
            strict("uuuu/MM/dd"),   // Logs
            strict("dd.MM.uuuu"),   // Central Europe
            strict("MM/dd/uuuu"),   // US
            strict("dd/MM/uuuu")    // UK / EU
    );

    private static final DateTimeFormatter SPACE_SEPARATED_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_PATTERNS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            SPACE_SEPARATED_DATE_TIME
    );

    public static List<String> supportedPatterns() {
        return List.of("yyyy-MM-dd", "yyyy/MM/dd", "dd.MM.yyyy", "MM/dd/yyyy", "dd/MM/yyyy",
                "yyyy-MM-ddTHH:mm[:ss][.fraction]", "yyyy-MM-dd HH:mm[:ss][.fraction]",
                "yyyy-MM-ddTHH:mm[:ss][.fraction](Z|+hh:mm)");
    }

    /**
     * Parses a cell as a date or timestamp. Offset timestamps are normalised to UTC.
     *
     * @param input trimmed cell text
     * @return the parsed value, or empty when no supported pattern matches
     */
    public static Optional<ParsedDateTime> parse(String input) {
        if (input == null || input.length() < 8 || !Character.isDigit(input.charAt(0))) {
            return Optional.empty();
        }
        for (DateTimeFormatter formatter : DATE_PATTERNS) {
            try {
                return Optional.of(new ParsedDateTime(LocalDate.parse(input, formatter).atStartOfDay(), false));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        for (DateTimeFormatter formatter : LOCAL_DATE_TIME_PATTERNS) {
            try {
                return Optional.of(new ParsedDateTime(LocalDateTime.parse(input, formatter), true));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        try {
            LocalDateTime utc = OffsetDateTime.parse(input, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime();
            return Optional.of(new ParsedDateTime(utc, true));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean isDateTime(String input) {
        return parse(input).isPresent();
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
