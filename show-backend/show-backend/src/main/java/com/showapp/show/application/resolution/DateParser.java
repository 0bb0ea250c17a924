package com.showapp.show.application.resolution;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

public final class DateParser {

    private DateParser() {}

    /**
     * Parses a date from a URL segment, trying each {@link ShowDateFormat} in
     * declaration order. The whole string must match; the first format that
     * does wins.
     *
     * @return empty when no format matches (including null or blank input)
     */
    public static Optional<ParsedDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        for (ShowDateFormat format : ShowDateFormat.values()) {
            try {
                LocalDate date = LocalDate.parse(raw, format.formatter());
                return Optional.of(new ParsedDate(date, format));
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }

        return Optional.empty();
    }

    public static String formatCanonical(LocalDate date) {
        return ShowDateFormat.canonicalFormat().formatter().format(date);
    }
}
