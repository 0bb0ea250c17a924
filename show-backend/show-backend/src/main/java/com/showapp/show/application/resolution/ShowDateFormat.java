package com.showapp.show.application.resolution;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;

/**
 * Date spellings accepted in show URLs, in the order they are tried.
 */
public enum ShowDateFormat {

    ISO("uuuu-MM-dd", true),
    DAY_FIRST("dd-MM-uuuu", false);

    private final DateTimeFormatter formatter;
    private final boolean canonical;

    ShowDateFormat(String pattern, boolean canonical) {
        this.formatter = DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
        this.canonical = canonical;
    }

    public DateTimeFormatter formatter() {
        return formatter;
    }

    public boolean isCanonical() {
        return canonical;
    }

    public static ShowDateFormat canonicalFormat() {
        return ISO;
    }
}
