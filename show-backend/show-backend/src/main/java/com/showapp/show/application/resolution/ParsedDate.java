package com.showapp.show.application.resolution;

import java.time.LocalDate;
import java.util.Objects;

public record ParsedDate(LocalDate date, ShowDateFormat format) {

    public ParsedDate {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(format, "format");
    }

    public boolean isCanonicalFormat() {
        return format.isCanonical();
    }
}
