package com.showapp.show.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * @param timeZone zone in which request dates become instants and showtimes become calendar dates
 * @param store    capabilities of the configured show store
 */
@Validated
@ConfigurationProperties(prefix = "show")
public record ShowProperties(
        @NotNull @DefaultValue("Europe/London") ZoneId timeZone,
        @Valid @NotNull @DefaultValue Store store) {

    /**
     * @param nativeDistinctYears whether the database can answer DISTINCT on the derived showtime year
     */
    public record Store(@DefaultValue("true") boolean nativeDistinctYears) {}
}
