package com.showapp.show.service;

import com.showapp.common.exception.NotFoundException;
import com.showapp.common.exception.ShowErrorCodes;
import com.showapp.show.application.archive.YearListingRegistry;
import com.showapp.show.application.resolution.ResolutionContext;
import com.showapp.show.config.ShowProperties;
import com.showapp.show.domain.show.Show;
import com.showapp.show.store.ShowStore;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Year index for the archive: which years have shows, and the shows of one year.
 * With {@code excludeCurrent} the show on air at the request's "now" is left
 * out of both.
 */
@Service
public class YearIndexer {

    private final ShowStore showStore;
    private final ShowLocator showLocator;
    private final YearListingRegistry yearListingRegistry;
    private final ShowProperties properties;

    public YearIndexer(
            ShowStore showStore,
            ShowLocator showLocator,
            YearListingRegistry yearListingRegistry,
            ShowProperties properties
    ) {
        this.showStore = showStore;
        this.showLocator = showLocator;
        this.yearListingRegistry = yearListingRegistry;
        this.properties = properties;
    }

    /** Distinct years with at least one show, ascending. */
    public List<Integer> listYears(boolean excludeCurrent, ResolutionContext context) {
        return context.cache().memoize(new YearsKey(excludeCurrent), () ->
                yearListingRegistry.resolve(showStore).listYears(showStore, excludedId(excludeCurrent, context)));
    }

    /**
     * @param requested null for the year of the newest show
     * @throws NotFoundException when the year has no shows
     */
    public int resolveYear(Integer requested, boolean excludeCurrent, ResolutionContext context) {
        Integer year = requested;
        if (year == null) {
            year = showStore.findLatest(excludedId(excludeCurrent, context))
                    .map(show -> show.getShowtime().atZone(properties.timeZone()).getYear())
                    .orElseThrow(() -> yearNotFound(null));
        }

        if (!listYears(excludeCurrent, context).contains(year)) {
            throw yearNotFound(year);
        }

        return year;
    }

    /** Shows whose showtime falls in {@code year} (broadcast zone), newest first. */
    public List<Show> listForYear(int year, boolean excludeCurrent, ResolutionContext context) {
        ZoneId zone = properties.timeZone();
        Instant from = LocalDate.of(year, 1, 1).atStartOfDay(zone).toInstant();
        Instant to = LocalDate.of(year + 1, 1, 1).atStartOfDay(zone).toInstant();

        return showStore.findStartingBetween(from, to, excludedId(excludeCurrent, context));
    }

    private Long excludedId(boolean excludeCurrent, ResolutionContext context) {
        if (!excludeCurrent) {
            return null;
        }
        return showLocator.findInProgress(context).map(Show::getId).orElse(null);
    }

    private NotFoundException yearNotFound(Integer year) {
        return new NotFoundException(
                "We don't have shows for that year",
                ShowErrorCodes.YEAR_NOT_FOUND,
                (year == null) ? null : Map.of("year", year)
        );
    }

    private record YearsKey(boolean excludeCurrent) {}
}
