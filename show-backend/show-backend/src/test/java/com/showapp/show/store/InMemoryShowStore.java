package com.showapp.show.store;

import com.showapp.show.domain.show.Show;

import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.stream.Stream;

/**
 * List-backed {@link ShowStore} for tests. Counts every query so memoization
 * can be asserted.
 */
public class InMemoryShowStore implements ShowStore {

    private final List<Show> shows = new ArrayList<>();
    private final Set<StoreCapability> capabilities;
    private final ZoneId zone;
    private int queryCount;

    public InMemoryShowStore(boolean nativeDistinctYears, ZoneId zone) {
        this.capabilities = nativeDistinctYears
                ? EnumSet.of(StoreCapability.DISTINCT_YEARS)
                : EnumSet.noneOf(StoreCapability.class);
        this.zone = zone;
    }

    public static InMemoryShowStore utc() {
        return new InMemoryShowStore(true, ZoneId.of("UTC"));
    }

    public InMemoryShowStore add(Show show) {
        shows.add(show);
        return this;
    }

    public Show add(long id, String showtime, String end) {
        Show show = Show.builder()
                .id(id)
                .showtime(Instant.parse(showtime))
                .end(Instant.parse(end))
                .build();
        shows.add(show);
        return show;
    }

    public int queryCount() {
        return queryCount;
    }

    @Override
    public Set<StoreCapability> capabilities() {
        return capabilities;
    }

    @Override
    public Optional<Show> findFirstStartingAfter(Instant instant) {
        queryCount++;
        return shows.stream()
                .filter(s -> s.getShowtime().isAfter(instant))
                .min(Comparator.comparing(Show::getShowtime).thenComparing(Show::getId));
    }

    @Override
    public Optional<Show> findLatestEndedBefore(Instant instant) {
        queryCount++;
        return shows.stream()
                .filter(s -> s.getEnd().isBefore(instant))
                .min(Comparator.comparing(Show::getEnd).reversed().thenComparing(Show::getId));
    }

    @Override
    public Optional<Show> findInProgressAt(Instant instant) {
        queryCount++;
        return shows.stream()
                .filter(s -> s.isInProgressAt(instant))
                .min(Comparator.comparing(Show::getId));
    }

    @Override
    public Optional<Show> findLatest(Long excludedId) {
        queryCount++;
        return without(excludedId)
                .min(Comparator.comparing(Show::getShowtime).reversed().thenComparing(Show::getId));
    }

    @Override
    public List<Integer> findDistinctShowtimeYears(Long excludedId) {
        if (!supports(StoreCapability.DISTINCT_YEARS)) {
            throw new UnsupportedOperationException("distinct years not supported");
        }
        queryCount++;
        return without(excludedId).map(this::year).distinct().sorted().toList();
    }

    @Override
    public List<Integer> findShowtimeYears(Long excludedId) {
        queryCount++;
        return without(excludedId)
                .sorted(Comparator.comparing(Show::getShowtime))
                .map(this::year)
                .toList();
    }

    @Override
    public List<Show> findStartingBetween(Instant fromInclusive, Instant toExclusive, Long excludedId) {
        queryCount++;
        return without(excludedId)
                .filter(s -> !s.getShowtime().isBefore(fromInclusive) && s.getShowtime().isBefore(toExclusive))
                .sorted(Comparator.comparing(Show::getShowtime).reversed().thenComparing(Show::getId))
                .toList();
    }

    private Stream<Show> without(Long excludedId) {
        return shows.stream().filter(s -> excludedId == null || !excludedId.equals(s.getId()));
    }

    private int year(Show show) {
        return show.getShowtime().atZone(zone).getYear();
    }
}
