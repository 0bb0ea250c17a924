package com.showapp.show.store;

import com.showapp.show.domain.show.Show;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to stored shows.
 * <p>
 * Wherever several shows tie on the ordering column, the one with the lowest
 * id wins. Methods taking an {@code excludedId} ignore that show; a null
 * {@code excludedId} excludes nothing.
 */
public interface ShowStore {

    Set<StoreCapability> capabilities();

    default boolean supports(StoreCapability capability) {
        return capabilities().contains(capability);
    }

    /** Earliest show whose showtime is strictly after {@code instant}. */
    Optional<Show> findFirstStartingAfter(Instant instant);

    /** Show with the greatest end strictly before {@code instant}. */
    Optional<Show> findLatestEndedBefore(Instant instant);

    /** Show whose [showtime, end) interval contains {@code instant}. */
    Optional<Show> findInProgressAt(Instant instant);

    /** Show with the greatest showtime. */
    Optional<Show> findLatest(Long excludedId);

    /**
     * Distinct showtime years in the configured zone, ascending.
     *
     * @throws UnsupportedOperationException if the store lacks {@link StoreCapability#DISTINCT_YEARS}
     */
    List<Integer> findDistinctShowtimeYears(Long excludedId);

    /** One showtime year per show in the configured zone, duplicates included. */
    List<Integer> findShowtimeYears(Long excludedId);

    /** Shows with {@code fromInclusive <= showtime < toExclusive}, newest first. */
    List<Show> findStartingBetween(Instant fromInclusive, Instant toExclusive, Long excludedId);
}
