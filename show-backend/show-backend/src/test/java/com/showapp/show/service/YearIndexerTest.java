package com.showapp.show.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.showapp.common.exception.NotFoundException;
import com.showapp.common.exception.ShowErrorCodes;
import com.showapp.show.application.archive.DeduplicatingYearListing;
import com.showapp.show.application.archive.NativeDistinctYearListing;
import com.showapp.show.application.archive.YearListingRegistry;
import com.showapp.show.application.resolution.ResolutionContext;
import com.showapp.show.config.ShowProperties;
import com.showapp.show.domain.show.Show;
import com.showapp.show.store.InMemoryShowStore;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class YearIndexerTest {

    private static final ShowProperties UTC =
            new ShowProperties(ZoneId.of("UTC"), new ShowProperties.Store(true));

    private final YearListingRegistry registry =
            new YearListingRegistry(List.of(new NativeDistinctYearListing(), new DeduplicatingYearListing()));

    @Test
    void twoShowsInOneYear() {
        InMemoryShowStore store = InMemoryShowStore.utc();
        Show january = store.add(1L, "2023-01-05T21:00:00Z", "2023-01-05T23:00:00Z");
        Show february = store.add(2L, "2023-02-10T21:00:00Z", "2023-02-10T23:00:00Z");
        YearIndexer indexer = indexer(store);
        ResolutionContext context = at("2023-03-01T00:00:00Z");

        assertThat(indexer.listYears(true, context)).containsExactly(2023);
        assertThat(indexer.resolveYear(null, true, context)).isEqualTo(2023);
        assertThat(indexer.listForYear(2023, true, context)).containsExactly(february, january);
    }

    @Test
    void yearsAreAscendingAndDistinctOnBothStoreKinds() {
        for (boolean nativeDistinct : new boolean[] {true, false}) {
            InMemoryShowStore store = new InMemoryShowStore(nativeDistinct, ZoneId.of("UTC"));
            store.add(1L, "2021-06-01T21:00:00Z", "2021-06-01T23:00:00Z");
            store.add(2L, "2019-06-01T21:00:00Z", "2019-06-01T23:00:00Z");
            store.add(3L, "2021-07-01T21:00:00Z", "2021-07-01T23:00:00Z");
            store.add(4L, "2020-06-01T21:00:00Z", "2020-06-01T23:00:00Z");

            assertThat(indexer(store).listYears(false, at("2022-01-01T00:00:00Z")))
                    .containsExactly(2019, 2020, 2021);
        }
    }

    @Test
    void excludingTheCurrentShowCanRemoveItsYear() {
        InMemoryShowStore store = InMemoryShowStore.utc();
        Show december = store.add(1L, "2022-12-20T21:00:00Z", "2022-12-20T23:00:00Z");
        Show onAir = store.add(2L, "2023-01-05T21:00:00Z", "2023-01-05T23:00:00Z");
        YearIndexer indexer = indexer(store);
        ResolutionContext duringShow = at("2023-01-05T22:00:00Z");

        assertThat(indexer.listYears(true, duringShow)).containsExactly(2022);
        assertThat(indexer.listYears(false, duringShow)).containsExactly(2022, 2023);
        assertThat(indexer.resolveYear(null, true, duringShow)).isEqualTo(2022);
        assertThat(indexer.resolveYear(null, false, duringShow)).isEqualTo(2023);
        assertThat(indexer.listForYear(2023, true, duringShow)).isEmpty();
        assertThat(indexer.listForYear(2023, false, duringShow)).containsExactly(onAir);
        assertThat(indexer.listForYear(2022, true, duringShow)).containsExactly(december);
    }

    @Test
    void nothingIsExcludedWhenNoShowIsOnAir() {
        InMemoryShowStore store = InMemoryShowStore.utc();
        store.add(1L, "2023-01-05T21:00:00Z", "2023-01-05T23:00:00Z");

        assertThat(indexer(store).listYears(true, at("2023-02-01T00:00:00Z"))).containsExactly(2023);
    }

    @Test
    void requestedYearWithoutShowsIsNotFound() {
        InMemoryShowStore store = InMemoryShowStore.utc();
        store.add(1L, "2023-01-05T21:00:00Z", "2023-01-05T23:00:00Z");
        YearIndexer indexer = indexer(store);

        assertThatThrownBy(() -> indexer.resolveYear(2019, true, at("2023-02-01T00:00:00Z")))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("We don't have shows for that year")
                .extracting(ex -> ((NotFoundException) ex).getErrorCode())
                .isEqualTo(ShowErrorCodes.YEAR_NOT_FOUND);
    }

    @Test
    void emptyStoreHasNoYearToDefaultTo() {
        YearIndexer indexer = indexer(InMemoryShowStore.utc());

        assertThat(indexer.listYears(true, at("2023-02-01T00:00:00Z"))).isEmpty();
        assertThatThrownBy(() -> indexer.resolveYear(null, true, at("2023-02-01T00:00:00Z")))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void yearBoundariesFollowTheConfiguredZone() {
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        InMemoryShowStore store = new InMemoryShowStore(true, tokyo);
        // New Year's Eve in UTC, already 2024 in Tokyo
        Show newYear = store.add(1L, "2023-12-31T20:00:00Z", "2023-12-31T22:00:00Z");
        YearIndexer indexer = new YearIndexer(
                store,
                new ShowLocator(store, new ShowProperties(tokyo, new ShowProperties.Store(true))),
                registry,
                new ShowProperties(tokyo, new ShowProperties.Store(true)));
        ResolutionContext context = at("2024-02-01T00:00:00Z");

        assertThat(indexer.resolveYear(null, true, context)).isEqualTo(2024);
        assertThat(indexer.listForYear(2024, true, context)).containsExactly(newYear);
        assertThat(indexer.listForYear(2023, true, context)).isEmpty();
    }

    @Test
    void yearListIsComputedOncePerRequest() {
        InMemoryShowStore store = InMemoryShowStore.utc();
        store.add(1L, "2023-01-05T21:00:00Z", "2023-01-05T23:00:00Z");
        YearIndexer indexer = indexer(store);
        ResolutionContext context = at("2023-02-01T00:00:00Z");

        indexer.listYears(true, context);
        int afterFirst = store.queryCount();
        indexer.listYears(true, context);
        indexer.resolveYear(2023, true, context);

        assertThat(store.queryCount()).isEqualTo(afterFirst);
    }

    private YearIndexer indexer(InMemoryShowStore store) {
        return new YearIndexer(store, new ShowLocator(store, UTC), registry, UTC);
    }

    private static ResolutionContext at(String instant) {
        return ResolutionContext.startingAt(Instant.parse(instant));
    }
}
