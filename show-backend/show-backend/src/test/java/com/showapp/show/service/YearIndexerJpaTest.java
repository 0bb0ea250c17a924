package com.showapp.show.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.showapp.show.application.archive.DeduplicatingYearListing;
import com.showapp.show.application.archive.NativeDistinctYearListing;
import com.showapp.show.application.archive.YearListingRegistry;
import com.showapp.show.application.resolution.ResolutionContext;
import com.showapp.show.config.ShowProperties;
import com.showapp.show.domain.show.Show;
import com.showapp.show.repository.ShowRepository;
import com.showapp.show.store.JpaShowStore;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
class YearIndexerJpaTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Autowired private ShowRepository showRepository;

    private Show newYearsEve;

    @BeforeEach
    void setUp() {
        showRepository.deleteAll();
        // 2024-01-01T02:00Z is still New Year's Eve 2023 in New York.
        newYearsEve = showRepository.save(Show.builder()
                .showtime(Instant.parse("2024-01-01T02:00:00Z"))
                .end(Instant.parse("2024-01-01T04:00:00Z"))
                .build());
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void defaultYearIsListedOutsideUtc(boolean nativeDistinctYears) {
        ShowProperties properties = new ShowProperties(NEW_YORK, new ShowProperties.Store(nativeDistinctYears));
        JpaShowStore store = new JpaShowStore(showRepository, nativeDistinctYears, NEW_YORK);
        YearIndexer indexer = new YearIndexer(
                store,
                new ShowLocator(store, properties),
                new YearListingRegistry(List.of(new NativeDistinctYearListing(), new DeduplicatingYearListing())),
                properties);
        ResolutionContext context = ResolutionContext.startingAt(Instant.parse("2024-02-01T00:00:00Z"));

        assertThat(indexer.listYears(true, context)).containsExactly(2023);
        assertThat(indexer.resolveYear(null, true, context)).isEqualTo(2023);
        assertThat(indexer.listForYear(2023, true, context))
                .extracting(Show::getId)
                .containsExactly(newYearsEve.getId());
    }
}
