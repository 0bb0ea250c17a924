package com.showapp.show.store;

import com.showapp.show.config.ShowProperties;
import com.showapp.show.domain.show.Show;
import com.showapp.show.repository.ShowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
@Transactional(readOnly = true)
public class JpaShowStore implements ShowStore {

    private final ShowRepository showRepository;
    private final Set<StoreCapability> capabilities;
    private final String zone;

    @Autowired
    public JpaShowStore(ShowRepository showRepository, ShowProperties properties) {
        this(showRepository, properties.store().nativeDistinctYears(), properties.timeZone());
    }

    public JpaShowStore(ShowRepository showRepository, boolean nativeDistinctYears, ZoneId zone) {
        this.showRepository = showRepository;
        this.zone = zone.getId();
        this.capabilities = Collections.unmodifiableSet(nativeDistinctYears
                ? EnumSet.of(StoreCapability.DISTINCT_YEARS)
                : EnumSet.noneOf(StoreCapability.class));
        log.info("Show store capabilities: {}, years in zone {}", this.capabilities, this.zone);
    }

    @Override
    public Set<StoreCapability> capabilities() {
        return capabilities;
    }

    @Override
    public Optional<Show> findFirstStartingAfter(Instant instant) {
        return showRepository.findFirstByShowtimeGreaterThanOrderByShowtimeAscIdAsc(instant);
    }

    @Override
    public Optional<Show> findLatestEndedBefore(Instant instant) {
        return showRepository.findFirstByEndLessThanOrderByEndDescIdAsc(instant);
    }

    @Override
    public Optional<Show> findInProgressAt(Instant instant) {
        return showRepository.findFirstByShowtimeLessThanEqualAndEndGreaterThanOrderByIdAsc(instant, instant);
    }

    @Override
    public Optional<Show> findLatest(Long excludedId) {
        return (excludedId == null)
                ? showRepository.findFirstByOrderByShowtimeDescIdAsc()
                : showRepository.findFirstByIdNotOrderByShowtimeDescIdAsc(excludedId);
    }

    @Override
    public List<Integer> findDistinctShowtimeYears(Long excludedId) {
        if (!supports(StoreCapability.DISTINCT_YEARS)) {
            throw new UnsupportedOperationException("This show store is not configured for distinct year queries");
        }
        return (excludedId == null)
                ? showRepository.findDistinctShowtimeYears(zone)
                : showRepository.findDistinctShowtimeYearsExcluding(zone, excludedId);
    }

    @Override
    public List<Integer> findShowtimeYears(Long excludedId) {
        return (excludedId == null)
                ? showRepository.findShowtimeYears(zone)
                : showRepository.findShowtimeYearsExcluding(zone, excludedId);
    }

    @Override
    public List<Show> findStartingBetween(Instant fromInclusive, Instant toExclusive, Long excludedId) {
        return (excludedId == null)
                ? showRepository.findByShowtimeGreaterThanEqualAndShowtimeLessThanOrderByShowtimeDescIdAsc(
                        fromInclusive, toExclusive)
                : showRepository.findByShowtimeGreaterThanEqualAndShowtimeLessThanAndIdNotOrderByShowtimeDescIdAsc(
                        fromInclusive, toExclusive, excludedId);
    }
}
