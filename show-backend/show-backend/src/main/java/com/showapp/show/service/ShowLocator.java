package com.showapp.show.service;

import com.showapp.common.exception.NotFoundException;
import com.showapp.common.exception.ShowErrorCodes;
import com.showapp.show.application.resolution.DefaultShowPolicy;
import com.showapp.show.application.resolution.ResolutionContext;
import com.showapp.show.config.ShowProperties;
import com.showapp.show.domain.show.Show;
import com.showapp.show.store.ShowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the single show a (possibly absent) calendar date refers to.
 * Lookups are memoized in the request's cache, so asking twice within one
 * request returns the same instance without touching the store again.
 */
@Slf4j
@Service
public class ShowLocator {

    private final ShowStore showStore;
    private final ShowProperties properties;

    public ShowLocator(ShowStore showStore, ShowProperties properties) {
        this.showStore = showStore;
        this.properties = properties;
    }

    /**
     * @param date null to fall back to {@code policy}
     * @throws NotFoundException when no show satisfies the rule
     */
    public Show locate(LocalDate date, DefaultShowPolicy policy, ResolutionContext context) {
        return find(date, policy, context).orElseThrow(() -> notFound(date, policy));
    }

    public Optional<Show> find(LocalDate date, DefaultShowPolicy policy, ResolutionContext context) {
        LocateKey key = new LocateKey(date, (date == null) ? policy : null);
        return context.cache().memoize(key, () -> query(date, policy, context.now()));
    }

    /** The show on air at the context's "now", if any. */
    public Optional<Show> findInProgress(ResolutionContext context) {
        return context.cache().memoize(InProgressKey.INSTANCE, () -> showStore.findInProgressAt(context.now()));
    }

    private Optional<Show> query(LocalDate date, DefaultShowPolicy policy, Instant now) {
        if (date != null) {
            // First show after the start of that day: a date between shows resolves forward.
            Instant startOfDay = date.atStartOfDay(properties.timeZone()).toInstant();
            log.debug("Locating first show after {} ({})", startOfDay, date);
            return showStore.findFirstStartingAfter(startOfDay);
        }

        if (policy == DefaultShowPolicy.IN_PROGRESS_OR_MOST_RECENT_COMPLETED) {
            Optional<Show> inProgress = showStore.findInProgressAt(now);
            if (inProgress.isPresent()) {
                log.debug("Show {} is in progress at {}", inProgress.get().getId(), now);
                return inProgress;
            }
        }

        log.debug("Locating most recently completed show before {}", now);
        return showStore.findLatestEndedBefore(now);
    }

    private NotFoundException notFound(LocalDate date, DefaultShowPolicy policy) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (date != null) {
            details.put("date", date.toString());
        } else {
            details.put("policy", policy.name());
        }
        return new NotFoundException("No show found", ShowErrorCodes.SHOW_NOT_FOUND, details);
    }

    private record LocateKey(LocalDate date, DefaultShowPolicy policy) {}

    private enum InProgressKey { INSTANCE }
}
