package com.showapp.show.service;

import com.showapp.common.exception.NotFoundException;
import com.showapp.common.exception.ShowErrorCodes;
import com.showapp.show.application.resolution.*;
import com.showapp.show.config.ShowProperties;
import com.showapp.show.domain.show.Show;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Turns the date segment of a show URL into a show plus a decision on
 * whether the client should be sent to that show's canonical URL.
 */
@Slf4j
@Service
public class ShowResolutionService {

    private final ShowLocator showLocator;
    private final ShowProperties properties;

    public ShowResolutionService(ShowLocator showLocator, ShowProperties properties) {
        this.showLocator = showLocator;
        this.properties = properties;
    }

    /**
     * @param rawDate date segment as sent by the client, null when the URL had none
     * @throws NotFoundException when the date cannot be parsed or names no show
     */
    public ShowResolution resolve(String rawDate, DefaultShowPolicy policy, ResolutionContext context) {
        return context.cache().memoize(new ResolutionKey(rawDate, policy), () -> doResolve(rawDate, policy, context));
    }

    private ShowResolution doResolve(String rawDate, DefaultShowPolicy policy, ResolutionContext context) {
        ParsedDate requested = null;
        if (rawDate != null) {
            requested = DateParser.parse(rawDate).orElseThrow(() -> new NotFoundException(
                    "No show for that date",
                    ShowErrorCodes.DATE_NOT_PARSEABLE,
                    Map.of("date", rawDate)
            ));
        }

        Show show = showLocator.locate(requested == null ? null : requested.date(), policy, context);
        CanonicalDecision decision = Canonicalizer.check(requested, show, properties.timeZone());

        if (decision.redirect()) {
            log.debug("Date '{}' resolved to show {}, canonical date {}", rawDate, show.getId(), decision.canonicalDate());
        }

        return new ShowResolution(show, decision);
    }

    private record ResolutionKey(String rawDate, DefaultShowPolicy policy) {}
}
