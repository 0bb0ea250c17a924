package com.showapp.show.application.resolution;

import com.showapp.show.domain.show.Show;

import java.time.LocalDate;
import java.time.ZoneId;

public final class Canonicalizer {

    private Canonicalizer() {}

    /**
     * Decides whether the client must be redirected to the located show's
     * canonical date.
     * <ul>
     *   <li>no requested date: proceed (there is no more canonical spelling of "latest")</li>
     *   <li>canonical format and same calendar day as the showtime: proceed</li>
     *   <li>anything else: redirect to the showtime's ISO date</li>
     * </ul>
     *
     * @param requested null when the request carried no date
     */
    public static CanonicalDecision check(ParsedDate requested, Show located, ZoneId zone) {
        if (requested == null) {
            return CanonicalDecision.proceed();
        }

        LocalDate airDate = located.airDate(zone);

        if (requested.isCanonicalFormat() && airDate.equals(requested.date())) {
            return CanonicalDecision.proceed();
        }

        return CanonicalDecision.redirectTo(DateParser.formatCanonical(airDate));
    }
}
