package com.showapp.show.application.resolution;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-request state for show resolution: the single "now" the request is
 * evaluated against and the cache its lookups share.
 */
public record ResolutionContext(Instant now, RequestScopedCache cache) {

    public static final String ATTRIBUTE = "com.showapp.show.application.resolution.ResolutionContext";

    public ResolutionContext {
        Objects.requireNonNull(now, "now");
        Objects.requireNonNull(cache, "cache");
    }

    public static ResolutionContext startingAt(Instant now) {
        return new ResolutionContext(now, new RequestScopedCache());
    }
}
