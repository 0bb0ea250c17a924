package com.showapp.show.application.resolution;

/**
 * Outcome of comparing a requested date with the show it resolved to:
 * either serve the show as requested or send the client to the show's
 * canonical date.
 */
public record CanonicalDecision(boolean redirect, String canonicalDate) {

    private static final CanonicalDecision PROCEED = new CanonicalDecision(false, null);

    public static CanonicalDecision proceed() {
        return PROCEED;
    }

    public static CanonicalDecision redirectTo(String canonicalDate) {
        if (canonicalDate == null || canonicalDate.isBlank()) {
            throw new IllegalArgumentException("canonicalDate is required for a redirect");
        }
        return new CanonicalDecision(true, canonicalDate);
    }

    public boolean isProceed() {
        return !redirect;
    }
}
