package com.showapp.show.application.resolution;

/**
 * Which show a request without a date refers to.
 */
public enum DefaultShowPolicy {
    /** The show that ended most recently. */
    MOST_RECENT_COMPLETED,
    /** The show on air right now, otherwise the one that ended most recently. */
    IN_PROGRESS_OR_MOST_RECENT_COMPLETED
}
