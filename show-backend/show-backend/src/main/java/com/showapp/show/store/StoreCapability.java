package com.showapp.show.store;

public enum StoreCapability {
    /** The engine can return distinct showtime years itself (DISTINCT over a derived column). */
    DISTINCT_YEARS
}
