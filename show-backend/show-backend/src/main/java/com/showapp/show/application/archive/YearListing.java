package com.showapp.show.application.archive;

import com.showapp.show.store.ShowStore;
import com.showapp.show.store.StoreCapability;

import java.util.List;

/**
 * One way of asking a {@link ShowStore} for the years that have shows.
 * Every implementation returns the same thing: distinct years, ascending.
 */
public interface YearListing {

    /** Capability the store must have for this listing to be used; null when it needs none. */
    StoreCapability requiredCapability();

    List<Integer> listYears(ShowStore store, Long excludedId);
}
