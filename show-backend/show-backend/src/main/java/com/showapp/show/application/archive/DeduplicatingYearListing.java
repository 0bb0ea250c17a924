package com.showapp.show.application.archive;

import com.showapp.show.store.ShowStore;
import com.showapp.show.store.StoreCapability;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.TreeSet;

/**
 * For engines without DISTINCT on a derived column: pull one year per show
 * and deduplicate in memory.
 */
@Component
public class DeduplicatingYearListing implements YearListing {

    @Override
    public StoreCapability requiredCapability() {
        return null;
    }

    @Override
    public List<Integer> listYears(ShowStore store, Long excludedId) {
        return List.copyOf(new TreeSet<>(store.findShowtimeYears(excludedId)));
    }
}
