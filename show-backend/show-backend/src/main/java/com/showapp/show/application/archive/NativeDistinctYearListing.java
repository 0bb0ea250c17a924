package com.showapp.show.application.archive;

import com.showapp.show.store.ShowStore;
import com.showapp.show.store.StoreCapability;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class NativeDistinctYearListing implements YearListing {

    @Override
    public StoreCapability requiredCapability() {
        return StoreCapability.DISTINCT_YEARS;
    }

    @Override
    public List<Integer> listYears(ShowStore store, Long excludedId) {
        return List.copyOf(store.findDistinctShowtimeYears(excludedId));
    }
}
