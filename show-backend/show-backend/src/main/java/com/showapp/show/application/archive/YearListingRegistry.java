package com.showapp.show.application.archive;

import com.showapp.show.store.ShowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class YearListingRegistry {

    private final List<YearListing> listings;

    public YearListingRegistry(List<YearListing> listings) {
        this.listings = listings;
    }

    /**
     * Picks the listing for a store: one that relies on a capability the store
     * has is preferred over one that needs no capability.
     */
    public YearListing resolve(ShowStore store) {
        // First: a listing backed by a capability this store advertises
        for (YearListing listing : listings) {
            if (listing.requiredCapability() != null && store.supports(listing.requiredCapability())) {
                log.debug("Using {} for year listing", listing.getClass().getSimpleName());
                return listing;
            }
        }

        // Second: a listing that works on any store
        for (YearListing listing : listings) {
            if (listing.requiredCapability() == null) {
                log.debug("Using {} for year listing", listing.getClass().getSimpleName());
                return listing;
            }
        }

        throw new IllegalStateException("No year listing registered for store capabilities " + store.capabilities());
    }
}
