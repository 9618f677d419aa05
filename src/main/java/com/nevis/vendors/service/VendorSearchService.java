package com.nevis.vendors.service;

import com.nevis.vendors.model.VendorSearchResult;

public interface VendorSearchService {

    /**
     * Ranks stored vendors against an event description.
     *
     * @param category restricts the corpus when not null
     * @param optimize rewrite the description into a search query before embedding it
     */
    VendorSearchResult search(String eventDescription, String category, int limit, boolean optimize);
}
