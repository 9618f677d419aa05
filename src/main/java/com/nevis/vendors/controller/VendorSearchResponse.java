package com.nevis.vendors.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.vendors.model.VendorMatch;
import com.nevis.vendors.model.VendorSearchResult;

import java.util.List;

public record VendorSearchResponse(
    String query,
    @JsonProperty("search_query") String searchQuery,
    List<VendorMatch> matches
) {
    public static VendorSearchResponse from(VendorSearchResult result) {
        return new VendorSearchResponse(result.query(), result.searchQuery(), result.matches());
    }
}
