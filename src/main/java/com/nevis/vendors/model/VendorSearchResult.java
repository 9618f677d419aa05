package com.nevis.vendors.model;

import java.util.List;

public record VendorSearchResult(
    String query,
    String searchQuery,
    List<VendorMatch> matches
) {}
