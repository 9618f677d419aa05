package com.nevis.vendors.model;

import java.util.List;
import java.util.Map;

public record VendorMatch(
    String id,
    double score,
    int rank,
    List<String> categories,
    Map<String, Object> metadata
) {}
