package com.nevis.vendors.model;

import java.util.List;

public record PlaceSummary(
    String placeId,
    String name,
    String formattedAddress,
    String primaryType,
    List<String> types,
    Double rating,
    Integer userRatingCount,
    String websiteUri,
    String phoneNumber,
    String googleMapsUri
) {
    public PlaceSummary {
        types = types == null ? List.of() : List.copyOf(types);
    }
}
