package com.nevis.vendors.model;

import java.util.List;

public record PlaceDetail(
    String placeId,
    String name,
    String primaryType,
    List<String> types,
    List<String> reviews,
    String summary
) {
    public PlaceDetail {
        types = types == null ? List.of() : List.copyOf(types);
        reviews = reviews == null ? List.of() : List.copyOf(reviews);
    }
}
