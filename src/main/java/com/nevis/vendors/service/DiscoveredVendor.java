package com.nevis.vendors.service;

import com.nevis.vendors.model.PlaceDetail;
import com.nevis.vendors.model.PlaceSummary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class DiscoveredVendor {

    private static final int MAX_REVIEWS_IN_DESCRIPTION = 5;

    private final PlaceSummary summary;
    private final Set<String> categories = new LinkedHashSet<>();
    private PlaceDetail detail;

    DiscoveredVendor(PlaceSummary summary) {
        this.summary = summary;
    }

    String id() {
        return summary.placeId();
    }

    void addCategory(String category) {
        categories.add(category);
    }

    List<String> categories() {
        return List.copyOf(categories);
    }

    void attach(PlaceDetail detail) {
        this.detail = detail;
    }

    /**
     * Text that represents the vendor in embedding space. Falls back to the search summary when details are missing.
     */
    String description() {
        List<String> parts = new ArrayList<>();
        parts.add(summary.name());
        String primaryType = detail != null && detail.primaryType() != null ? detail.primaryType() : summary.primaryType();
        if (primaryType != null) {
            parts.add("Type: " + primaryType.replace('_', ' '));
        }
        List<String> types = detail != null && !detail.types().isEmpty() ? detail.types() : summary.types();
        if (!types.isEmpty()) {
            parts.add("Services: " + String.join(", ", types).replace('_', ' '));
        }
        parts.add("Categories: " + String.join(", ", categories));
        if (detail != null) {
            if (detail.summary() != null && !detail.summary().isBlank()) {
                parts.add(detail.summary());
            }
            detail.reviews().stream()
                .limit(MAX_REVIEWS_IN_DESCRIPTION)
                .forEach(review -> parts.add("Review: " + review));
        }
        return String.join("\n", parts.stream().filter(p -> p != null && !p.isBlank()).toList());
    }

    Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        put(metadata, "name", summary.name());
        put(metadata, "address", summary.formattedAddress());
        put(metadata, "primary_type", summary.primaryType());
        put(metadata, "rating", summary.rating());
        put(metadata, "user_rating_count", summary.userRatingCount());
        put(metadata, "website", summary.websiteUri());
        put(metadata, "phone", summary.phoneNumber());
        put(metadata, "maps_url", summary.googleMapsUri());
        if (detail != null) {
            put(metadata, "summary", detail.summary());
        }
        return metadata;
    }

    private static void put(Map<String, Object> metadata, String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
