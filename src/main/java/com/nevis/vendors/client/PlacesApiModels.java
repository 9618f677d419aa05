package com.nevis.vendors.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

final class PlacesApiModels {

    private PlacesApiModels() {
    }

    record SearchTextRequest(String textQuery, Integer pageSize) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchTextResponse(List<Place> places) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Place(
        String id,
        LocalizedText displayName,
        String formattedAddress,
        String primaryType,
        List<String> types,
        Double rating,
        Integer userRatingCount,
        String websiteUri,
        String nationalPhoneNumber,
        String googleMapsUri,
        List<Review> reviews,
        LocalizedText editorialSummary,
        GenerativeSummary generativeSummary
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LocalizedText(String text, String languageCode) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Review(LocalizedText text, Double rating) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerativeSummary(LocalizedText overview) {}

    static String text(LocalizedText value) {
        return value == null ? null : value.text();
    }
}
