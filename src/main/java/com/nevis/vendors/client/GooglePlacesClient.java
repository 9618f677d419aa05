package com.nevis.vendors.client;

import com.nevis.vendors.client.PlacesApiModels.Place;
import com.nevis.vendors.client.PlacesApiModels.Review;
import com.nevis.vendors.client.PlacesApiModels.SearchTextRequest;
import com.nevis.vendors.client.PlacesApiModels.SearchTextResponse;
import com.nevis.vendors.config.PlacesProperties;
import com.nevis.vendors.model.PlaceDetail;
import com.nevis.vendors.model.PlaceSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Objects;

@Slf4j
@Component
public class GooglePlacesClient implements PlaceSearchClient {

    static final String FIELD_MASK_HEADER = "X-Goog-FieldMask";

    static final String SEARCH_FIELD_MASK = String.join(",",
        "places.id",
        "places.displayName",
        "places.formattedAddress",
        "places.primaryType",
        "places.types",
        "places.rating",
        "places.userRatingCount",
        "places.websiteUri",
        "places.nationalPhoneNumber",
        "places.googleMapsUri");

    static final String DETAILS_FIELD_MASK = "id,displayName,primaryType,types,reviews,editorialSummary,generativeSummary";

    private final RestClient restClient;
    private final int pageSize;

    public GooglePlacesClient(@Qualifier("placesRestClient") RestClient restClient, PlacesProperties properties) {
        this.restClient = restClient;
        this.pageSize = properties.maxResultsPerQuery();
    }

    @Override
    public List<PlaceSummary> search(String query, String location) {
        String textQuery = location == null || location.isBlank() ? query : query + " in " + location;
        log.debug("Searching places for '{}'", textQuery);

        SearchTextResponse response = restClient.post()
            .uri("/v1/places:searchText")
            .contentType(MediaType.APPLICATION_JSON)
            .header(FIELD_MASK_HEADER, SEARCH_FIELD_MASK)
            .body(new SearchTextRequest(textQuery, pageSize))
            .retrieve()
            .body(SearchTextResponse.class);

        if (response == null || response.places() == null) {
            return List.of();
        }

        return response.places().stream()
            .filter(place -> place.id() != null)
            .map(GooglePlacesClient::toSummary)
            .toList();
    }

    @Override
    public PlaceDetail getDetails(String placeId) {
        Place place = restClient.get()
            .uri("/v1/places/{placeId}", placeId)
            .header(FIELD_MASK_HEADER, DETAILS_FIELD_MASK)
            .retrieve()
            .body(Place.class);

        if (place == null) {
            throw new IllegalStateException("Empty details response for place " + placeId);
        }

        List<String> reviews = place.reviews() == null ? List.of() : place.reviews().stream()
            .map(Review::text)
            .map(PlacesApiModels::text)
            .filter(Objects::nonNull)
            .filter(text -> !text.isBlank())
            .toList();

        String summary = place.generativeSummary() != null
            ? PlacesApiModels.text(place.generativeSummary().overview())
            : null;
        if (summary == null) {
            summary = PlacesApiModels.text(place.editorialSummary());
        }

        return new PlaceDetail(
            place.id() != null ? place.id() : placeId,
            PlacesApiModels.text(place.displayName()),
            place.primaryType(),
            place.types(),
            reviews,
            summary
        );
    }

    private static PlaceSummary toSummary(Place place) {
        return new PlaceSummary(
            place.id(),
            PlacesApiModels.text(place.displayName()),
            place.formattedAddress(),
            place.primaryType(),
            place.types(),
            place.rating(),
            place.userRatingCount(),
            place.websiteUri(),
            place.nationalPhoneNumber(),
            place.googleMapsUri()
        );
    }
}
