package com.nevis.vendors.client;

import com.nevis.vendors.model.PlaceDetail;
import com.nevis.vendors.model.PlaceSummary;

import java.util.List;

public interface PlaceSearchClient {

    List<PlaceSummary> search(String query, String location);

    PlaceDetail getDetails(String placeId);
}
