package com.nevis.vendors.service;

import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.infra.TaskResult;
import com.nevis.vendors.model.PlaceDetail;
import com.nevis.vendors.model.PlaceSummary;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface PlaceSearchService {

    Map<String, TaskResult<List<PlaceSummary>>> searchBatch(Map<String, String> queriesByKey, String location,
                                                            CancellationToken cancellation);

    Map<String, TaskResult<PlaceDetail>> detailsBatch(Collection<String> placeIds, CancellationToken cancellation);
}
