package com.nevis.vendors.service;

import com.nevis.vendors.client.PlaceSearchClient;
import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.infra.Dispatcher;
import com.nevis.vendors.infra.TaskResult;
import com.nevis.vendors.infra.WorkUnit;
import com.nevis.vendors.model.PlaceDetail;
import com.nevis.vendors.model.PlaceSummary;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;

@Service
public class PlaceSearchServiceImpl implements PlaceSearchService {

    private final Dispatcher searchDispatcher;
    private final Dispatcher detailsDispatcher;
    private final PlaceSearchClient client;

    public PlaceSearchServiceImpl(@Qualifier("placeSearchDispatcher") Dispatcher searchDispatcher,
                                  @Qualifier("placeDetailsDispatcher") Dispatcher detailsDispatcher,
                                  PlaceSearchClient client) {
        this.searchDispatcher = searchDispatcher;
        this.detailsDispatcher = detailsDispatcher;
        this.client = client;
    }

    @Override
    public Map<String, TaskResult<List<PlaceSummary>>> searchBatch(Map<String, String> queriesByKey, String location,
                                                                   CancellationToken cancellation) {
        List<WorkUnit<List<PlaceSummary>>> units = queriesByKey.entrySet().stream()
            .map(entry -> searchDispatcher.unit(entry.getKey(), () -> client.search(entry.getValue(), location)))
            .toList();

        return TaskResult.byKey(searchDispatcher.dispatch(units, cancellation));
    }

    @Override
    public Map<String, TaskResult<PlaceDetail>> detailsBatch(Collection<String> placeIds,
                                                             CancellationToken cancellation) {
        List<WorkUnit<PlaceDetail>> units = placeIds.stream()
            .distinct()
            .map(placeId -> detailsDispatcher.unit(placeId, () -> client.getDetails(placeId)))
            .toList();

        return TaskResult.byKey(detailsDispatcher.dispatch(units, cancellation));
    }
}
