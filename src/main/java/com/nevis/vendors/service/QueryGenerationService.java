package com.nevis.vendors.service;

import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.infra.TaskResult;

import java.util.List;
import java.util.Map;

public interface QueryGenerationService {

    /**
     * Asks the model which vendor categories the described event needs.
     */
    TaskResult<List<String>> deriveCategories(String eventDescription, CancellationToken cancellation);

    /**
     * One place-search query per category, keyed by category.
     */
    Map<String, TaskResult<String>> generateQueries(String eventDescription, List<String> categories,
                                                   CancellationToken cancellation);

    /**
     * Rewrites an event description into a query suited to similarity search over stored vendors.
     */
    String optimizeQuery(String eventDescription);
}
