package com.nevis.vendors.service;

import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.infra.TaskResult;

import java.util.Map;

public interface EmbeddingService {

    /**
     * Embeds every text, keyed like the input. Vectors are unit length.
     */
    Map<String, TaskResult<float[]>> embedBatch(Map<String, String> textsByKey, CancellationToken cancellation);

    /**
     * Embeds search queries with the same cleanup as {@link #embedQuery(String)}.
     */
    Map<String, TaskResult<float[]>> embedQueries(Map<String, String> queriesByKey, CancellationToken cancellation);

    float[] embedQuery(String query);
}
