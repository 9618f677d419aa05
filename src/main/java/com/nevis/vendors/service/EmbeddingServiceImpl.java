package com.nevis.vendors.service;

import com.nevis.vendors.exception.DimensionMismatchException;
import com.nevis.vendors.exception.InvalidVectorException;
import com.nevis.vendors.exception.PermanentServiceException;
import com.nevis.vendors.exception.WrongQueryException;
import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.infra.Dispatcher;
import com.nevis.vendors.infra.TaskResult;
import com.nevis.vendors.infra.WorkUnit;
import com.nevis.vendors.model.ServiceType;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class EmbeddingServiceImpl implements EmbeddingService {

    static final int MAX_QUERY_LENGTH = 1000;
    static final int MAX_DOCUMENT_LENGTH = 8000;

    private final Dispatcher dispatcher;
    private final EmbeddingModel embeddingModel;
    private final int dimensions;

    public EmbeddingServiceImpl(@Qualifier("embeddingDispatcher") Dispatcher dispatcher,
                                EmbeddingModel embeddingModel,
                                @Value("${app.embedding.dimensions:768}") int dimensions) {
        this.dispatcher = dispatcher;
        this.embeddingModel = embeddingModel;
        this.dimensions = dimensions;
    }

    @Override
    public Map<String, TaskResult<float[]>> embedBatch(Map<String, String> textsByKey, CancellationToken cancellation) {
        List<WorkUnit<float[]>> units = textsByKey.entrySet().stream()
            .map(entry -> dispatcher.unit(entry.getKey(), () -> embed(truncate(entry.getValue(), MAX_DOCUMENT_LENGTH))))
            .toList();

        return TaskResult.byKey(dispatcher.dispatch(units, cancellation));
    }

    @Override
    public Map<String, TaskResult<float[]>> embedQueries(Map<String, String> queriesByKey,
                                                         CancellationToken cancellation) {
        List<WorkUnit<float[]>> units = queriesByKey.entrySet().stream()
            .map(entry -> dispatcher.unit(entry.getKey(), () -> embed(cleanQuery(entry.getValue()))))
            .toList();

        return TaskResult.byKey(dispatcher.dispatch(units, cancellation));
    }

    @Override
    public float[] embedQuery(String inputQuery) {
        if (inputQuery == null || inputQuery.isBlank()) {
            throw new WrongQueryException("Search query cannot be empty");
        }

        return embedQueries(Map.of("query", inputQuery), CancellationToken.create())
            .get("query")
            .getOrThrow();
    }

    static String cleanQuery(String inputQuery) {
        if (inputQuery == null || inputQuery.isBlank()) {
            throw new WrongQueryException("Search query cannot be empty");
        }

        String query = inputQuery.trim().toLowerCase();
        if (query.length() > MAX_QUERY_LENGTH) {
            query = query.substring(0, MAX_QUERY_LENGTH);
            log.warn("Query was truncated for embedding: {}", query);
        }

        log.debug("Generating embedding for query: '{}'", query);
        return query;
    }

    private float[] embed(String text) {
        float[] vector = embeddingModel.embed(text).content().vector();
        if (vector == null || vector.length == 0) {
            throw new PermanentServiceException(ServiceType.EMBEDDING, "model returned an empty vector");
        }
        if (vector.length != dimensions) {
            throw new PermanentServiceException(ServiceType.EMBEDDING, "unexpected embedding size",
                new DimensionMismatchException(dimensions, vector.length));
        }
        try {
            return VectorMath.normalize(vector);
        } catch (InvalidVectorException e) {
            throw new PermanentServiceException(ServiceType.EMBEDDING, "unusable embedding: " + e.getMessage(), e);
        }
    }

    private static String truncate(String text, int maxLength) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            throw new PermanentServiceException(ServiceType.EMBEDDING, "nothing to embed");
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
