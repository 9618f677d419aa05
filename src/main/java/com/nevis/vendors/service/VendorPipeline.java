package com.nevis.vendors.service;

import com.nevis.vendors.config.PipelineProperties;
import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.infra.TaskResult;
import com.nevis.vendors.model.CategoryRanking;
import com.nevis.vendors.model.CollectionSummary;
import com.nevis.vendors.model.EmbeddingFilter;
import com.nevis.vendors.model.EmbeddingRecord;
import com.nevis.vendors.model.PipelineStage;
import com.nevis.vendors.model.PlaceDetail;
import com.nevis.vendors.model.PlaceSummary;
import com.nevis.vendors.model.PlanCommand;
import com.nevis.vendors.model.RunReport;
import com.nevis.vendors.model.SimilarityResult;
import com.nevis.vendors.repository.VendorEmbeddingRepository;
import com.nevis.vendors.service.PipelineState.SearchQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class VendorPipeline {

    private final QueryGenerationService queryGenerationService;
    private final PlaceSearchService placeSearchService;
    private final EmbeddingService embeddingService;
    private final VendorEmbeddingRepository repository;
    private final SimilarityEngine similarityEngine;
    private final PipelineProperties properties;

    public RunReport run(UUID runId, PlanCommand command, CancellationToken cancellation) {
        OffsetDateTime startedAt = OffsetDateTime.now();
        PipelineState state = new PipelineState();
        int topK = command.topK() != null ? command.topK() : properties.topK();

        log.info("Run {}: planning vendors for '{}' in {}", runId, command.eventDescription(), command.location());

        List<String> categories = resolveCategories(command, state, cancellation);
        generateQueries(command.eventDescription(), categories, state, cancellation);
        searchPlaces(command.location(), state, cancellation);
        fetchDetails(state, cancellation);
        embedVendors(state, cancellation);
        persist(state);

        if (cancellation.isCancelled()) {
            log.info("Run {}: cancelled, skipping ranking", runId);
        } else {
            rank(state, topK, cancellation);
        }

        log.info("Run {}: finished with {} vendors, {} rankings, {} failures",
            runId, state.vendors.size(), state.rankings.size(), state.failures.size());

        return new RunReport(
            runId,
            command.eventDescription(),
            command.location(),
            List.copyOf(state.rankings),
            List.copyOf(state.failures),
            cancellation.isCancelled(),
            startedAt,
            OffsetDateTime.now()
        );
    }

    /**
     * Search, enrich, embed and store vendors for fixed queries, without ranking.
     */
    public CollectionSummary collect(Map<String, List<String>> queriesByCategory, String location,
                                     CancellationToken cancellation) {
        PipelineState state = new PipelineState();
        queriesByCategory.forEach((category, queries) -> queries.forEach(query ->
            state.searches.put(category + ":" + query, new SearchQuery(normalize(category), query))));

        searchPlaces(location, state, cancellation);
        fetchDetails(state, cancellation);
        embedVendors(state, cancellation);
        persist(state);

        return new CollectionSummary(state.vendors.size(), state.stored.size(), List.copyOf(state.failures));
    }

    private List<String> resolveCategories(PlanCommand command, PipelineState state, CancellationToken cancellation) {
        if (!command.categories().isEmpty()) {
            return normalizeAll(command.categories());
        }

        TaskResult<List<String>> derived = queryGenerationService.deriveCategories(command.eventDescription(), cancellation);
        if (derived.isSuccess()) {
            return normalizeAll(derived.value());
        }

        state.fail(PipelineStage.CATEGORY_DERIVATION, null, derived);
        log.warn("Category derivation failed ({}), using defaults {}", derived.errorMessage(), properties.defaultCategories());
        return normalizeAll(properties.defaultCategories());
    }

    private void generateQueries(String eventDescription, List<String> categories, PipelineState state,
                                 CancellationToken cancellation) {
        log.info("Stage {}: {} categories", PipelineStage.QUERY_GENERATION, categories.size());
        Map<String, TaskResult<String>> queries =
            queryGenerationService.generateQueries(eventDescription, categories, cancellation);

        for (String category : categories) {
            TaskResult<String> result = queries.get(category);
            if (result != null && result.isSuccess()) {
                state.searches.put(category, new SearchQuery(category, result.value()));
                continue;
            }
            if (result != null) {
                state.fail(PipelineStage.QUERY_GENERATION, category, result);
            }
            if (!cancellation.isCancelled()) {
                // the bare category name still finds vendors
                state.searches.put(category, new SearchQuery(category, category));
            }
        }
    }

    private void searchPlaces(String location, PipelineState state, CancellationToken cancellation) {
        if (state.searches.isEmpty()) {
            return;
        }
        log.info("Stage {}: {} queries", PipelineStage.PLACE_SEARCH, state.searches.size());

        Map<String, String> queriesByKey = new LinkedHashMap<>();
        state.searches.forEach((key, search) -> queriesByKey.put(key, search.text()));

        Map<String, TaskResult<List<PlaceSummary>>> results =
            placeSearchService.searchBatch(queriesByKey, location, cancellation);

        results.forEach((key, result) -> {
            String category = state.searches.get(key).category();
            if (result.isSuccess()) {
                state.discover(category, result.value());
            } else {
                state.fail(PipelineStage.PLACE_SEARCH, category, result);
            }
        });
        log.info("Discovered {} distinct vendors", state.vendors.size());
    }

    private void fetchDetails(PipelineState state, CancellationToken cancellation) {
        if (!properties.fetchDetails() || state.vendors.isEmpty()) {
            return;
        }
        log.info("Stage {}: {} vendors", PipelineStage.PLACE_DETAILS, state.vendors.size());

        Map<String, TaskResult<PlaceDetail>> results =
            placeSearchService.detailsBatch(state.vendors.keySet(), cancellation);

        results.forEach((placeId, result) -> {
            if (result.isSuccess()) {
                state.vendors.get(placeId).attach(result.value());
            } else {
                state.fail(PipelineStage.PLACE_DETAILS, state.categoriesOf(placeId), result);
            }
        });
    }

    private void embedVendors(PipelineState state, CancellationToken cancellation) {
        if (state.vendors.isEmpty()) {
            return;
        }
        log.info("Stage {}: {} vendors", PipelineStage.EMBEDDING, state.vendors.size());

        Map<String, String> texts = new LinkedHashMap<>();
        state.vendors.forEach((id, vendor) -> texts.put(id, vendor.description()));

        embeddingService.embedBatch(texts, cancellation).forEach((placeId, result) -> {
            if (result.isSuccess()) {
                state.vectors.put(placeId, result.value());
            } else {
                state.fail(PipelineStage.EMBEDDING, state.categoriesOf(placeId), result);
            }
        });
    }

    private void persist(PipelineState state) {
        if (state.vectors.isEmpty()) {
            return;
        }
        log.info("Stage {}: {} records", PipelineStage.PERSISTENCE, state.vectors.size());

        state.vectors.forEach((placeId, vector) -> {
            DiscoveredVendor vendor = state.vendors.get(placeId);
            try {
                repository.upsert(new EmbeddingRecord(placeId, vector, vendor.categories(), vendor.metadata()));
                state.stored.add(placeId);
            } catch (RuntimeException e) {
                log.error("Failed to store vendor {}", placeId, e);
                state.fail(PipelineStage.PERSISTENCE, placeId, state.categoriesOf(placeId), e.getMessage());
            }
        });
    }

    private void rank(PipelineState state, int topK, CancellationToken cancellation) {
        Map<String, String> rankedQueries = new LinkedHashMap<>();
        state.searches.values().forEach(search -> rankedQueries.putIfAbsent(search.category(), search.text()));
        if (rankedQueries.isEmpty()) {
            return;
        }
        log.info("Stage {}: {} categories, top {}", PipelineStage.RANKING, rankedQueries.size(), topK);

        Map<String, TaskResult<float[]>> queryVectors = embeddingService.embedQueries(rankedQueries, cancellation);

        rankedQueries.forEach((category, query) -> {
            TaskResult<float[]> vector = queryVectors.get(category);
            if (vector == null || !vector.isSuccess()) {
                if (vector != null) {
                    state.fail(PipelineStage.RANKING, category, vector);
                }
                return;
            }
            try (Stream<EmbeddingRecord> corpus = repository.streamAll(EmbeddingFilter.byCategory(category))) {
                List<SimilarityResult> results = similarityEngine.rank(vector.value(), corpus, topK);
                state.rankings.add(new CategoryRanking(category, query, results));
            } catch (RuntimeException e) {
                log.error("Ranking failed for category {}", category, e);
                state.fail(PipelineStage.RANKING, category, category, e.getMessage());
            }
        });
    }

    private static List<String> normalizeAll(List<String> categories) {
        return categories.stream()
            .map(VendorPipeline::normalize)
            .filter(c -> !c.isEmpty())
            .distinct()
            .toList();
    }

    private static String normalize(String category) {
        return category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    }
}
