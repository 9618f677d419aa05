package com.nevis.vendors.service;

import com.nevis.vendors.config.PipelineProperties;
import com.nevis.vendors.exception.PermanentServiceException;
import com.nevis.vendors.exception.RunCancelledException;
import com.nevis.vendors.exception.TransientServiceException;
import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.infra.TaskResult;
import com.nevis.vendors.model.CategoryRanking;
import com.nevis.vendors.model.CollectionSummary;
import com.nevis.vendors.model.EmbeddingRecord;
import com.nevis.vendors.model.PipelineStage;
import com.nevis.vendors.model.PlaceDetail;
import com.nevis.vendors.model.PlaceSummary;
import com.nevis.vendors.model.PlanCommand;
import com.nevis.vendors.model.RunFailure;
import com.nevis.vendors.model.RunReport;
import com.nevis.vendors.model.ServiceType;
import com.nevis.vendors.model.SimilarityResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VendorPipelineTest {

    private static final String DESCRIPTION = "Garden wedding for 80 guests";
    private static final String LOCATION = "Tel Aviv";

    private static final Map<String, float[]> VECTORS = Map.of(
        "p1", new float[]{1f, 0f},
        "p2", new float[]{0.8f, 0.6f},
        "p3", new float[]{0f, 1f},
        "catering", new float[]{1f, 0f},
        "florist", new float[]{0f, 1f},
        "decorations", new float[]{0.6f, 0.8f}
    );

    @Mock
    private QueryGenerationService queryGenerationService;

    @Mock
    private PlaceSearchService placeSearchService;

    @Mock
    private EmbeddingService embeddingService;

    private InMemoryVendorEmbeddingRepository repository;
    private VendorPipeline pipeline;
    private final List<Map<String, String>> embeddedTexts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        repository = new InMemoryVendorEmbeddingRepository();
        PipelineProperties properties = new PipelineProperties(
            10, 5, List.of("Decorations"), true, Duration.ofMinutes(5));
        pipeline = new VendorPipeline(queryGenerationService, placeSearchService, embeddingService,
            repository, new SimilarityEngine(), properties);
    }

    private void stubVendorEmbeddings(Set<String> failingIds) {
        when(embeddingService.embedBatch(anyMap(), any())).thenAnswer(invocation -> {
            Map<String, String> texts = invocation.getArgument(0);
            embeddedTexts.add(Map.copyOf(texts));
            return vectorsFor(texts.keySet(), failingIds);
        });
    }

    private void stubQueryEmbeddings(Set<String> failingKeys) {
        when(embeddingService.embedQueries(anyMap(), any())).thenAnswer(invocation -> {
            Map<String, String> queries = invocation.getArgument(0);
            return vectorsFor(queries.keySet(), failingKeys);
        });
    }

    private static Map<String, TaskResult<float[]>> vectorsFor(Collection<String> keys, Set<String> failingKeys) {
        Map<String, TaskResult<float[]>> results = new LinkedHashMap<>();
        keys.forEach(key -> results.put(key, failingKeys.contains(key)
            ? TaskResult.failure(key, new PermanentServiceException(ServiceType.EMBEDDING, "content rejected"), 1)
            : TaskResult.success(key, VECTORS.get(key), 1)));
        return results;
    }

    private void stubQueries(String... categories) {
        Map<String, TaskResult<String>> queries = new LinkedHashMap<>();
        for (String category : categories) {
            queries.put(category, TaskResult.success(category, category + " near me", 1));
        }
        when(queryGenerationService.generateQueries(eq(DESCRIPTION), eq(List.of(categories)), any()))
            .thenReturn(queries);
    }

    private void stubDetails() {
        when(placeSearchService.detailsBatch(anyCollection(), any())).thenAnswer(invocation -> {
            Collection<String> ids = invocation.getArgument(0);
            Map<String, TaskResult<PlaceDetail>> results = new LinkedHashMap<>();
            ids.forEach(id -> results.put(id, TaskResult.success(id, detail(id, "Vendor " + id), 1)));
            return results;
        });
    }

    private RunReport run(String... categories) {
        return pipeline.run(UUID.randomUUID(),
            new PlanCommand(DESCRIPTION, LOCATION, List.of(categories), 5),
            CancellationToken.create());
    }

    private static PlaceSummary place(String id, String name) {
        return new PlaceSummary(id, name, "1 Main St", "florist", List.of("florist", "store"),
            4.5, 120, null, null, null);
    }

    private static PlaceDetail detail(String id, String name) {
        return new PlaceDetail(id, name, "florist", List.of("florist"), List.of("Lovely bouquets"), name + " arranges flowers");
    }

    private List<String> storedIds() {
        return List.copyOf(repository.records.keySet());
    }

    @Test
    @DisplayName("Runs every stage, merges shared vendors and ranks each category")
    void shouldProduceRankingsForEveryCategory() {
        Map<String, TaskResult<String>> queries = new LinkedHashMap<>();
        queries.put("catering", TaskResult.success("catering", "kosher catering", 1));
        queries.put("florist", TaskResult.failure("florist",
            new PermanentServiceException(ServiceType.QUERY_GENERATION, "blocked"), 1));
        when(queryGenerationService.generateQueries(eq(DESCRIPTION), eq(List.of("catering", "florist")), any()))
            .thenReturn(queries);

        Map<String, TaskResult<List<PlaceSummary>>> places = new LinkedHashMap<>();
        places.put("catering", TaskResult.success("catering", List.of(place("p1", "Chef Ori"), place("p2", "Bloom & Bite")), 1));
        places.put("florist", TaskResult.success("florist", List.of(place("p2", "Bloom & Bite"), place("p3", "Petal")), 1));
        when(placeSearchService.searchBatch(anyMap(), eq(LOCATION), any())).thenReturn(places);

        Map<String, TaskResult<PlaceDetail>> details = new LinkedHashMap<>();
        details.put("p1", TaskResult.success("p1", detail("p1", "Chef Ori"), 1));
        details.put("p2", TaskResult.success("p2", detail("p2", "Bloom & Bite"), 1));
        details.put("p3", TaskResult.failure("p3", new TransientServiceException(ServiceType.PLACE_DETAILS, "503"), 3));
        when(placeSearchService.detailsBatch(anyCollection(), any())).thenReturn(details);

        stubVendorEmbeddings(Set.of());
        stubQueryEmbeddings(Set.of());

        UUID runId = UUID.randomUUID();
        RunReport report = pipeline.run(runId,
            new PlanCommand(DESCRIPTION, LOCATION, List.of(" Catering", "florist", "catering"), 5),
            CancellationToken.create());

        assertThat(report.runId()).isEqualTo(runId);
        assertThat(report.cancelled()).isFalse();
        assertThat(report.rankings()).extracting(CategoryRanking::category).containsExactly("catering", "florist");

        CategoryRanking catering = report.rankings().get(0);
        assertThat(catering.query()).isEqualTo("kosher catering");
        assertThat(catering.results()).extracting(SimilarityResult::id).containsExactly("p1", "p2");

        CategoryRanking florist = report.rankings().get(1);
        assertThat(florist.query()).isEqualTo("florist");
        assertThat(florist.results()).extracting(SimilarityResult::id).containsExactly("p3", "p2");

        assertThat(report.failures())
            .extracting(RunFailure::stage, RunFailure::key, RunFailure::category)
            .containsExactlyInAnyOrder(
                tuple(PipelineStage.QUERY_GENERATION, "florist", "florist"),
                tuple(PipelineStage.PLACE_DETAILS, "p3", "florist"));
        assertThat(report.failures()).filteredOn(f -> f.stage() == PipelineStage.PLACE_DETAILS)
            .extracting(RunFailure::attempts).containsExactly(3);

        assertThat(repository.records.get("p2").categories()).containsExactly("catering", "florist");
        assertThat(storedIds()).containsExactly("p1", "p2", "p3");
        assertThat(repository.openStreams.get()).isZero();

        assertThat(embeddedTexts.get(0).get("p1")).contains("Chef Ori arranges flowers", "Review: Lovely bouquets");
        assertThat(embeddedTexts.get(0).get("p3")).contains("Petal").doesNotContain("Review:");
    }

    @Test
    @DisplayName("Ranking embeds the category queries through the query path, not the document path")
    void shouldEmbedRankingQueriesAsQueries() {
        stubQueries("catering");
        when(placeSearchService.searchBatch(anyMap(), eq(LOCATION), any()))
            .thenReturn(Map.of("catering", TaskResult.success("catering", List.of(place("p1", "Chef Ori")), 1)));
        stubDetails();
        stubVendorEmbeddings(Set.of());
        stubQueryEmbeddings(Set.of());

        run("catering");

        verify(embeddingService).embedQueries(eq(Map.of("catering", "catering near me")), any());
        verify(embeddingService, times(1)).embedBatch(anyMap(), any());
        assertThat(embeddedTexts).singleElement().satisfies(texts -> assertThat(texts).containsOnlyKeys("p1"));
    }

    @Test
    @DisplayName("A failed place search is recorded against its category and the rest is still ranked")
    void shouldRecordFailedPlaceSearch() {
        stubQueries("catering", "florist");
        Map<String, TaskResult<List<PlaceSummary>>> places = new LinkedHashMap<>();
        places.put("catering", TaskResult.success("catering", List.of(place("p1", "Chef Ori")), 1));
        places.put("florist", TaskResult.failure("florist",
            new TransientServiceException(ServiceType.PLACE_SEARCH, "timed out"), 3));
        when(placeSearchService.searchBatch(anyMap(), eq(LOCATION), any())).thenReturn(places);
        stubDetails();
        stubVendorEmbeddings(Set.of());
        stubQueryEmbeddings(Set.of());

        RunReport report = run("catering", "florist");

        assertThat(report.failures())
            .extracting(RunFailure::stage, RunFailure::key, RunFailure::category, RunFailure::attempts)
            .containsExactly(tuple(PipelineStage.PLACE_SEARCH, "florist", "florist", 3));
        assertThat(report.rankings()).extracting(CategoryRanking::category).containsExactly("catering", "florist");
        assertThat(report.rankings().get(0).results()).extracting(SimilarityResult::id).containsExactly("p1");
        assertThat(report.rankings().get(1).results()).isEmpty();
    }

    @Test
    @DisplayName("A vendor whose embedding fails is recorded and never stored")
    void shouldNotStoreVendorWithFailedEmbedding() {
        stubQueries("catering");
        when(placeSearchService.searchBatch(anyMap(), eq(LOCATION), any()))
            .thenReturn(Map.of("catering", TaskResult.success("catering",
                List.of(place("p1", "Chef Ori"), place("p2", "Bloom & Bite")), 1)));
        stubDetails();
        stubVendorEmbeddings(Set.of("p2"));
        stubQueryEmbeddings(Set.of());

        RunReport report = run("catering");

        assertThat(report.failures())
            .extracting(RunFailure::stage, RunFailure::key, RunFailure::category)
            .containsExactly(tuple(PipelineStage.EMBEDDING, "p2", "catering"));
        assertThat(storedIds()).containsExactly("p1");
        assertThat(report.rankings()).singleElement()
            .satisfies(ranking -> assertThat(ranking.results()).extracting(SimilarityResult::id).containsExactly("p1"));
    }

    @Test
    @DisplayName("A store failure for one vendor is recorded and the others are kept and ranked")
    void shouldRecordPersistenceFailure() {
        repository.rejectedIds.add("p2");
        stubQueries("catering");
        when(placeSearchService.searchBatch(anyMap(), eq(LOCATION), any()))
            .thenReturn(Map.of("catering", TaskResult.success("catering",
                List.of(place("p1", "Chef Ori"), place("p2", "Bloom & Bite")), 1)));
        stubDetails();
        stubVendorEmbeddings(Set.of());
        stubQueryEmbeddings(Set.of());

        RunReport report = run("catering");

        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.stage()).isEqualTo(PipelineStage.PERSISTENCE);
            assertThat(failure.key()).isEqualTo("p2");
            assertThat(failure.category()).isEqualTo("catering");
            assertThat(failure.reason()).contains("cannot serialize metadata");
        });
        assertThat(storedIds()).containsExactly("p1");
        assertThat(report.rankings()).singleElement()
            .satisfies(ranking -> assertThat(ranking.results()).extracting(SimilarityResult::id).containsExactly("p1"));
    }

    @Test
    @DisplayName("A failed query embedding drops only that category's ranking")
    void shouldRecordFailedQueryEmbedding() {
        stubQueries("catering", "florist");
        Map<String, TaskResult<List<PlaceSummary>>> places = new LinkedHashMap<>();
        places.put("catering", TaskResult.success("catering", List.of(place("p1", "Chef Ori")), 1));
        places.put("florist", TaskResult.success("florist", List.of(place("p3", "Petal")), 1));
        when(placeSearchService.searchBatch(anyMap(), eq(LOCATION), any())).thenReturn(places);
        stubDetails();
        stubVendorEmbeddings(Set.of());
        stubQueryEmbeddings(Set.of("florist"));

        RunReport report = run("catering", "florist");

        assertThat(report.failures())
            .extracting(RunFailure::stage, RunFailure::key, RunFailure::category)
            .containsExactly(tuple(PipelineStage.RANKING, "florist", "florist"));
        assertThat(report.rankings()).singleElement()
            .satisfies(ranking -> {
                assertThat(ranking.category()).isEqualTo("catering");
                assertThat(ranking.results()).extracting(SimilarityResult::id).containsExactly("p1");
            });
        assertThat(storedIds()).containsExactly("p1", "p3");
    }

    @Test
    @DisplayName("Falls back to default categories when derivation fails")
    void shouldUseDefaultCategoriesWhenDerivationFails() {
        when(queryGenerationService.deriveCategories(eq(DESCRIPTION), any()))
            .thenReturn(TaskResult.failure("categories",
                new TransientServiceException(ServiceType.QUERY_GENERATION, "overloaded"), 3));
        when(queryGenerationService.generateQueries(eq(DESCRIPTION), eq(List.of("decorations")), any()))
            .thenReturn(Map.of("decorations", TaskResult.success("decorations", "garden wedding decor", 1)));
        when(placeSearchService.searchBatch(anyMap(), eq(LOCATION), any()))
            .thenReturn(Map.of("decorations", TaskResult.success("decorations", List.of(), 1)));
        stubQueryEmbeddings(Set.of());

        RunReport report = pipeline.run(UUID.randomUUID(), new PlanCommand(DESCRIPTION, LOCATION, null, null),
            CancellationToken.create());

        assertThat(report.failures()).singleElement()
            .satisfies(failure -> {
                assertThat(failure.stage()).isEqualTo(PipelineStage.CATEGORY_DERIVATION);
                assertThat(failure.attempts()).isEqualTo(3);
            });
        assertThat(report.rankings()).singleElement()
            .satisfies(ranking -> {
                assertThat(ranking.category()).isEqualTo("decorations");
                assertThat(ranking.results()).isEmpty();
            });
        verify(placeSearchService, never()).detailsBatch(anyCollection(), any());
        verify(embeddingService, never()).embedBatch(anyMap(), any());
    }

    @Test
    @DisplayName("A cancelled run skips the remaining stages and is reported as cancelled")
    void shouldStopWhenCancelled() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        when(queryGenerationService.generateQueries(anyString(), any(), eq(token)))
            .thenReturn(Map.of("catering", TaskResult.failure("catering", new RunCancelledException("catering"), 0)));

        RunReport report = pipeline.run(UUID.randomUUID(),
            new PlanCommand(DESCRIPTION, LOCATION, List.of("catering"), 3), token);

        assertThat(report.cancelled()).isTrue();
        assertThat(report.rankings()).isEmpty();
        assertThat(report.failures()).extracting(RunFailure::stage).containsExactly(PipelineStage.QUERY_GENERATION);
        verify(placeSearchService, never()).searchBatch(anyMap(), anyString(), any());
        verifyNoInteractions(embeddingService);
    }

    @Test
    @DisplayName("Collection stores vendors for fixed queries without ranking")
    void shouldCollectWithoutRanking() {
        when(placeSearchService.searchBatch(anyMap(), eq(LOCATION), any())).thenAnswer(invocation -> {
            Map<String, String> searches = invocation.getArgument(0);
            Map<String, TaskResult<List<PlaceSummary>>> results = new LinkedHashMap<>();
            searches.keySet().forEach(key ->
                results.put(key, TaskResult.success(key, List.of(place("p1", "Balloon Bar"), place("p3", "Party Box")), 1)));
            return results;
        });
        stubDetails();
        stubVendorEmbeddings(Set.of());

        CollectionSummary summary = pipeline.collect(
            Map.of("Decorations", List.of("balloon decorations", "party decorations")),
            LOCATION,
            CancellationToken.create());

        assertThat(summary.discovered()).isEqualTo(2);
        assertThat(summary.stored()).isEqualTo(2);
        assertThat(summary.failures()).isEmpty();
        EmbeddingRecord stored = repository.records.get("p1");
        assertThat(stored.categories()).containsExactly("decorations");
        verify(embeddingService, times(1)).embedBatch(anyMap(), any());
        verify(embeddingService, never()).embedQueries(anyMap(), any());
        verifyNoInteractions(queryGenerationService);
    }
}
