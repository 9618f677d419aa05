package com.nevis.vendors.service;

import com.nevis.vendors.exception.ExternalServiceException;
import com.nevis.vendors.exception.WrongQueryException;
import com.nevis.vendors.model.EmbeddingFilter;
import com.nevis.vendors.model.EmbeddingRecord;
import com.nevis.vendors.model.SimilarityResult;
import com.nevis.vendors.model.VendorMatch;
import com.nevis.vendors.model.VendorSearchResult;
import com.nevis.vendors.repository.VendorEmbeddingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class VendorSearchServiceImpl implements VendorSearchService {

    private final QueryGenerationService queryGenerationService;
    private final EmbeddingService embeddingService;
    private final VendorEmbeddingRepository repository;
    private final SimilarityEngine similarityEngine;

    @Override
    public VendorSearchResult search(String eventDescription, String category, int limit, boolean optimize) {
        if (eventDescription == null || eventDescription.isBlank()) {
            throw new WrongQueryException("Search query cannot be empty");
        }
        if (limit < 1) {
            throw new WrongQueryException("Limit must be positive");
        }

        String searchQuery = optimize ? optimizedOrRaw(eventDescription) : eventDescription.trim();
        float[] queryVector = embeddingService.embedQuery(searchQuery);

        EmbeddingFilter filter = category == null || category.isBlank()
            ? EmbeddingFilter.all()
            : EmbeddingFilter.byCategory(category.trim().toLowerCase(Locale.ROOT));

        List<SimilarityResult> ranked;
        try (Stream<EmbeddingRecord> corpus = repository.streamAll(filter)) {
            ranked = similarityEngine.rank(queryVector, corpus, limit);
        }

        if (ranked.isEmpty()) {
            return new VendorSearchResult(eventDescription, searchQuery, List.of());
        }

        Map<String, EmbeddingRecord> records = repository
            .fetchAll(EmbeddingFilter.byIds(ranked.stream().map(SimilarityResult::id).toList()))
            .stream()
            .collect(Collectors.toMap(EmbeddingRecord::id, Function.identity()));

        List<VendorMatch> matches = ranked.stream()
            .map(result -> {
                EmbeddingRecord record = records.get(result.id());
                return new VendorMatch(
                    result.id(),
                    result.score(),
                    result.rank(),
                    record == null ? List.of() : record.categories(),
                    record == null ? Map.of() : record.metadata()
                );
            })
            .toList();

        return new VendorSearchResult(eventDescription, searchQuery, matches);
    }

    private String optimizedOrRaw(String eventDescription) {
        try {
            return queryGenerationService.optimizeQuery(eventDescription);
        } catch (ExternalServiceException e) {
            log.warn("Query optimization failed, searching with the raw description: {}", e.getMessage());
            return eventDescription.trim();
        }
    }
}
