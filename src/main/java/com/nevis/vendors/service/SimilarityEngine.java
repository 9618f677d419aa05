package com.nevis.vendors.service;

import com.nevis.vendors.exception.DimensionMismatchException;
import com.nevis.vendors.exception.InvalidVectorException;
import com.nevis.vendors.model.EmbeddingRecord;
import com.nevis.vendors.model.SimilarityResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.stream.Stream;

/**
 * Exact top-k cosine ranking. Keeps a heap of at most k candidates, so a streamed corpus is ranked
 * in memory proportional to k. Results are ordered by score descending, equal scores by ascending id.
 * Records that cannot be compared with the query are skipped and logged.
 */
@Slf4j
@Component
public class SimilarityEngine {

    private record Candidate(String id, double score) {}

    private static final Comparator<Candidate> BEST_FIRST = Comparator
        .comparingDouble(Candidate::score).reversed()
        .thenComparing(Candidate::id);

    public List<SimilarityResult> rank(float[] query, Collection<EmbeddingRecord> corpus, int k) {
        return rank(query, corpus.stream(), k);
    }

    public List<SimilarityResult> rank(float[] query, Stream<EmbeddingRecord> corpus, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }
        if (query == null || query.length == 0) {
            throw new InvalidVectorException("Query vector cannot be empty");
        }
        if (!VectorMath.isFinite(query)) {
            throw new InvalidVectorException("Query vector contains non-finite values");
        }
        double queryNorm = VectorMath.norm(query);
        if (queryNorm == 0) {
            throw new InvalidVectorException("Query vector cannot be zero");
        }

        // head is the weakest kept candidate
        PriorityQueue<Candidate> heap = new PriorityQueue<>(k + 1, BEST_FIRST.reversed());
        int[] excluded = new int[1];

        corpus.forEach(record -> {
            Double score = score(query, queryNorm, record);
            if (score == null) {
                excluded[0]++;
                return;
            }
            Candidate candidate = new Candidate(record.id(), score);
            if (heap.size() < k) {
                heap.add(candidate);
            } else if (BEST_FIRST.compare(candidate, heap.peek()) < 0) {
                heap.poll();
                heap.add(candidate);
            }
        });

        if (excluded[0] > 0) {
            log.warn("Excluded {} record(s) from ranking", excluded[0]);
        }

        List<Candidate> top = new ArrayList<>(heap);
        top.sort(BEST_FIRST);

        List<SimilarityResult> results = new ArrayList<>(top.size());
        for (int i = 0; i < top.size(); i++) {
            results.add(new SimilarityResult(top.get(i).id(), top.get(i).score(), i + 1));
        }
        return results;
    }

    private Double score(float[] query, double queryNorm, EmbeddingRecord record) {
        float[] vector = record.vector();
        try {
            if (vector == null || vector.length != query.length) {
                throw new DimensionMismatchException(query.length, record.dimension());
            }
            if (!VectorMath.isFinite(vector)) {
                throw new InvalidVectorException("non-finite values");
            }
            double norm = VectorMath.norm(vector);
            if (norm == 0) {
                throw new InvalidVectorException("zero vector");
            }
            return VectorMath.cosine(query, queryNorm, vector, norm);
        } catch (DimensionMismatchException | InvalidVectorException e) {
            log.warn("Skipping record {}: {}", record.id(), e.getMessage());
            return null;
        }
    }
}
