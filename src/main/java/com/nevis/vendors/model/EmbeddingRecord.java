package com.nevis.vendors.model;

import java.util.List;
import java.util.Map;

public record EmbeddingRecord(
    String id,
    float[] vector,
    List<String> categories,
    Map<String, Object> metadata
) {
    public EmbeddingRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Embedding record id cannot be blank");
        }
        categories = categories == null ? List.of() : List.copyOf(categories);
        metadata = metadata == null ? Map.of() : metadata;
    }

    public int dimension() {
        return vector == null ? 0 : vector.length;
    }
}
