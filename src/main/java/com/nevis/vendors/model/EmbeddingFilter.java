package com.nevis.vendors.model;

import java.util.Collection;
import java.util.Set;

public record EmbeddingFilter(String category, Set<String> ids) {

    public EmbeddingFilter {
        ids = ids == null ? Set.of() : Set.copyOf(ids);
    }

    public static EmbeddingFilter all() {
        return new EmbeddingFilter(null, Set.of());
    }

    public static EmbeddingFilter byCategory(String category) {
        return new EmbeddingFilter(category, Set.of());
    }

    public static EmbeddingFilter byIds(Collection<String> ids) {
        return new EmbeddingFilter(null, Set.copyOf(ids));
    }

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }
}
