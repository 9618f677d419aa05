package com.nevis.vendors.model;

public enum PipelineStage {
    CATEGORY_DERIVATION,
    QUERY_GENERATION,
    PLACE_SEARCH,
    PLACE_DETAILS,
    EMBEDDING,
    PERSISTENCE,
    RANKING
}
