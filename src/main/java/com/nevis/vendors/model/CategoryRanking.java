package com.nevis.vendors.model;

import java.util.List;

public record CategoryRanking(
    String category,
    String query,
    List<SimilarityResult> results
) {}
