package com.nevis.vendors.model;

public record SimilarityResult(String id, double score, int rank) {}
