package com.nevis.vendors.model;

public record RunFailure(
    PipelineStage stage,
    String key,
    String category,
    String reason,
    int attempts
) {}
