package com.nevis.vendors.model;

import java.util.List;

public record CollectionSummary(
    int discovered,
    int stored,
    List<RunFailure> failures
) {}
