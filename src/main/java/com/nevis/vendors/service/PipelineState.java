package com.nevis.vendors.service;

import com.nevis.vendors.infra.TaskResult;
import com.nevis.vendors.model.CategoryRanking;
import com.nevis.vendors.model.PipelineStage;
import com.nevis.vendors.model.PlaceSummary;
import com.nevis.vendors.model.RunFailure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// only the pipeline thread touches this, between batches
final class PipelineState {

    record SearchQuery(String category, String text) {}

    final Map<String, SearchQuery> searches = new LinkedHashMap<>();
    final Map<String, DiscoveredVendor> vendors = new LinkedHashMap<>();
    final Map<String, float[]> vectors = new LinkedHashMap<>();
    final List<String> stored = new ArrayList<>();
    final List<CategoryRanking> rankings = new ArrayList<>();
    final List<RunFailure> failures = new ArrayList<>();

    void discover(String category, List<PlaceSummary> places) {
        for (PlaceSummary place : places) {
            vendors.computeIfAbsent(place.placeId(), id -> new DiscoveredVendor(place))
                .addCategory(category);
        }
    }

    void fail(PipelineStage stage, String category, TaskResult<?> result) {
        failures.add(new RunFailure(stage, result.key(), category, result.errorMessage(), result.attempts()));
    }

    void fail(PipelineStage stage, String key, String category, String reason) {
        failures.add(new RunFailure(stage, key, category, reason, 0));
    }

    String categoriesOf(String vendorId) {
        DiscoveredVendor vendor = vendors.get(vendorId);
        return vendor == null ? null : String.join(",", vendor.categories());
    }
}
