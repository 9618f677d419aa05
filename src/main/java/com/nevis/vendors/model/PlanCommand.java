package com.nevis.vendors.model;

import java.util.List;

public record PlanCommand(
    String eventDescription,
    String location,
    List<String> categories,
    Integer topK
) {
    public PlanCommand {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
