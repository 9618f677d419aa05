package com.nevis.vendors.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.vendors.model.PlanCommand;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record PlanRequest(
    @NotBlank @Size(max = 2000) @JsonProperty("event_description") String eventDescription,
    @NotBlank String location,
    @Size(max = 20) List<@NotBlank String> categories,
    @Min(1) @Max(100) @JsonProperty("top_k") Integer topK
) {
    public PlanCommand toCommand() {
        return new PlanCommand(eventDescription, location, categories, topK);
    }
}
