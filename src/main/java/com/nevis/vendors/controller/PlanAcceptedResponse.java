package com.nevis.vendors.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.vendors.model.RunStatus;

import java.util.UUID;

public record PlanAcceptedResponse(
    @JsonProperty("run_id") UUID runId,
    RunStatus status
) {}
