package com.nevis.vendors.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record RunReport(
    @JsonProperty("run_id") UUID runId,
    @JsonProperty("event_description") String eventDescription,
    String location,
    List<CategoryRanking> rankings,
    List<RunFailure> failures,
    boolean cancelled,
    @JsonProperty("started_at") OffsetDateTime startedAt,
    @JsonProperty("finished_at") OffsetDateTime finishedAt
) {}
