package com.nevis.vendors.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.vendors.model.RunReport;
import com.nevis.vendors.model.RunStatus;
import com.nevis.vendors.service.PlanRun;

import java.time.Instant;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunStatusResponse(
    @JsonProperty("run_id") UUID runId,
    RunStatus status,
    @JsonProperty("cancel_requested") boolean cancelRequested,
    @JsonProperty("submitted_at") Instant submittedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    String error,
    RunReport report
) {
    public static RunStatusResponse from(PlanRun run) {
        return new RunStatusResponse(
            run.getRunId(),
            run.getStatus(),
            run.isCancelRequested(),
            run.getSubmittedAt(),
            run.getFinishedAt(),
            run.getError(),
            run.getReport()
        );
    }
}
