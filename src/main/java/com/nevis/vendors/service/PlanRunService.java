package com.nevis.vendors.service;

import com.nevis.vendors.model.PlanCommand;

import java.time.Instant;
import java.util.UUID;

public interface PlanRunService {
    PlanRun start(PlanCommand command);
    void execute(UUID runId);
    PlanRun get(UUID runId);
    PlanRun cancel(UUID runId);
    int evictFinishedBefore(Instant cutoff);
}
