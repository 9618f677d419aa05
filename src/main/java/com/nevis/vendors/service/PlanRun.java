package com.nevis.vendors.service;

import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.model.PlanCommand;
import com.nevis.vendors.model.RunReport;
import com.nevis.vendors.model.RunStatus;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

@Getter
public class PlanRun {

    private final UUID runId;
    private final PlanCommand command;
    private final CancellationToken cancellation;
    private final Instant submittedAt;

    private volatile RunStatus status = RunStatus.RUNNING;
    private volatile RunReport report;
    private volatile String error;
    private volatile Instant finishedAt;

    public PlanRun(UUID runId, PlanCommand command, CancellationToken cancellation) {
        this.runId = runId;
        this.command = command;
        this.cancellation = cancellation;
        this.submittedAt = Instant.now();
    }

    void complete(RunReport report) {
        this.report = report;
        this.finishedAt = Instant.now();
        this.status = report.cancelled() ? RunStatus.CANCELLED : RunStatus.COMPLETED;
    }

    void fail(String error) {
        this.error = error;
        this.finishedAt = Instant.now();
        this.status = RunStatus.FAILED;
    }

    public boolean isFinished() {
        return status != RunStatus.RUNNING;
    }

    public boolean isCancelRequested() {
        return cancellation.isCancelled();
    }
}
