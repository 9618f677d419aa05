package com.nevis.vendors.service;

import com.nevis.vendors.config.PipelineProperties;
import com.nevis.vendors.event.PlanRequestedEvent;
import com.nevis.vendors.exception.EntityNotFoundException;
import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.model.PlanCommand;
import com.nevis.vendors.model.RunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlanRunServiceImpl implements PlanRunService {

    private final Map<UUID, PlanRun> runs = new ConcurrentHashMap<>();

    private final VendorPipeline pipeline;
    private final PipelineProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public PlanRun start(PlanCommand command) {
        UUID runId = UUID.randomUUID();
        PlanRun run = new PlanRun(runId, command, CancellationToken.withTimeout(properties.runTimeout()));
        runs.put(runId, run);

        try {
            eventPublisher.publishEvent(new PlanRequestedEvent(runId));
        } catch (TaskRejectedException e) {
            runs.remove(runId);
            throw e;
        }

        log.info("Run {} accepted", runId);
        return run;
    }

    @Override
    public void execute(UUID runId) {
        PlanRun run = runs.get(runId);
        if (run == null) {
            log.warn("Run {} is no longer registered, skipping", runId);
            return;
        }

        try {
            RunReport report = pipeline.run(runId, run.getCommand(), run.getCancellation());
            run.complete(report);
        } catch (RuntimeException e) {
            log.error("Run {} failed", runId, e);
            run.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    @Override
    public PlanRun get(UUID runId) {
        PlanRun run = runs.get(runId);
        if (run == null) {
            throw new EntityNotFoundException(runId);
        }
        return run;
    }

    @Override
    public PlanRun cancel(UUID runId) {
        PlanRun run = get(runId);
        if (!run.isFinished() && run.getCancellation().cancel()) {
            log.info("Run {} cancellation requested", runId);
        }
        return run;
    }

    @Override
    public int evictFinishedBefore(Instant cutoff) {
        int before = runs.size();
        runs.values().removeIf(run -> run.isFinished() && run.getFinishedAt().isBefore(cutoff));
        return before - runs.size();
    }
}
