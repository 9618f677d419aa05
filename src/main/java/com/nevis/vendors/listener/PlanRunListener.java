package com.nevis.vendors.listener;

import com.nevis.vendors.event.PlanRequestedEvent;
import com.nevis.vendors.service.PlanRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class PlanRunListener {

    private final PlanRunService planRunService;

    @Async("pipelineTaskExecutor")
    @EventListener
    public void handlePlanRequested(PlanRequestedEvent event) {
        log.info("Starting async run: {}", event.runId());
        planRunService.execute(event.runId());
    }
}
