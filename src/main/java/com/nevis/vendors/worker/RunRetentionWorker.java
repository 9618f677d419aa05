package com.nevis.vendors.worker;

import com.nevis.vendors.service.PlanRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
@Slf4j
@RequiredArgsConstructor
public class RunRetentionWorker {

    private final PlanRunService planRunService;

    @Value("${app.runs.retention:1h}")
    private Duration retention;

    @Scheduled(fixedDelayString = "${app.runs.cleanup-interval-ms:60000}")
    public void evictFinishedRuns() {
        int evicted = planRunService.evictFinishedBefore(Instant.now().minus(retention));
        if (evicted > 0) {
            log.info("Evicted {} finished run(s) older than {}", evicted, retention);
        }
    }
}
