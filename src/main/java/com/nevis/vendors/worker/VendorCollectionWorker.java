package com.nevis.vendors.worker;

import com.nevis.vendors.config.CollectorProperties;
import com.nevis.vendors.config.PipelineProperties;
import com.nevis.vendors.infra.CancellationToken;
import com.nevis.vendors.model.CollectionSummary;
import com.nevis.vendors.service.VendorPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.collector", name = "enabled", havingValue = "true")
public class VendorCollectionWorker {

    private final VendorPipeline pipeline;
    private final CollectorProperties collectorProperties;
    private final PipelineProperties pipelineProperties;

    private final AtomicBoolean running = new AtomicBoolean();

    @Scheduled(initialDelayString = "${app.collector.initial-delay-ms:30000}",
        fixedDelayString = "${app.collector.interval-ms:86400000}")
    public void collectVendors() {
        if (collectorProperties.queries().isEmpty()) {
            log.debug("No collection queries configured");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous vendor collection still running, skipping");
            return;
        }

        try {
            log.info("Collecting vendors for {} categories in {}",
                collectorProperties.queries().size(), collectorProperties.location());

            CollectionSummary summary = pipeline.collect(
                collectorProperties.queries(),
                collectorProperties.location(),
                CancellationToken.withTimeout(pipelineProperties.runTimeout())
            );

            log.info("Vendor collection finished: {} discovered, {} stored, {} failures",
                summary.discovered(), summary.stored(), summary.failures().size());
        } finally {
            running.set(false);
        }
    }
}
