package com.nevis.vendors.infra;

import com.nevis.vendors.model.ServiceType;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
public class Dispatcher implements AutoCloseable {

    private final ServiceType service;
    private final RateLimiter limiter;
    private final WorkerPool pool;
    private final int defaultCost;

    public Dispatcher(ServiceType service, RateLimiter limiter, WorkerPool pool, int defaultCost) {
        limiter.requirePermits(defaultCost);

        this.service = service;
        this.limiter = limiter;
        this.pool = pool;
        this.defaultCost = defaultCost;
    }

    public <T> WorkUnit<T> unit(String key, Callable<T> task) {
        return new WorkUnit<>(key, defaultCost, task);
    }

    public <T> List<TaskResult<T>> dispatch(List<WorkUnit<T>> units, CancellationToken cancellation) {
        units.forEach(unit -> limiter.requirePermits(unit.cost()));

        log.debug("{}: dispatching {} units", service.id(), units.size());
        List<TaskResult<T>> results = pool.submit(units, this::invoke, cancellation);

        long failed = results.stream().filter(result -> !result.isSuccess()).count();
        if (failed > 0) {
            log.warn("{}: {} of {} units failed", service.id(), failed, results.size());
        } else {
            log.info("{}: {} units completed", service.id(), results.size());
        }
        return results;
    }

    public <T> TaskResult<T> dispatchOne(WorkUnit<T> unit, CancellationToken cancellation) {
        return dispatch(List.of(unit), cancellation).get(0);
    }

    // runs on the pool thread; the client's own timeout bounds the call
    private <T> T invoke(WorkUnit<T> unit) throws Exception {
        limiter.acquire(unit.cost());
        try {
            return unit.task().call();
        } catch (Exception e) {
            throw ServiceErrorClassifier.classify(service, unit.key(), e);
        }
    }

    public ServiceType service() {
        return service;
    }

    public RateLimiter limiter() {
        return limiter;
    }

    @Override
    public void close() {
        pool.close();
    }
}
