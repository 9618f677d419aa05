package com.nevis.vendors.infra;

import com.nevis.vendors.exception.RunCancelledException;
import com.nevis.vendors.exception.TransientServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
public class WorkerPool implements AutoCloseable {

    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final long MAX_BACKOFF_MS = 10_000;

    @FunctionalInterface
    public interface Worker<T> {
        T run(WorkUnit<T> unit) throws Exception;
    }

    private final String name;
    private final SimpleAsyncTaskExecutor executor;
    private final RetryTemplate retryTemplate;

    public WorkerPool(String name, int maxConcurrency, int maxAttempts, Duration initialBackoff) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be positive, got " + maxConcurrency);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }
        this.name = name;

        this.executor = new SimpleAsyncTaskExecutor(name + "-");
        this.executor.setConcurrencyLimit(maxConcurrency);

        long initialMs = Math.max(1, initialBackoff.toMillis());
        this.retryTemplate = RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .exponentialBackoff(initialMs, BACKOFF_MULTIPLIER, Math.max(initialMs * 2, MAX_BACKOFF_MS))
            .retryOn(TransientServiceException.class)
            .build();
    }

    public <T> List<TaskResult<T>> submit(List<WorkUnit<T>> units, Worker<T> worker, CancellationToken cancellation) {
        if (units.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<TaskResult<T>>> futures = new ArrayList<>(units.size());
        for (WorkUnit<T> unit : units) {
            if (cancellation.isCancelled()) {
                futures.add(CompletableFuture.completedFuture(
                    TaskResult.failure(unit.key(), new RunCancelledException(unit.key()), 0)));
                continue;
            }
            futures.add(schedule(unit, worker, cancellation));
        }

        List<TaskResult<T>> results = futures.stream()
            .map(CompletableFuture::join)
            .toList();

        log.debug("Pool {}: batch of {} units finished", name, units.size());
        return results;
    }

    private <T> CompletableFuture<TaskResult<T>> schedule(WorkUnit<T> unit, Worker<T> worker,
                                                          CancellationToken cancellation) {
        try {
            return CompletableFuture.supplyAsync(() -> runUnit(unit, worker, cancellation), executor);
        } catch (TaskRejectedException e) {
            log.error("Pool {}: unit {} rejected: {}", name, unit.key(), e.getMessage());
            return CompletableFuture.completedFuture(TaskResult.failure(unit.key(), e, 0));
        }
    }

    private <T> TaskResult<T> runUnit(WorkUnit<T> unit, Worker<T> worker, CancellationToken cancellation) {
        AtomicInteger attempts = new AtomicInteger();

        RetryCallback<T, Exception> callback = context -> {
            cancellation.throwIfCancelled(unit.key());
            attempts.incrementAndGet();
            return worker.run(unit);
        };

        try {
            T value = retryTemplate.execute(callback);
            return TaskResult.success(unit.key(), value, attempts.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskResult.failure(unit.key(), e, attempts.get());
        } catch (Exception e) {
            log.warn("Pool {}: unit {} failed after {} attempt(s): {}", name, unit.key(), attempts.get(), e.getMessage());
            return TaskResult.failure(unit.key(), e, attempts.get());
        }
    }

    @Override
    public void close() {
        executor.close();
    }
}
