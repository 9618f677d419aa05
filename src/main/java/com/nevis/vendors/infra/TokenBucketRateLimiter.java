package com.nevis.vendors.infra;

import com.nevis.vendors.exception.RateLimitMisconfiguredException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket over a Bucket4j bandwidth with greedy refill. Tokens are only taken when the
 * whole request fits, so the balance never goes below zero; a short caller sleeps for the
 * exact deficit and tries again.
 */
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    private static final long MIN_WAIT_NANOS = TimeUnit.MICROSECONDS.toNanos(100);

    private final String name;
    private final long capacity;
    private final double refillPerSecond;
    private final Bucket bucket;

    public TokenBucketRateLimiter(String name, long capacity, double refillPerSecond) {
        if (capacity < 1) {
            throw new RateLimitMisconfiguredException(name, "capacity must be at least 1, got " + capacity);
        }
        if (!(refillPerSecond > 0) || Double.isInfinite(refillPerSecond)) {
            throw new RateLimitMisconfiguredException(name, "refill rate must be positive, got " + refillPerSecond);
        }
        this.name = name;
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.bucket = Bucket.builder()
            .addLimit(Bandwidth.classic(capacity, Refill.greedy(capacity, refillPeriod(capacity, refillPerSecond))))
            .build();
    }

    public static TokenBucketRateLimiter perMinute(String name, int requestsPerMinute, int burst) {
        return new TokenBucketRateLimiter(name, burst, requestsPerMinute / 60.0);
    }

    private static Duration refillPeriod(long capacity, double refillPerSecond) {
        long nanos = Math.round(capacity / refillPerSecond * TimeUnit.SECONDS.toNanos(1));
        return Duration.ofNanos(Math.max(nanos, 1));
    }

    @Override
    @SneakyThrows
    public void acquire(int permits) {
        requirePermits(permits);

        while (true) {
            ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(permits);
            if (probe.isConsumed()) {
                return;
            }
            long waitNanos = Math.max(probe.getNanosToWaitForRefill(), MIN_WAIT_NANOS);
            log.debug("Limiter {}: {} permits unavailable, waiting {} ms", name, permits,
                TimeUnit.NANOSECONDS.toMillis(waitNanos));
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    @Override
    public long availableTokens() {
        return bucket.getAvailableTokens();
    }

    @Override
    public long capacity() {
        return capacity;
    }

    public double refillPerSecond() {
        return refillPerSecond;
    }

    @Override
    public void requirePermits(int permits) {
        if (permits < 1) {
            throw new IllegalArgumentException("Permits must be positive, got " + permits);
        }
        if (permits > capacity) {
            throw new RateLimitMisconfiguredException(name,
                "request of " + permits + " permits exceeds bucket capacity " + capacity);
        }
    }

    @Override
    public String toString() {
        return "TokenBucketRateLimiter[" + name + ", capacity=" + capacity + ", refill=" + refillPerSecond + "/s]";
    }
}
