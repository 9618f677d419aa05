package com.nevis.vendors.infra;

public interface RateLimiter {

    /**
     * Blocks until {@code permits} tokens are available, then takes them.
     */
    void acquire(int permits);

    long availableTokens();

    long capacity();

    /**
     * Fails with {@link com.nevis.vendors.exception.RateLimitMisconfiguredException} when a single
     * request of {@code permits} could never be served by this limiter.
     */
    void requirePermits(int permits);
}
