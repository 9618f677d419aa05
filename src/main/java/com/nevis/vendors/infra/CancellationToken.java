package com.nevis.vendors.infra;

import com.nevis.vendors.exception.RunCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-level stop signal. Workers consult it before starting a unit and between retries;
 * calls already in flight are left to finish. An optional deadline cancels the token on its own.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout, Clock clock) {
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    /**
     * @return true if this call flipped the token
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get() || isExpired();
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public void throwIfCancelled(String key) {
        if (isCancelled()) {
            throw new RunCancelledException(key);
        }
    }
}
