package com.nevis.vendors.exception;

import lombok.Getter;

@Getter
public class RateLimitMisconfiguredException extends RuntimeException {
    private final String limiter;

    public RateLimitMisconfiguredException(String limiter, String message) {
        super("Rate limiter '" + limiter + "' misconfigured: " + message);
        this.limiter = limiter;
    }
}
