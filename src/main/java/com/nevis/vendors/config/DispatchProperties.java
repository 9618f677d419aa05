package com.nevis.vendors.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.dispatch")
public record DispatchProperties(
    @NotNull @Valid ServiceLimits queryGeneration,
    @NotNull @Valid ServiceLimits embedding,
    @NotNull @Valid ServiceLimits placeSearch,
    @NotNull @Valid ServiceLimits placeDetails
) {

    /**
     * Quota and pool settings of one external service. {@code burst} is the bucket capacity,
     * {@code cost} the tokens a single call spends.
     */
    public record ServiceLimits(
        @NotNull @Min(1) Integer requestsPerMinute,
        @NotNull @Min(1) Integer burst,
        @NotNull @Min(1) @Max(64) Integer maxConcurrency,
        @NotNull @Min(1) Integer cost,
        @NotNull @Min(1) @Max(10) Integer maxAttempts,
        @NotNull Duration initialBackoff,
        @NotNull Duration callTimeout
    ) {}
}
