package com.nevis.vendors.config;

import com.nevis.vendors.config.DispatchProperties.ServiceLimits;
import com.nevis.vendors.infra.RateLimiter;
import com.nevis.vendors.infra.TokenBucketRateLimiter;
import com.nevis.vendors.model.ServiceType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("queryGenerationLimiter")
    public RateLimiter queryGenerationLimiter(DispatchProperties properties) {
        return limiter(ServiceType.QUERY_GENERATION, properties.queryGeneration());
    }

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(DispatchProperties properties) {
        return limiter(ServiceType.EMBEDDING, properties.embedding());
    }

    @Bean("placeSearchLimiter")
    public RateLimiter placeSearchLimiter(DispatchProperties properties) {
        return limiter(ServiceType.PLACE_SEARCH, properties.placeSearch());
    }

    @Bean("placeDetailsLimiter")
    public RateLimiter placeDetailsLimiter(DispatchProperties properties) {
        return limiter(ServiceType.PLACE_DETAILS, properties.placeDetails());
    }

    private static RateLimiter limiter(ServiceType service, ServiceLimits limits) {
        return TokenBucketRateLimiter.perMinute(service.id(), limits.requestsPerMinute(), limits.burst());
    }
}
