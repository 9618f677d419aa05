package com.nevis.vendors.config;

import com.nevis.vendors.config.DispatchProperties.ServiceLimits;
import com.nevis.vendors.infra.Dispatcher;
import com.nevis.vendors.infra.RateLimiter;
import com.nevis.vendors.infra.WorkerPool;
import com.nevis.vendors.model.ServiceType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatcherConfig {

    @Bean("queryGenerationDispatcher")
    public Dispatcher queryGenerationDispatcher(
        @Qualifier("queryGenerationLimiter") RateLimiter limiter, DispatchProperties properties) {
        return dispatcher(ServiceType.QUERY_GENERATION, limiter, properties.queryGeneration());
    }

    @Bean("embeddingDispatcher")
    public Dispatcher embeddingDispatcher(
        @Qualifier("embeddingLimiter") RateLimiter limiter, DispatchProperties properties) {
        return dispatcher(ServiceType.EMBEDDING, limiter, properties.embedding());
    }

    @Bean("placeSearchDispatcher")
    public Dispatcher placeSearchDispatcher(
        @Qualifier("placeSearchLimiter") RateLimiter limiter, DispatchProperties properties) {
        return dispatcher(ServiceType.PLACE_SEARCH, limiter, properties.placeSearch());
    }

    @Bean("placeDetailsDispatcher")
    public Dispatcher placeDetailsDispatcher(
        @Qualifier("placeDetailsLimiter") RateLimiter limiter, DispatchProperties properties) {
        return dispatcher(ServiceType.PLACE_DETAILS, limiter, properties.placeDetails());
    }

    private static Dispatcher dispatcher(ServiceType service, RateLimiter limiter, ServiceLimits limits) {
        WorkerPool pool = new WorkerPool(
            service.id(),
            limits.maxConcurrency(),
            limits.maxAttempts(),
            limits.initialBackoff()
        );
        return new Dispatcher(service, limiter, pool, limits.cost());
    }
}
