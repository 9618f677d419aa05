package com.nevis.vendors.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "app.collector")
public record CollectorProperties(
    boolean enabled,
    String location,
    Map<String, List<String>> queries
) {
    public CollectorProperties {
        queries = queries == null ? Map.of() : queries;
    }
}
