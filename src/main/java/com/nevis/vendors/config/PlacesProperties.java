package com.nevis.vendors.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.places")
public record PlacesProperties(
    @NotBlank String apiKey,
    @NotBlank String baseUrl,
    @NotNull Duration connectTimeout,
    @NotNull @Min(1) @Max(20) Integer maxResultsPerQuery
) {}
