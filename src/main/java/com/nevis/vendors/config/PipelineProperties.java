package com.nevis.vendors.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
    @NotNull @Min(1) @Max(100) Integer topK,
    @NotNull @Min(1) @Max(20) Integer maxCategories,
    @NotEmpty List<String> defaultCategories,
    @NotNull Boolean fetchDetails,
    @NotNull Duration runTimeout
) {}
