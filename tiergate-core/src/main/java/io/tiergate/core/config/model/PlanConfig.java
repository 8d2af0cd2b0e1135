package io.tiergate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanConfig(
    String name,
    int durationDays,
    long priceMinor,
    String description
) {
}
