package io.tiergate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscountConfig(
    int percentage,
    long maxDiscountMinor,
    String validUntil,
    String description
) {
}
