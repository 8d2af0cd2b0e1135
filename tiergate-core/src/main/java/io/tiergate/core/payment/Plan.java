package io.tiergate.core.payment;

public record Plan(
    String id,
    String name,
    int durationDays,
    long priceMinor,
    String description
) {
    public Plan {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("plan id must not be blank");
        }
        if (durationDays <= 0) {
            throw new IllegalArgumentException("plan " + id + " must last at least one day");
        }
        if (priceMinor <= 0) {
            throw new IllegalArgumentException("plan " + id + " must have a positive price");
        }
        id = id.trim();
        name = name == null || name.isBlank() ? id : name.trim();
        description = description == null ? "" : description.trim();
    }
}
