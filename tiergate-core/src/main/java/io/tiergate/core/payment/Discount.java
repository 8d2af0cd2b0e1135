package io.tiergate.core.payment;

import java.time.LocalDate;

/**
 * Percentage discount capped at {@code maxDiscountMinor}. {@code validUntil} is inclusive; {@code null}
 * means the code never expires.
 */
public record Discount(
    String code,
    int percentage,
    long maxDiscountMinor,
    LocalDate validUntil,
    String description
) {
    public Discount {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("discount code must not be blank");
        }
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("discount percentage must be between 0 and 100");
        }
        code = code.trim();
        maxDiscountMinor = Math.max(0, maxDiscountMinor);
        description = description == null ? "" : description.trim();
    }

    public boolean validOn(LocalDate day) {
        return validUntil == null || !day.isAfter(validUntil);
    }

    public long discountFor(long priceMinor) {
        long raw = priceMinor * percentage / 100;
        return Math.min(raw, maxDiscountMinor);
    }
}
