package io.tiergate.core.subscription;

import java.time.Duration;
import java.time.Instant;

/**
 * Subscription view of one user at a point in time. {@code expiresAt} may lie in the past.
 */
public record SubscriptionStatus(
    String userId,
    boolean active,
    Instant expiresAt,
    String planId,
    Duration remaining
) {
    public SubscriptionStatus {
        planId = planId == null ? "" : planId;
        remaining = remaining == null || remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public long remainingDays() {
        return remaining.toDays();
    }
}
