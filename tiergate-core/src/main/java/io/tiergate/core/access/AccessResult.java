package io.tiergate.core.access;

import java.time.Instant;

/**
 * Answer of the download checkpoint. {@code remaining} is {@link #UNLIMITED} for subscribers;
 * {@code resetsAt} is {@code null} for subscribers and otherwise the next quota boundary.
 */
public record AccessResult(
    boolean allowed,
    AccessReason reason,
    int remaining,
    Instant resetsAt,
    Instant subscriptionExpiresAt
) {
    public static final int UNLIMITED = -1;

    public static AccessResult subscription(Instant expiresAt) {
        return new AccessResult(true, AccessReason.SUBSCRIPTION, UNLIMITED, null, expiresAt);
    }
}
