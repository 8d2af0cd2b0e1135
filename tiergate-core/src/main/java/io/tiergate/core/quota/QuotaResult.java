package io.tiergate.core.quota;

import java.time.Instant;

/**
 * Outcome of a quota check. {@code resetsAt} is the next boundary, when a denied user gets a fresh quota.
 */
public record QuotaResult(boolean allowed, int remaining, int limit, Instant resetsAt) {

    public static QuotaResult allowed(int remaining, int limit, Instant resetsAt) {
        return new QuotaResult(true, remaining, limit, resetsAt);
    }

    public static QuotaResult exceeded(int limit, Instant resetsAt) {
        return new QuotaResult(false, 0, limit, resetsAt);
    }
}
