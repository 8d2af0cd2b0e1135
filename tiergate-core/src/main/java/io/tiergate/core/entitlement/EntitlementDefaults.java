package io.tiergate.core.entitlement;

import io.tiergate.core.config.model.QuotaConfig;
import io.tiergate.core.quota.QuotaBoundary;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the record a user gets on first interaction and keeps daily limits in line with the quota config.
 */
public final class EntitlementDefaults {
    private final QuotaConfig quotaConfig;
    private final QuotaBoundary boundary;
    private final Clock clock;

    public EntitlementDefaults(QuotaConfig quotaConfig, QuotaBoundary boundary, Clock clock) {
        this.quotaConfig = Objects.requireNonNull(quotaConfig, "quotaConfig must not be null");
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public UserEntitlement create(String userId) {
        Instant now = clock.instant();
        return UserEntitlement.fresh(
            userId,
            UserEntitlement.FREE_TIER,
            quotaConfig.limitFor(UserEntitlement.FREE_TIER),
            boundary.dayOf(now),
            now
        );
    }

    public int limitFor(String tier) {
        return quotaConfig.limitFor(tier);
    }

    /**
     * Returns {@code record} with the daily limit configured for its tier. A record already on that
     * limit is returned as is.
     */
    public UserEntitlement withConfiguredLimit(UserEntitlement record) {
        int limit = quotaConfig.limitFor(record.tier());
        return limit == record.dailyLimit() ? record : record.withDailyLimit(limit, record.updatedAt());
    }

    /**
     * {@code free} plus every tier named in {@code quota.tierLimits}.
     */
    public boolean knowsTier(String tier) {
        if (tier == null || tier.isBlank()) {
            return false;
        }
        String normalized = tier.trim().toLowerCase(Locale.ROOT);
        return UserEntitlement.FREE_TIER.equals(normalized) || quotaConfig.tierLimits().containsKey(normalized);
    }

    public Instant now() {
        return clock.instant();
    }
}
