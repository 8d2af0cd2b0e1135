package io.tiergate.core.subscription;

import io.tiergate.core.entitlement.EntitlementStore;
import io.tiergate.core.entitlement.UserEntitlement;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time-boxed paid access. A purchase extends from the later of now and the current expiry, so an early
 * renewal keeps the time that was left.
 */
public final class SubscriptionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionEngine.class);

    private final EntitlementStore store;

    public SubscriptionEngine(EntitlementStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public boolean isActive(String userId, Instant now) throws IOException {
        return store.get(userId).subscriptionActiveAt(now);
    }

    public Instant applyPurchase(String userId, String planId, int planDurationDays, Instant now) throws IOException {
        UserEntitlement after = store.update(userId, purchase(planId, planDurationDays, now)).after();
        LOG.info("Subscription for user {} extended by {} day(s) with plan {}, now expires {}",
            userId, planDurationDays, planId, after.subscriptionExpiresAt());
        return after.subscriptionExpiresAt();
    }

    /**
     * The stacking extension as a record mutation, for callers that persist it together with other state.
     */
    public UnaryOperator<UserEntitlement> purchase(String planId, int planDurationDays, Instant now) {
        if (planDurationDays <= 0) {
            throw new IllegalArgumentException("planDurationDays must be > 0");
        }
        Duration duration = Duration.ofDays(planDurationDays);
        return current -> {
            Instant expiry = current.subscriptionExpiresAt();
            Instant base = expiry != null && expiry.isAfter(now) ? expiry : now;
            return current.withSubscription(base.plus(duration), planId, now);
        };
    }

    public SubscriptionStatus status(String userId, Instant now) throws IOException {
        UserEntitlement record = store.get(userId);
        return new SubscriptionStatus(
            record.userId(),
            record.subscriptionActiveAt(now),
            record.subscriptionExpiresAt(),
            record.subscriptionPlanId(),
            record.subscriptionRemainingAt(now)
        );
    }
}
