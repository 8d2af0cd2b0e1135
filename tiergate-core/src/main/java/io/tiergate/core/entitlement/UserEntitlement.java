package io.tiergate.core.entitlement;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Stored entitlement state of a single user.
 *
 * <p>{@code dailyUsed} counts downloads since {@code lastResetAt}, a calendar day in the reference
 * timezone. {@code subscriptionExpiresAt} is {@code null} when the user never bought a plan.
 */
public record UserEntitlement(
    String userId,
    String tier,
    int dailyUsed,
    int dailyLimit,
    LocalDate lastResetAt,
    Instant subscriptionExpiresAt,
    String subscriptionPlanId,
    Set<String> processedPaymentIds,
    Instant createdAt,
    Instant updatedAt
) {
    public static final String FREE_TIER = "free";

    public UserEntitlement {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        userId = userId.trim();
        tier = tier == null || tier.isBlank() ? FREE_TIER : tier.trim();
        dailyLimit = Math.max(0, dailyLimit);
        dailyUsed = Math.max(0, Math.min(dailyUsed, dailyLimit));
        lastResetAt = lastResetAt == null ? LocalDate.EPOCH : lastResetAt;
        subscriptionPlanId = subscriptionPlanId == null ? "" : subscriptionPlanId.trim();
        processedPaymentIds = processedPaymentIds == null ? Set.of() : Set.copyOf(processedPaymentIds);
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public static UserEntitlement fresh(String userId, String tier, int dailyLimit, LocalDate today, Instant now) {
        return new UserEntitlement(userId, tier, 0, dailyLimit, today, null, "", Set.of(), now, now);
    }

    public int remaining() {
        return Math.max(0, dailyLimit - dailyUsed);
    }

    public boolean resetDue(LocalDate today) {
        return lastResetAt.isBefore(today);
    }

    public boolean subscriptionActiveAt(Instant now) {
        return subscriptionExpiresAt != null && now.isBefore(subscriptionExpiresAt);
    }

    public Duration subscriptionRemainingAt(Instant now) {
        if (!subscriptionActiveAt(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, subscriptionExpiresAt);
    }

    /**
     * Reconciles a mutated copy with the stored {@code previous} value: the payment ledger is only changed
     * through the store's ledger operations, and usage from an older day never overwrites a newer reset.
     */
    public UserEntitlement settledAgainst(UserEntitlement previous) {
        boolean staleUsage = lastResetAt.isBefore(previous.lastResetAt());
        return new UserEntitlement(
            previous.userId(),
            tier,
            staleUsage ? previous.dailyUsed() : dailyUsed,
            dailyLimit,
            staleUsage ? previous.lastResetAt() : lastResetAt,
            subscriptionExpiresAt,
            subscriptionPlanId,
            previous.processedPaymentIds(),
            previous.createdAt(),
            updatedAt
        );
    }

    /**
     * Zeroes usage for a new day. Never moves {@code lastResetAt} backwards.
     */
    public UserEntitlement resetFor(LocalDate day, Instant now) {
        if (!resetDue(day)) {
            return this;
        }
        return new UserEntitlement(
            userId,
            tier,
            0,
            dailyLimit,
            day,
            subscriptionExpiresAt,
            subscriptionPlanId,
            processedPaymentIds,
            createdAt,
            now
        );
    }

    public UserEntitlement withDailyUsed(int used, Instant now) {
        return new UserEntitlement(
            userId,
            tier,
            used,
            dailyLimit,
            lastResetAt,
            subscriptionExpiresAt,
            subscriptionPlanId,
            processedPaymentIds,
            createdAt,
            now
        );
    }

    public UserEntitlement withSubscription(Instant expiresAt, String planId, Instant now) {
        return new UserEntitlement(
            userId,
            tier,
            dailyUsed,
            dailyLimit,
            lastResetAt,
            expiresAt,
            planId,
            processedPaymentIds,
            createdAt,
            now
        );
    }

    public UserEntitlement withTier(String newTier, int newLimit, Instant now) {
        return new UserEntitlement(
            userId,
            newTier,
            dailyUsed,
            newLimit,
            lastResetAt,
            subscriptionExpiresAt,
            subscriptionPlanId,
            processedPaymentIds,
            createdAt,
            now
        );
    }

    /**
     * Same tier with a new limit. Usage above the new limit is clamped to it.
     */
    public UserEntitlement withDailyLimit(int newLimit, Instant now) {
        return withTier(tier, newLimit, now);
    }

    public UserEntitlement withPayment(String paymentId, Instant now) {
        Set<String> ledger = new LinkedHashSet<>(processedPaymentIds);
        ledger.add(paymentId);
        return withLedger(ledger, now);
    }

    private UserEntitlement withLedger(Set<String> ledger, Instant now) {
        return new UserEntitlement(
            userId,
            tier,
            dailyUsed,
            dailyLimit,
            lastResetAt,
            subscriptionExpiresAt,
            subscriptionPlanId,
            ledger,
            createdAt,
            now
        );
    }
}
