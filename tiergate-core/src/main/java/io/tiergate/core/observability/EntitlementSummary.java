package io.tiergate.core.observability;

/**
 * Counters over the retained audit trail. Rates are percentages rounded to two decimals.
 */
public record EntitlementSummary(
    int downloadsAllowed,
    int downloadsDenied,
    int subscriptionDownloads,
    double denialRate,
    int paymentsApplied,
    int paymentsDuplicate,
    int paymentsRejected,
    long revenueMinor,
    int quotaResets,
    int activeUsers24h,
    int auditEvents
) {
}
