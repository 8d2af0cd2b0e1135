package io.tiergate.core.access;

import io.tiergate.core.observability.AuditEvent;
import io.tiergate.core.observability.ObservabilityService;
import io.tiergate.core.quota.QuotaEngine;
import io.tiergate.core.quota.QuotaResult;
import io.tiergate.core.subscription.SubscriptionEngine;
import io.tiergate.core.subscription.SubscriptionStatus;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The single checkpoint in front of every download. An active subscription allows unconditionally and
 * leaves the free quota untouched; otherwise one unit of daily quota is consumed when available.
 */
public final class AccessDecision {
    private final SubscriptionEngine subscriptions;
    private final QuotaEngine quota;
    private final ObservabilityService observability;

    public AccessDecision(SubscriptionEngine subscriptions, QuotaEngine quota, ObservabilityService observability) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions must not be null");
        this.quota = Objects.requireNonNull(quota, "quota must not be null");
        this.observability = observability;
    }

    public AccessResult canDownload(String userId, Instant now) throws IOException {
        SubscriptionStatus status = subscriptions.status(userId, now);
        if (status.active()) {
            AccessResult result = AccessResult.subscription(status.expiresAt());
            audit(userId, result);
            return result;
        }
        QuotaResult consumed = quota.checkAndConsume(userId, now);
        AccessResult result = new AccessResult(
            consumed.allowed(),
            consumed.allowed() ? AccessReason.QUOTA_OK : AccessReason.QUOTA_EXCEEDED,
            consumed.remaining(),
            consumed.resetsAt(),
            status.expiresAt()
        );
        audit(userId, result);
        return result;
    }

    private void audit(String userId, AccessResult result) {
        if (observability == null) {
            return;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("reason", result.reason().wireName());
        attributes.put("remaining", result.remaining());
        observability.recordQuietly(
            result.allowed() ? AuditEvent.DOWNLOAD_ALLOWED : AuditEvent.DOWNLOAD_DENIED,
            userId,
            attributes
        );
    }
}
