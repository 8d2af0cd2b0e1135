package io.tiergate.core.observability;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditEvent(
    String id,
    Instant timestamp,
    String type,
    String userId,
    Map<String, Object> attributes
) {
    public static final String DOWNLOAD_ALLOWED = "download_allowed";
    public static final String DOWNLOAD_DENIED = "download_denied";
    public static final String PAYMENT_APPLIED = "payment_applied";
    public static final String PAYMENT_DUPLICATE = "payment_duplicate";
    public static final String PAYMENT_REJECTED = "payment_rejected";
    public static final String QUOTA_RESET = "quota_reset";

    public AuditEvent {
        id = id == null ? "" : id.trim();
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        type = type == null ? "" : type.trim();
        userId = userId == null ? "" : userId.trim();
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
