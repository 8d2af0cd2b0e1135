package io.tiergate.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records entitlement events (downloads, payments, resets) and derives the summary counters from them.
 */
public final class ObservabilityService {
    private static final Logger LOG = LoggerFactory.getLogger(ObservabilityService.class);
    static final int RETAINED_EVENTS = 20_000;
    private static final Duration ACTIVE_WINDOW = Duration.ofHours(24);
    private static final Comparator<AuditEvent> NEWEST_FIRST = Comparator.comparing(AuditEvent::timestamp).reversed();

    private final AuditStore trail;
    private final Clock clock;

    public ObservabilityService(AuditStore trail, Clock clock) {
        this.trail = Objects.requireNonNull(trail, "trail must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public AuditEvent record(String type, String userId, Map<String, Object> attributes) throws IOException {
        AuditEvent event = new AuditEvent(UUID.randomUUID().toString(), clock.instant(), type, userId, attributes);
        trail.append(event, RETAINED_EVENTS);
        return event;
    }

    /**
     * Records an event; failures are logged and dropped.
     */
    public void recordQuietly(String type, String userId, Map<String, Object> attributes) {
        try {
            record(type, userId, attributes);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to record audit event {} for user {}: {}", type, userId, e.getMessage());
        }
    }

    public List<AuditEvent> recent(int limit) throws IOException {
        return newest(event -> true, limit);
    }

    public List<AuditEvent> forUser(String userId, int limit) throws IOException {
        String wanted = userId == null ? "" : userId.trim();
        return newest(event -> wanted.equals(event.userId()), limit);
    }

    public EntitlementSummary summary() throws IOException {
        List<AuditEvent> events = trail.events();
        Map<String, List<AuditEvent>> byType = events.stream()
            .collect(Collectors.groupingBy(AuditEvent::type));
        List<AuditEvent> allowed = byType.getOrDefault(AuditEvent.DOWNLOAD_ALLOWED, List.of());
        List<AuditEvent> applied = byType.getOrDefault(AuditEvent.PAYMENT_APPLIED, List.of());
        int denied = count(byType, AuditEvent.DOWNLOAD_DENIED);

        int viaSubscription = (int) allowed.stream()
            .filter(e -> "subscription".equals(text(e.attributes().get("reason"))))
            .count();
        long revenue = applied.stream().mapToLong(e -> minorUnits(e.attributes().get("amount_minor"))).sum();

        Instant since = clock.instant().minus(ACTIVE_WINDOW);
        int activeUsers = (int) events.stream()
            .filter(e -> !e.timestamp().isBefore(since))
            .filter(e -> e.type().startsWith("download_"))
            .map(AuditEvent::userId)
            .filter(id -> !id.isBlank())
            .distinct()
            .count();

        int decisions = allowed.size() + denied;
        double denialRate = decisions == 0 ? 0.0 : Math.round(denied * 10_000.0 / decisions) / 100.0;

        return new EntitlementSummary(
            allowed.size(),
            denied,
            viaSubscription,
            denialRate,
            applied.size(),
            count(byType, AuditEvent.PAYMENT_DUPLICATE),
            count(byType, AuditEvent.PAYMENT_REJECTED),
            revenue,
            count(byType, AuditEvent.QUOTA_RESET),
            activeUsers,
            events.size()
        );
    }

    private List<AuditEvent> newest(Predicate<AuditEvent> filter, int limit) throws IOException {
        return trail.events().stream()
            .filter(filter)
            .sorted(NEWEST_FIRST)
            .limit(Math.max(1, limit))
            .toList();
    }

    private static int count(Map<String, List<AuditEvent>> byType, String type) {
        return byType.getOrDefault(type, List.of()).size();
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static long minorUnits(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(text(value));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
