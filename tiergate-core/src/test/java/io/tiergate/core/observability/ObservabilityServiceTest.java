package io.tiergate.core.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.tiergate.core.MutableClock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ObservabilityServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSummarizeDownloadsAndPayments() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-08T10:00:00Z"));
        ObservabilityService service = new ObservabilityService(
            new FileAuditStore(tempDir.resolve("audit").resolve("events.json")), clock
        );

        service.record(AuditEvent.DOWNLOAD_ALLOWED, "old-user", Map.of("reason", "quota_ok", "remaining", 2));
        clock.advance(Duration.ofDays(2));
        service.record(AuditEvent.DOWNLOAD_ALLOWED, "u1", Map.of("reason", "quota_ok", "remaining", 1));
        service.record(AuditEvent.DOWNLOAD_ALLOWED, "u2", Map.of("reason", "subscription", "remaining", -1));
        service.record(AuditEvent.DOWNLOAD_DENIED, "u1", Map.of("reason", "quota_exceeded", "remaining", 0));
        service.record(AuditEvent.PAYMENT_APPLIED, "u2", Map.of("payment_id", "pay_1", "amount_minor", 4_900));
        service.record(AuditEvent.PAYMENT_APPLIED, "u3", Map.of("payment_id", "pay_2", "amount_minor", "12900"));
        service.record(AuditEvent.PAYMENT_DUPLICATE, "u2", Map.of("payment_id", "pay_1"));
        service.record(AuditEvent.PAYMENT_REJECTED, "", Map.of("reason", "verification"));
        service.record(AuditEvent.QUOTA_RESET, "", Map.of("day", "2026-03-10", "records_reset", 3));

        EntitlementSummary summary = service.summary();

        assertThat(summary.downloadsAllowed()).isEqualTo(3);
        assertThat(summary.downloadsDenied()).isEqualTo(1);
        assertThat(summary.subscriptionDownloads()).isEqualTo(1);
        assertThat(summary.denialRate()).isEqualTo(25.0);
        assertThat(summary.paymentsApplied()).isEqualTo(2);
        assertThat(summary.paymentsDuplicate()).isEqualTo(1);
        assertThat(summary.paymentsRejected()).isEqualTo(1);
        assertThat(summary.revenueMinor()).isEqualTo(17_800);
        assertThat(summary.quotaResets()).isEqualTo(1);
        assertThat(summary.activeUsers24h()).isEqualTo(2);
        assertThat(summary.auditEvents()).isEqualTo(9);
    }

    @Test
    void shouldReturnRecentAndPerUserEventsNewestFirst() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-10T10:00:00Z"));
        ObservabilityService service = new ObservabilityService(new InMemoryAuditStore(), clock);
        service.record(AuditEvent.DOWNLOAD_ALLOWED, "u1", Map.of());
        clock.advance(Duration.ofMinutes(1));
        service.record(AuditEvent.DOWNLOAD_ALLOWED, "u2", Map.of());
        clock.advance(Duration.ofMinutes(1));
        service.record(AuditEvent.DOWNLOAD_DENIED, "u1", Map.of());

        List<AuditEvent> recent = service.recent(2);
        List<AuditEvent> forUser = service.forUser("u1", 10);

        assertThat(recent).extracting(AuditEvent::userId).containsExactly("u1", "u2");
        assertThat(forUser).extracting(AuditEvent::type)
            .containsExactly(AuditEvent.DOWNLOAD_DENIED, AuditEvent.DOWNLOAD_ALLOWED);
    }

    @Test
    void shouldSetAsideCorruptAuditFile() throws Exception {
        Path file = tempDir.resolve("events.json");
        Files.writeString(file, "{broken");
        FileAuditStore store = new FileAuditStore(file);

        assertThat(store.events()).isEmpty();
        assertThat(Files.exists(tempDir.resolve("events.json.corrupt"))).isTrue();

        ObservabilityService service = new ObservabilityService(store, new MutableClock(Instant.parse("2026-03-10T10:00:00Z")));
        service.record(AuditEvent.QUOTA_RESET, "", Map.of("records_reset", 0));
        assertThat(new FileAuditStore(file).events()).hasSize(1);
    }

    @Test
    void shouldKeepOnlyTheNewestEventsInTheTrail() throws Exception {
        FileAuditStore store = new FileAuditStore(tempDir.resolve("trail.json"));
        MutableClock clock = new MutableClock(Instant.parse("2026-03-10T10:00:00Z"));

        for (int i = 0; i < 5; i++) {
            store.append(new AuditEvent("e" + i, clock.instant(), AuditEvent.QUOTA_RESET, "", Map.of()), 3);
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(store.events()).extracting(AuditEvent::id).containsExactly("e2", "e3", "e4");
    }

    @Test
    void shouldSwallowAuditFailuresWhenRecordingQuietly() {
        AuditStore broken = new AuditStore() {
            @Override
            public void append(AuditEvent event, int retain) throws IOException {
                throw new IOException("read-only filesystem");
            }

            @Override
            public List<AuditEvent> events() throws IOException {
                throw new IOException("read-only filesystem");
            }
        };
        ObservabilityService service = new ObservabilityService(broken, new MutableClock(Instant.EPOCH));

        assertThatCode(() -> service.recordQuietly(AuditEvent.DOWNLOAD_ALLOWED, "u1", Map.of()))
            .doesNotThrowAnyException();
    }
}
