package io.tiergate.core.quota;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class QuotaBoundaryTest {

    @Test
    void shouldComputeDayAndNextMidnightInZone() {
        QuotaBoundary boundary = new QuotaBoundary(ZoneId.of("Asia/Kolkata"));
        Instant at = Instant.parse("2026-03-10T18:29:59Z");

        assertThat(boundary.dayOf(at)).isEqualTo(LocalDate.parse("2026-03-10"));
        assertThat(boundary.dayOf(at.plusSeconds(1))).isEqualTo(LocalDate.parse("2026-03-11"));
        assertThat(boundary.nextBoundary(at)).isEqualTo(Instant.parse("2026-03-10T18:30:00Z"));
        assertThat(boundary.untilNextBoundary(at)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void shouldFollowDaylightSavingShift() {
        QuotaBoundary boundary = new QuotaBoundary(ZoneId.of("America/New_York"));
        // clocks jump forward on 2026-03-08, so that local day has 23 hours
        Instant startOfDstDay = boundary.startOf(LocalDate.parse("2026-03-08"));

        assertThat(Duration.between(startOfDstDay, boundary.nextBoundary(startOfDstDay))).isEqualTo(Duration.ofHours(23));
    }

    @Test
    void shouldTreatMidnightAsStartOfNewDay() {
        QuotaBoundary boundary = new QuotaBoundary(ZoneOffset.UTC);
        Instant midnight = Instant.parse("2026-03-11T00:00:00Z");

        assertThat(boundary.dayOf(midnight)).isEqualTo(LocalDate.parse("2026-03-11"));
        assertThat(boundary.nextBoundary(midnight)).isEqualTo(Instant.parse("2026-03-12T00:00:00Z"));
    }
}
