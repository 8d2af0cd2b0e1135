package io.tiergate.core.quota;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Daily quota boundary: midnight in one reference timezone. Quota consumption and the reset job both
 * decide "is this record from an earlier day" through this class, comparing calendar dates, never raw
 * timestamp differences.
 */
public final class QuotaBoundary {
    private final ZoneId zone;

    public QuotaBoundary(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ZoneId zone() {
        return zone;
    }

    public LocalDate dayOf(Instant at) {
        return at.atZone(zone).toLocalDate();
    }

    public Instant startOf(LocalDate day) {
        return day.atStartOfDay(zone).toInstant();
    }

    public Instant nextBoundary(Instant at) {
        return startOf(dayOf(at).plusDays(1));
    }

    public Duration untilNextBoundary(Instant at) {
        Duration delay = Duration.between(at, nextBoundary(at));
        return delay.isNegative() ? Duration.ZERO : delay;
    }
}
