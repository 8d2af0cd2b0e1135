package io.tiergate.core.quota;

import io.tiergate.core.entitlement.EntitlementChange;
import io.tiergate.core.entitlement.EntitlementStore;
import io.tiergate.core.entitlement.UserEntitlement;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Free daily download quota. The stale-day reset and the conditional increment run as one store
 * mutation, so two concurrent checks for the same user can never both take the last unit.
 */
public final class QuotaEngine {
    private static final Logger LOG = LoggerFactory.getLogger(QuotaEngine.class);

    private final EntitlementStore store;
    private final QuotaBoundary boundary;
    private final Clock clock;

    public QuotaEngine(EntitlementStore store, QuotaBoundary boundary, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public QuotaResult checkAndConsume(String userId) throws IOException {
        return checkAndConsume(userId, clock.instant());
    }

    public QuotaResult checkAndConsume(String userId, Instant now) throws IOException {
        LocalDate today = boundary.dayOf(now);
        Instant resetsAt = boundary.nextBoundary(now);
        AtomicBoolean consumed = new AtomicBoolean(false);
        EntitlementChange change = store.update(userId, current -> {
            UserEntitlement rolled = current.resetFor(today, now);
            boolean below = rolled.dailyUsed() < rolled.dailyLimit();
            consumed.set(below);
            return below ? rolled.withDailyUsed(rolled.dailyUsed() + 1, now) : rolled;
        });
        UserEntitlement after = change.after();
        if (!consumed.get()) {
            LOG.debug("Quota exhausted for user {} ({}/{})", userId, after.dailyUsed(), after.dailyLimit());
            return QuotaResult.exceeded(after.dailyLimit(), resetsAt);
        }
        return QuotaResult.allowed(after.remaining(), after.dailyLimit(), resetsAt);
    }

    /**
     * Remaining quota without consuming. A record from an earlier day reports its full limit; nothing is
     * written beyond the default record of a first-time user.
     */
    public QuotaResult peek(String userId, Instant now) throws IOException {
        UserEntitlement record = store.get(userId);
        Instant resetsAt = boundary.nextBoundary(now);
        int remaining = record.resetDue(boundary.dayOf(now)) ? record.dailyLimit() : record.remaining();
        return new QuotaResult(remaining > 0, remaining, record.dailyLimit(), resetsAt);
    }

    public QuotaResult peek(String userId) throws IOException {
        return peek(userId, clock.instant());
    }

    /**
     * Resets every record last reset before the boundary day of {@code asOf}. Running it again for the
     * same day changes nothing.
     *
     * @return number of records reset
     */
    public int resetAll(Instant asOf) throws IOException {
        LocalDate day = boundary.dayOf(asOf);
        int reset = store.resetBefore(day, asOf);
        LOG.info("Daily quota reset for {} ({}): {} record(s) reset", day, boundary.zone(), reset);
        return reset;
    }

    public QuotaBoundary boundary() {
        return boundary;
    }
}
