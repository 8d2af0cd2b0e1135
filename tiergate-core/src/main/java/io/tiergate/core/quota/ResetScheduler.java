package io.tiergate.core.quota;

import io.tiergate.core.observability.AuditEvent;
import io.tiergate.core.observability.ObservabilityService;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link QuotaEngine#resetAll} once per daily boundary on its own thread. A catch-up run happens at
 * start so a process that was down over midnight does not wait a full day. Each run schedules the next
 * one from the boundary computed at that moment, so DST shifts are followed.
 */
public final class ResetScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ResetScheduler.class);
    private static final Duration RETRY_DELAY = Duration.ofMinutes(1);
    // fire slightly after midnight so the new day is already current
    private static final Duration BOUNDARY_GRACE = Duration.ofSeconds(1);

    private final QuotaEngine quotaEngine;
    private final ObservabilityService observability;
    private final Clock clock;
    private final ScheduledExecutorService executor;

    public ResetScheduler(QuotaEngine quotaEngine, ObservabilityService observability, Clock clock) {
        this.quotaEngine = Objects.requireNonNull(quotaEngine, "quotaEngine must not be null");
        this.observability = observability;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tiergate-quota-reset");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        executor.execute(this::runAndReschedule);
    }

    /**
     * Resets stale records now.
     *
     * @return number of records reset
     */
    public int runOnce() throws IOException {
        Instant now = clock.instant();
        int reset = quotaEngine.resetAll(now);
        if (observability != null) {
            observability.recordQuietly(AuditEvent.QUOTA_RESET, "", Map.of(
                "day", quotaEngine.boundary().dayOf(now).toString(),
                "records_reset", reset
            ));
        }
        return reset;
    }

    Duration delayUntilNextRun() {
        return quotaEngine.boundary().untilNextBoundary(clock.instant()).plus(BOUNDARY_GRACE);
    }

    private void runAndReschedule() {
        Duration next;
        try {
            runOnce();
            next = delayUntilNextRun();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Daily quota reset failed, retrying in {}: {}", RETRY_DELAY, e.getMessage());
            next = RETRY_DELAY;
        }
        try {
            executor.schedule(this::runAndReschedule, next.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Next quota reset in {}", next);
        } catch (RejectedExecutionException e) {
            LOG.debug("Quota reset scheduler stopped");
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
