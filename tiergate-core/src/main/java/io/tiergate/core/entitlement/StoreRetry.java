package io.tiergate.core.entitlement;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-runs a whole store operation when it fails with {@link TransientStoreException}. Other failures are
 * rethrown immediately. The last transient failure is rethrown once attempts are exhausted.
 */
public final class StoreRetry {
    private static final Logger LOG = LoggerFactory.getLogger(StoreRetry.class);
    private static final long MAX_DELAY_MS = 2000;

    private final int maxAttempts;
    private final long initialDelayMs;

    public StoreRetry(int maxAttempts) {
        this(maxAttempts, 250);
    }

    public StoreRetry(int maxAttempts, long initialDelayMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialDelayMs = Math.max(0, initialDelayMs);
    }

    public static StoreRetry none() {
        return new StoreRetry(1, 0);
    }

    public <T> T call(StoreCall<T> operation) throws IOException {
        long delayMs = initialDelayMs;
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call();
            } catch (TransientStoreException e) {
                if (attempt >= maxAttempts) {
                    LOG.warn("Store still unavailable after {} attempts: {}", attempt, e.getMessage());
                    throw e;
                }
                LOG.warn("Transient store failure (attempt {}/{}), retrying in {} ms: {}",
                    attempt, maxAttempts, delayMs, e.getMessage());
                sleep(delayMs);
                delayMs = Math.min(delayMs * 2, MAX_DELAY_MS);
            }
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private static void sleep(long delayMs) throws TransientStoreException {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while waiting to retry store operation", ie);
        }
    }

    @FunctionalInterface
    public interface StoreCall<T> {
        T call() throws IOException;
    }
}
