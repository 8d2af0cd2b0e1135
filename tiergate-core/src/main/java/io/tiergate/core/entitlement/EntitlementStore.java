package io.tiergate.core.entitlement;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable per-user entitlement records plus the processed-payment ledger.
 *
 * <p>Implementations own the atomicity discipline: {@link #update} is a per-user read-modify-write that
 * never interleaves with another mutation of the same user, and {@link #applyPayment} succeeds for exactly
 * one caller per payment id, even under concurrent delivery.
 *
 * <p>Every record read through a store carries the daily limit currently configured for its tier.
 */
public interface EntitlementStore {

    /**
     * Returns the record, creating and persisting the default one when the user is unknown.
     */
    UserEntitlement get(String userId) throws IOException;

    /**
     * Replaces the stored record. {@code lastResetAt} is kept when the new value is older.
     */
    void save(UserEntitlement record) throws IOException;

    /**
     * Atomically applies {@code mutation} to the current record (created when absent) and persists the result.
     */
    EntitlementChange update(String userId, UnaryOperator<UserEntitlement> mutation) throws IOException;

    /**
     * Records {@code paymentId} in the idempotency ledger and applies {@code grant} to the paying user's
     * record as one atomic step. Either both are persisted or neither is.
     *
     * @return empty, with the record untouched, when the payment id was already in the ledger
     */
    Optional<EntitlementChange> applyPayment(String userId, String paymentId, UnaryOperator<UserEntitlement> grant)
        throws IOException;

    /**
     * Records {@code paymentId} in the idempotency ledger without changing the entitlement.
     *
     * @return {@code false} when the payment id was already present
     */
    default boolean markPaymentProcessed(String userId, String paymentId) throws IOException {
        return applyPayment(userId, paymentId, UnaryOperator.identity()).isPresent();
    }

    List<String> userIds() throws IOException;

    /**
     * Zeroes usage of every record whose last reset precedes {@code day}.
     *
     * @return number of records reset
     */
    default int resetBefore(LocalDate day, Instant now) throws IOException {
        int count = 0;
        for (String userId : userIds()) {
            EntitlementChange change = update(userId, current -> current.resetFor(day, now));
            if (change.changed()) {
                count++;
            }
        }
        return count;
    }
}
