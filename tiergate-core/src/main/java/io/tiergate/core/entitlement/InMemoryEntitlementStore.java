package io.tiergate.core.entitlement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local store. Per-user atomicity comes from {@link ConcurrentHashMap#compute}; the payment
 * ledger is a separate map keyed by payment id so {@code putIfAbsent} decides the single winner.
 */
public final class InMemoryEntitlementStore implements EntitlementStore {
    private final EntitlementDefaults defaults;
    private final Map<String, UserEntitlement> records = new ConcurrentHashMap<>();
    private final Map<String, String> ledger = new ConcurrentHashMap<>();

    public InMemoryEntitlementStore(EntitlementDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    }

    @Override
    public UserEntitlement get(String userId) {
        return update(userId, UnaryOperator.identity()).after();
    }

    @Override
    public void save(UserEntitlement record) {
        update(record.userId(), current -> record);
    }

    @Override
    public EntitlementChange update(String userId, UnaryOperator<UserEntitlement> mutation) {
        return mutate(key(userId), mutation, null);
    }

    /**
     * The ledger claim comes first; when the grant fails the claim is withdrawn before the failure propagates.
     */
    @Override
    public Optional<EntitlementChange> applyPayment(String userId, String paymentId, UnaryOperator<UserEntitlement> grant) {
        String id = key(userId);
        if (ledger.putIfAbsent(paymentId, id) != null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mutate(id, grant, paymentId));
        } catch (RuntimeException e) {
            ledger.remove(paymentId, id);
            throw e;
        }
    }

    @Override
    public List<String> userIds() {
        List<String> ids = new ArrayList<>(records.keySet());
        ids.sort(String::compareTo);
        return ids;
    }

    private EntitlementChange mutate(String id, UnaryOperator<UserEntitlement> mutation, String paymentId) {
        UserEntitlement[] before = new UserEntitlement[1];
        UserEntitlement after = records.compute(id, (key, current) -> {
            UserEntitlement base = defaults.withConfiguredLimit(current == null ? defaults.create(key) : current);
            before[0] = base;
            UserEntitlement next = mutation.apply(base).settledAgainst(base);
            return paymentId == null ? next : next.withPayment(paymentId, defaults.now());
        });
        return new EntitlementChange(before[0], after);
    }

    private static String key(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        return userId.trim();
    }
}
