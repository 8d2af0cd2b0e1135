package io.tiergate.core.payment;

public enum ReconcileOutcome {
    APPLIED("applied"),
    DUPLICATE("duplicate"),
    IGNORED("ignored"),
    INVALID("invalid"),
    UNVERIFIED("unverified");

    private final String wireName;

    ReconcileOutcome(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
