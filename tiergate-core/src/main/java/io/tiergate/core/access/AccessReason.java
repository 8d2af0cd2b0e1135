package io.tiergate.core.access;

public enum AccessReason {
    SUBSCRIPTION("subscription"),
    QUOTA_OK("quota_ok"),
    QUOTA_EXCEEDED("quota_exceeded");

    private final String wireName;

    AccessReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
