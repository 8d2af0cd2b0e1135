package io.tiergate.core.entitlement;

public record EntitlementChange(UserEntitlement before, UserEntitlement after) {

    public boolean changed() {
        return !before.equals(after);
    }
}
