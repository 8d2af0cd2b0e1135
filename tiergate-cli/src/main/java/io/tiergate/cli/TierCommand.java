package io.tiergate.cli;

import io.tiergate.core.entitlement.UserEntitlement;
import io.tiergate.core.runtime.EntitlementRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "tier", description = "Move a user to a quota tier from quota.tierLimits (or back to free)")
public final class TierCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "User id")
    String userId;

    @Parameters(index = "1", description = "Tier name")
    String tier;

    public TierCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            EntitlementRuntime runtime = context.openRuntime();
            UserEntitlement updated = runtime.assignTier(userId, tier);
            System.out.println("User " + updated.userId() + " is now on tier " + updated.tier()
                + " (daily limit " + updated.dailyLimit() + ", used today " + updated.dailyUsed() + ")");
            return 0;
        } catch (Exception e) {
            System.err.println("Tier command failed: " + e.getMessage());
            return 1;
        }
    }
}
