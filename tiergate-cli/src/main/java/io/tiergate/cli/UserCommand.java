package io.tiergate.cli;

import io.tiergate.core.quota.QuotaResult;
import io.tiergate.core.runtime.EntitlementRuntime;
import io.tiergate.core.subscription.SubscriptionStatus;
import java.time.Instant;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "user", description = "Show a user's quota and subscription without consuming quota")
public final class UserCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "User id")
    String userId;

    public UserCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            EntitlementRuntime runtime = context.openRuntime();
            Instant now = context.clock().instant();
            QuotaResult quota = runtime.quotaEngine().peek(userId, now);
            SubscriptionStatus subscription = runtime.subscriptionEngine().status(userId, now);
            System.out.println("User: " + subscription.userId());
            System.out.println("Quota remaining today: " + quota.remaining() + "/" + quota.limit());
            System.out.println("Quota resets at: " + quota.resetsAt());
            if (subscription.active()) {
                System.out.println("Subscription: active (" + subscription.planId() + ") until "
                    + subscription.expiresAt() + ", " + subscription.remainingDays() + " day(s) left");
            } else if (subscription.expiresAt() != null) {
                System.out.println("Subscription: expired at " + subscription.expiresAt());
            } else {
                System.out.println("Subscription: none");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("User command failed: " + e.getMessage());
            return 1;
        }
    }
}
