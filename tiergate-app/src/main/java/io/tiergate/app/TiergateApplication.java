package io.tiergate.app;

import io.tiergate.cli.CliContext;
import io.tiergate.cli.InitCommand;
import io.tiergate.cli.OrderCommand;
import io.tiergate.cli.ResetCommand;
import io.tiergate.cli.ServeCommand;
import io.tiergate.cli.StatusCommand;
import io.tiergate.cli.TierCommand;
import io.tiergate.cli.TiergateCliCommand;
import io.tiergate.cli.UserCommand;
import io.tiergate.core.api.WebhookServer;
import io.tiergate.core.config.ConfigPaths;
import io.tiergate.core.config.ConfigService;
import io.tiergate.core.config.model.GatewayConfig;
import io.tiergate.core.config.model.TiergateConfig;
import io.tiergate.core.quota.ResetScheduler;
import io.tiergate.core.runtime.EntitlementRuntime;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class TiergateApplication {
    private static final Logger LOG = LoggerFactory.getLogger(TiergateApplication.class);

    private TiergateApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        Clock clock = Clock.systemUTC();

        CliContext context = new CliContext(
            configService,
            configPath,
            clock,
            (host, port) -> runServer(configService, configPath, clock, host, port)
        );

        CommandLine commandLine = new CommandLine(new TiergateCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("user", new UserCommand(context));
        commandLine.addSubcommand("reset", new ResetCommand(context));
        commandLine.addSubcommand("order", new OrderCommand(context));
        commandLine.addSubcommand("tier", new TierCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runServer(
        ConfigService configService,
        Path configPath,
        Clock clock,
        String hostOverride,
        Integer portOverride
    ) throws Exception {
        TiergateConfig config = configService.load(configPath);
        GatewayConfig gateway = config.gateway();
        String host = hostOverride == null || hostOverride.isBlank() ? gateway.host() : hostOverride;
        int port = portOverride == null ? gateway.port() : portOverride;
        if (!config.payments().webhookConfigured()) {
            LOG.warn("No webhook secret configured; every payment webhook will be rejected");
        }

        EntitlementRuntime runtime = EntitlementRuntime.create(config, clock);
        CountDownLatch shutdown = new CountDownLatch(1);
        try (WebhookServer server = runtime.newServer(host, port);
             ResetScheduler scheduler = runtime.newResetScheduler()) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            scheduler.start();
            System.out.println("Gateway started on http://" + host + ":" + server.port());
            System.out.println("Endpoints: POST /webhooks/payments, POST /payments/checkout, POST /access/check, "
                + "GET /entitlements/{userId}, GET /plans, GET /audit/events, GET /audit/summary, GET /healthz");
            shutdown.await();
        }
        return 0;
    }
}
