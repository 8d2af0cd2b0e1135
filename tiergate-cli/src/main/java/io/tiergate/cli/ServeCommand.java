package io.tiergate.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Start the webhook and access-check gateway with the daily reset job")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--host"}, description = "Bind address (default: gateway.host from config)")
    String host;

    @Option(names = {"--port"}, description = "Gateway port (default: gateway.port from config)")
    Integer port;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serverRunner().run(host, port);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
