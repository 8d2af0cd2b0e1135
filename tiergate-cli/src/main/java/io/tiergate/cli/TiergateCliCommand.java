package io.tiergate.cli;

import picocli.CommandLine.Command;

@Command(name = "tiergate", mixinStandardHelpOptions = true, description = "Download quota and subscription entitlements")
public final class TiergateCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
