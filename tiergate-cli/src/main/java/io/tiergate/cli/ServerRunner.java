package io.tiergate.cli;

@FunctionalInterface
public interface ServerRunner {
    /**
     * Runs the gateway and the reset scheduler until shutdown. A {@code null} host or port falls back to
     * the configured value.
     */
    int run(String hostOverride, Integer portOverride) throws Exception;
}
