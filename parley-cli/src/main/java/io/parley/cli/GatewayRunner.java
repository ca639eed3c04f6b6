package io.parley.cli;

/** Starts the HTTP gateway and blocks until it shuts down, returning the exit code. */
@FunctionalInterface
public interface GatewayRunner {
    int run(String host, int port) throws Exception;
}
