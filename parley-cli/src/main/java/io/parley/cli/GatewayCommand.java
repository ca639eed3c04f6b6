package io.parley.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "gateway",
    description = {
        "Serve conversations over HTTP until interrupted.",
        "Routes: POST /chat, GET /tools, GET /tools/metrics, POST /tools/metrics/reset, GET /sessions, GET /healthz"
    }
)
public final class GatewayCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--host"}, description = "Interface to bind (default: ${DEFAULT-VALUE})", defaultValue = "0.0.0.0")
    String host;

    @Option(names = {"-p", "--port"}, description = "Port to listen on, 0 for any free port (default: ${DEFAULT-VALUE})",
        defaultValue = "8787")
    int port;

    public GatewayCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (port < 0 || port > 65_535) {
            System.err.println("Invalid port: " + port);
            return 2;
        }
        try {
            return context.gatewayRunner().run(host, port);
        } catch (Exception e) {
            System.err.println("Gateway stopped: " + e.getMessage());
            return 1;
        }
    }
}
