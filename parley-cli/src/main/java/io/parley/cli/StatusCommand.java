package io.parley.cli;

import io.parley.core.config.model.ParleyConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ParleyConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Default provider: " + config.agents().defaults().provider());
            System.out.println("Default model: " + config.agents().defaults().model());
            System.out.println("Max iterations: " + config.agents().defaults().maxIterations());
            System.out.println("Session timeout (minutes): " + config.sessions().timeoutMinutes());
            System.out.println("Max sessions: " + config.sessions().maxSessions());
            System.out.println("Anthropic configured: " + config.providers().anthropic().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("Bedrock configured: " + config.providers().bedrock().configuredForBedrock());
            System.out.println("Remote tools: " + (config.tools().remote().enabled() ? config.tools().remote().baseUrl() : "disabled"));
            System.out.println("Tool selection: " + (config.tools().selection().enabled()
                ? "by context" + (config.tools().selection().modelAssisted() ? ", model assisted" : "")
                : "disabled"));
            System.out.println("Credential owners: " + config.credentials().size());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
