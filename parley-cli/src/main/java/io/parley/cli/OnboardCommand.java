package io.parley.cli;

import io.parley.core.config.OnboardResult;
import io.parley.core.config.model.ParleyConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "onboard",
    description = "Write config.json with Parley's defaults, keeping any values already set"
)
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--reset", description = "Discard the existing config and write plain defaults")
    boolean reset;

    @Option(names = "--print", description = "Print the resulting config")
    boolean print;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), reset);
            if (result.createdConfig()) {
                System.out.println("Wrote new config to " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Reset config to defaults at " + result.configPath());
            } else {
                System.out.println("Config at " + result.configPath() + " is up to date with current defaults");
            }
            ParleyConfig config = context.configService().load(result.configPath());
            if (!config.providers().anthropic().configured() && !config.providers().openai().configured()
                && !config.providers().bedrock().configuredForBedrock()) {
                System.out.println("No provider is configured yet; add an API key under \"providers\" before chatting.");
            }
            if (print) {
                System.out.println(context.configService().toPrettyJson(config));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Could not write config: " + e.getMessage());
            return 1;
        }
    }
}
