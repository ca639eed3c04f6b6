package io.parley.app;

import io.parley.cli.ChatCommand;
import io.parley.cli.CliContext;
import io.parley.cli.GatewayCommand;
import io.parley.cli.OnboardCommand;
import io.parley.cli.ParleyCliCommand;
import io.parley.cli.StatusCommand;
import io.parley.core.agent.AgentLoop;
import io.parley.core.agent.AgentSettings;
import io.parley.core.agent.AgentWorkerPool;
import io.parley.core.api.GatewayServer;
import io.parley.core.chat.ChatService;
import io.parley.core.config.ConfigPaths;
import io.parley.core.config.ConfigService;
import io.parley.core.config.model.AgentDefaults;
import io.parley.core.config.model.ParleyConfig;
import io.parley.core.config.model.ProviderConfig;
import io.parley.core.config.model.RemoteToolsConfig;
import io.parley.core.integration.remote.RemoteToolClient;
import io.parley.core.model.ToolDefinition;
import io.parley.core.provider.AnthropicProvider;
import io.parley.core.provider.BedrockProvider;
import io.parley.core.provider.DisabledProvider;
import io.parley.core.provider.EchoProvider;
import io.parley.core.provider.FallbackProvider;
import io.parley.core.provider.GenerationSettings;
import io.parley.core.provider.ModelProvider;
import io.parley.core.provider.OpenAiCompatProvider;
import io.parley.core.provider.ProviderRegistry;
import io.parley.core.provider.ProviderRouter;
import io.parley.core.session.ConfigCredentialProvider;
import io.parley.core.session.SessionRegistry;
import io.parley.core.tool.ToolRegistry;
import io.parley.core.tool.ToolSelector;
import io.parley.core.tool.ToolUsageMetrics;
import io.parley.core.tool.impl.ListNotesTool;
import io.parley.core.tool.impl.NoteTool;
import io.parley.core.tool.impl.RemoteTool;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class ParleyApplication {
    private static final Logger LOG = LoggerFactory.getLogger(ParleyApplication.class);

    private ParleyApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.resolve(System.getenv("PARLEY_CONFIG"));
        ParleyConfig config = loadConfig(configService, configPath);
        AgentDefaults defaults = config.agents().defaults();

        GenerationSettings generation = config.agents().toGenerationSettings();
        ModelProvider anthropic = buildAnthropicProvider(config.providers().anthropic(), generation);
        ModelProvider openai = buildOpenAiProvider(config.providers().openai(), generation);
        ModelProvider bedrock = buildBedrockProvider(config.providers().bedrock(), generation);

        ProviderRegistry providerRegistry = new ProviderRegistry();
        providerRegistry.register(new FallbackProvider("anthropic", List.of(anthropic, bedrock, openai)));
        providerRegistry.register(new FallbackProvider("openai", List.of(openai, anthropic)));
        providerRegistry.register(new FallbackProvider("bedrock", List.of(bedrock, anthropic)));
        providerRegistry.register(new EchoProvider("echo"));
        ModelProvider provider = new ProviderRouter(providerRegistry).resolve(defaults.provider(), defaults.model());
        LOG.info("Using provider {} with model {}", provider.name(), defaults.model());

        RemoteToolsConfig remote = config.tools().remote();
        RemoteToolClient remoteClient = remote.enabled() ? new RemoteToolClient(remote.baseUrl()) : null;
        ToolRegistry toolRegistry = new ToolRegistry();
        toolRegistry.register(new NoteTool());
        toolRegistry.register(new ListNotesTool());
        if (remoteClient != null) {
            registerRemoteTools(toolRegistry, remoteClient);
        }

        AgentSettings agentSettings = config.agents().toAgentSettings();
        SessionRegistry sessionRegistry = new SessionRegistry(
            config.sessions().toSettings(),
            new ConfigCredentialProvider(config.credentials())
        );
        AgentWorkerPool workers = new AgentWorkerPool(
            Math.max(1, defaults.workerThreads()),
            Duration.ofSeconds(Math.max(1, defaults.requestTimeoutSeconds()))
        );
        ToolSelector toolSelector = new ToolSelector(config.tools().selection().toSettings(), provider);
        if (config.tools().selection().enabled()) {
            LOG.info("Context-based tool selection enabled (model assisted: {})",
                config.tools().selection().modelAssisted());
        }
        ChatService chatService = new ChatService(
            sessionRegistry,
            new AgentLoop(provider, agentSettings),
            toolRegistry,
            workers,
            toolSelector,
            new ToolUsageMetrics()
        );

        CliContext context = new CliContext(
            chatService,
            configService,
            configPath,
            (host, port) -> runGateway(host, port, chatService, sessionRegistry, toolRegistry)
        );

        CommandLine commandLine = new CommandLine(new ParleyCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("gateway", new GatewayCommand(context));

        int exitCode;
        try {
            exitCode = commandLine.execute(args);
        } finally {
            workers.close();
            sessionRegistry.close();
            if (bedrock instanceof AutoCloseable closeable) {
                closeQuietly(closeable);
            }
        }
        System.exit(exitCode);
    }

    private static int runGateway(
        String host,
        int port,
        ChatService chatService,
        SessionRegistry sessionRegistry,
        ToolRegistry toolRegistry
    ) throws InterruptedException {
        CountDownLatch shutdown = new CountDownLatch(1);
        sessionRegistry.start();
        try (GatewayServer server = new GatewayServer(port, host, chatService, sessionRegistry, toolRegistry)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://" + host + ":" + server.port());
            System.out.println("Endpoints: POST /chat, GET /tools, GET /tools/metrics, POST /tools/metrics/reset, GET /sessions, GET /healthz");
            shutdown.await();
        }
        return 0;
    }

    private static ParleyConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (IOException e) {
            LOG.warn("Could not read config {}; using defaults: {}", configPath, e.getMessage());
            return ParleyConfig.defaults();
        }
    }

    private static void registerRemoteTools(ToolRegistry toolRegistry, RemoteToolClient client) {
        try {
            for (ToolDefinition definition : client.listTools()) {
                toolRegistry.register(new RemoteTool(definition, client));
            }
        } catch (IOException e) {
            LOG.warn("Remote tool server unavailable; continuing with local tools only: {}", e.getMessage());
        }
    }

    private static ModelProvider buildAnthropicProvider(ProviderConfig providerConfig, GenerationSettings generation) {
        if (providerConfig != null && providerConfig.configured()) {
            return new AnthropicProvider("anthropic", providerConfig.apiKey(),
                baseOrDefault(providerConfig, "https://api.anthropic.com/v1"), generation);
        }
        return new DisabledProvider("anthropic", "missing API key");
    }

    private static ModelProvider buildOpenAiProvider(ProviderConfig providerConfig, GenerationSettings generation) {
        if (providerConfig != null && providerConfig.configured()) {
            return new OpenAiCompatProvider("openai", providerConfig.apiKey(),
                baseOrDefault(providerConfig, "https://api.openai.com/v1"), generation);
        }
        return new DisabledProvider("openai", "missing API key");
    }

    private static ModelProvider buildBedrockProvider(ProviderConfig providerConfig, GenerationSettings generation) {
        if (providerConfig == null || !providerConfig.configuredForBedrock()) {
            return new DisabledProvider("bedrock", "missing AWS region, profile or keys");
        }
        try {
            return new BedrockProvider("bedrock", generation, new BedrockProvider.BedrockConnection(
                providerConfig.region(),
                providerConfig.apiBase(),
                providerConfig.accessKeyId(),
                providerConfig.secretAccessKey(),
                providerConfig.sessionToken(),
                providerConfig.profile()
            ));
        } catch (RuntimeException e) {
            LOG.warn("Bedrock provider could not be created: {}", e.getMessage());
            return new DisabledProvider("bedrock", e.getMessage());
        }
    }

    private static String baseOrDefault(ProviderConfig providerConfig, String defaultBase) {
        return providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
            ? defaultBase
            : providerConfig.apiBase();
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            LOG.debug("Failed to close {}", closeable, e);
        }
    }
}
