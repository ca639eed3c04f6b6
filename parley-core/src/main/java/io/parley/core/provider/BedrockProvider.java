package io.parley.core.provider;

import io.parley.core.model.Block;
import io.parley.core.model.TextBlock;
import io.parley.core.model.ToolDefinition;
import io.parley.core.model.ToolInvocationBlock;
import io.parley.core.model.ToolResultBlock;
import io.parley.core.model.Turn;
import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.document.Document;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClientBuilder;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.SystemContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.Tool;
import software.amazon.awssdk.services.bedrockruntime.model.ToolConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.ToolInputSchema;
import software.amazon.awssdk.services.bedrockruntime.model.ToolResultContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ToolResultStatus;
import software.amazon.awssdk.services.bedrockruntime.model.ToolSpecification;
import software.amazon.awssdk.services.bedrockruntime.model.ToolUseBlock;

/** Bedrock Converse API adapter. Cache markers are not sent. */
public final class BedrockProvider implements ModelProvider, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BedrockProvider.class);

    private final String name;
    private final GenerationSettings settings;
    private final BedrockRuntimeClient client;
    private final boolean ownsClient;

    public BedrockProvider(String name, GenerationSettings settings, BedrockConnection connection) {
        this(name, settings, buildClient(connection), true);
    }

    BedrockProvider(String name, GenerationSettings settings, BedrockRuntimeClient client) {
        this(name, settings, client, false);
    }

    private BedrockProvider(String name, GenerationSettings settings, BedrockRuntimeClient client, boolean ownsClient) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.ownsClient = ownsClient;
    }

    /** Connection details for the Bedrock runtime; blank fields fall back to the AWS default chain. */
    public record BedrockConnection(
        String region,
        String endpoint,
        String accessKeyId,
        String secretAccessKey,
        String sessionToken,
        String profile
    ) {
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderReply send(List<Turn> turns, List<ToolDefinition> tools, String conversationId, String systemPrompt) {
        if (settings.model().isBlank()) {
            throw new ProviderException(name, "missing model");
        }

        ConverseRequest.Builder request = ConverseRequest.builder()
            .modelId(settings.wireModel())
            .messages(toMessages(turns))
            .inferenceConfig(InferenceConfiguration.builder()
                .maxTokens(settings.maxTokens())
                .temperature((float) settings.temperature())
                .build());
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            request.system(SystemContentBlock.builder().text(systemPrompt).build());
        }
        if (tools != null && !tools.isEmpty()) {
            request.toolConfig(toToolConfiguration(tools));
        }

        try {
            return parseResponse(client.converse(request.build()));
        } catch (SdkException e) {
            throw new ProviderException(name, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (ownsClient) {
            client.close();
        }
    }

    private static BedrockRuntimeClient buildClient(BedrockConnection connection) {
        Objects.requireNonNull(connection, "connection must not be null");
        String region = firstNonBlank(connection.region(), System.getenv("AWS_REGION"), System.getenv("AWS_DEFAULT_REGION"));
        if (region == null) {
            throw new IllegalArgumentException("missing AWS region for Bedrock provider");
        }
        BedrockRuntimeClientBuilder builder = BedrockRuntimeClient.builder()
            .region(Region.of(region))
            .credentialsProvider(credentialsFor(connection));
        if (connection.endpoint() != null && !connection.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(connection.endpoint()));
        }
        return builder.build();
    }

    private static AwsCredentialsProvider credentialsFor(BedrockConnection connection) {
        String keyId = connection.accessKeyId();
        String secret = connection.secretAccessKey();
        if (keyId != null && !keyId.isBlank() && secret != null && !secret.isBlank()) {
            String token = connection.sessionToken();
            return token != null && !token.isBlank()
                ? StaticCredentialsProvider.create(AwsSessionCredentials.create(keyId, secret, token))
                : StaticCredentialsProvider.create(AwsBasicCredentials.create(keyId, secret));
        }
        if (connection.profile() != null && !connection.profile().isBlank()) {
            return ProfileCredentialsProvider.create(connection.profile());
        }
        return DefaultCredentialsProvider.create();
    }

    private List<Message> toMessages(List<Turn> turns) {
        List<Message> wire = new ArrayList<>();
        for (Turn turn : turns) {
            List<ContentBlock> content = new ArrayList<>();
            for (Block block : turn.blocks()) {
                if (block instanceof TextBlock text && !text.isBlank()) {
                    content.add(ContentBlock.fromText(text.text()));
                } else if (block instanceof ToolInvocationBlock invocation) {
                    content.add(ContentBlock.fromToolUse(ToolUseBlock.builder()
                        .toolUseId(invocation.id())
                        .name(invocation.name())
                        .input(toDocument(invocation.arguments()))
                        .build()));
                } else if (block instanceof ToolResultBlock result) {
                    content.add(ContentBlock.fromToolResult(
                        software.amazon.awssdk.services.bedrockruntime.model.ToolResultBlock.builder()
                            .toolUseId(result.invocationId())
                            .status(ToolResultStatus.SUCCESS)
                            .content(ToolResultContentBlock.fromText(result.content()))
                            .build()));
                }
            }
            if (content.isEmpty()) {
                continue;
            }
            wire.add(Message.builder()
                .role(turn.isAssistant() ? ConversationRole.ASSISTANT : ConversationRole.USER)
                .content(content)
                .build());
        }
        return wire;
    }

    private ToolConfiguration toToolConfiguration(List<ToolDefinition> tools) {
        List<Tool> mapped = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            mapped.add(Tool.fromToolSpec(ToolSpecification.builder()
                .name(tool.name())
                .description(tool.description())
                .inputSchema(ToolInputSchema.fromJson(toDocument(tool.inputSchema())))
                .build()));
        }
        return ToolConfiguration.builder().tools(mapped).build();
    }

    private ProviderReply parseResponse(ConverseResponse response) {
        List<TextBlock> text = new ArrayList<>();
        ToolInvocationBlock toolRequest = null;
        if (response.output() != null && response.output().message() != null) {
            for (ContentBlock block : response.output().message().content()) {
                if (block.text() != null) {
                    text.add(new TextBlock(block.text()));
                }
                if (block.toolUse() != null && toolRequest == null) {
                    ToolUseBlock toolUse = block.toolUse();
                    toolRequest = new ToolInvocationBlock(toolUse.toolUseId(), toolUse.name(), toArguments(toolUse.input()));
                } else if (block.toolUse() != null) {
                    LOG.warn("Dropping additional tool request {} ({}); only {} runs this turn",
                        block.toolUse().name(), block.toolUse().toolUseId(), toolRequest.name());
                }
            }
        }
        TokenUsage usage = TokenUsage.NONE;
        if (response.usage() != null) {
            usage = new TokenUsage(
                valueOf(response.usage().inputTokens()),
                valueOf(response.usage().outputTokens()),
                0,
                0
            );
        }
        LOG.debug("Provider {} usage: input={} output={}", name, usage.inputTokens(), usage.outputTokens());
        return new ProviderReply(text, toolRequest, usage);
    }

    private static long valueOf(Integer tokens) {
        return tokens == null ? 0 : tokens;
    }

    private Map<String, Object> toArguments(Document document) {
        if (document == null || !document.isMap()) {
            return Map.of();
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        document.asMap().forEach((key, value) -> arguments.put(key, fromDocument(value)));
        return arguments;
    }

    static Document toDocument(Object value) {
        if (value == null) {
            return Document.fromNull();
        }
        if (value instanceof String s) {
            return Document.fromString(s);
        }
        if (value instanceof Boolean b) {
            return Document.fromBoolean(b);
        }
        if (value instanceof Number n) {
            return Document.fromNumber(new BigDecimal(n.toString()));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Document> converted = new LinkedHashMap<>();
            map.forEach((key, item) -> converted.put(String.valueOf(key), toDocument(item)));
            return Document.fromMap(converted);
        }
        if (value instanceof List<?> list) {
            return Document.fromList(list.stream().map(BedrockProvider::toDocument).toList());
        }
        return Document.fromString(String.valueOf(value));
    }

    static Object fromDocument(Document document) {
        if (document == null || document.isNull()) {
            return null;
        }
        if (document.isString()) {
            return document.asString();
        }
        if (document.isBoolean()) {
            return document.asBoolean();
        }
        if (document.isNumber()) {
            BigDecimal number = document.asNumber().bigDecimalValue();
            return number.scale() <= 0 ? (Object) number.longValue() : (Object) number.doubleValue();
        }
        if (document.isList()) {
            return document.asList().stream().map(BedrockProvider::fromDocument).toList();
        }
        Map<String, Object> values = new LinkedHashMap<>();
        document.asMap().forEach((key, item) -> values.put(key, fromDocument(item)));
        return values;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
