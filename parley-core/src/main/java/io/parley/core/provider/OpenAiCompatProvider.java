package io.parley.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.model.TextBlock;
import io.parley.core.model.ToolDefinition;
import io.parley.core.model.ToolInvocationBlock;
import io.parley.core.model.ToolResultBlock;
import io.parley.core.model.Turn;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat Completions adapter for OpenAI and compatible gateways. Tool results are sent as
 * {@code tool} role messages; cache markers have no equivalent and are ignored.
 */
public final class OpenAiCompatProvider implements ModelProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final GenerationSettings settings;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, GenerationSettings settings) {
        this(name, apiKey, apiBase, settings, Map.of(), 3);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        GenerationSettings settings,
        Map<String, String> extraHeaders,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderReply send(List<Turn> turns, List<ToolDefinition> tools, String conversationId, String systemPrompt) {
        if (apiKey.isBlank()) {
            throw new ProviderException(name, "missing API key");
        }
        String payload = serialize(turns, tools, systemPrompt);

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(buildRequest(payload)).execute()) {
                String body = response.body() == null ? "" : response.body().string();
                if (!response.isSuccessful()) {
                    boolean retryable = response.code() == 429 || response.code() >= 500;
                    if (retryable && attempt < maxAttempts) {
                        LOG.warn("Provider {} returned HTTP {} (attempt {}/{}); retrying in {}ms",
                            name, response.code(), attempt, maxAttempts, delayMs);
                        sleep(delayMs);
                        delayMs = Math.min(delayMs * 2, 2000);
                        continue;
                    }
                    throw new ProviderException(name, "HTTP " + response.code() + " " + body, response.code(), null);
                }
                if (body.isBlank()) {
                    return new ProviderReply(List.of(), null, TokenUsage.NONE);
                }
                return parseReply(mapper.readTree(body));
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new ProviderException(name, ioe.getMessage(), ioe);
            }
        }
        throw new ProviderException(name, "exhausted retries");
    }

    private String serialize(List<Turn> turns, List<ToolDefinition> tools, String systemPrompt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", settings.wireModel());
        payload.put("max_tokens", settings.maxTokens());
        payload.put("temperature", settings.temperature());
        payload.put("messages", toWireMessages(turns, systemPrompt));
        if (tools != null && !tools.isEmpty()) {
            payload.put("tools", toWireTools(tools));
            payload.put("tool_choice", "auto");
        }
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ProviderException(name, "could not serialize request: " + e.getOriginalMessage(), e);
        }
    }

    private Request buildRequest(String payload) {
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(RequestBody.create(payload, JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json");
        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<Turn> turns, String systemPrompt) {
        List<Map<String, Object>> wire = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            wire.add(message("system", systemPrompt));
        }
        for (Turn turn : turns) {
            if (turn.isAssistant()) {
                Map<String, Object> row = message("assistant", turn.text());
                List<ToolInvocationBlock> invocations = turn.toolInvocations();
                if (!invocations.isEmpty()) {
                    row.put("tool_calls", toWireToolCalls(invocations));
                }
                wire.add(row);
                continue;
            }
            for (ToolResultBlock result : turn.toolResults()) {
                Map<String, Object> row = message("tool", result.content());
                row.put("tool_call_id", result.invocationId());
                wire.add(row);
            }
            String text = turn.text();
            if (!text.isBlank()) {
                wire.add(message("user", text));
            }
        }
        return wire;
    }

    private Map<String, Object> message(String role, String content) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", role);
        row.put("content", content);
        return row;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolInvocationBlock> invocations) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolInvocationBlock invocation : invocations) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", invocation.name());
            function.put("arguments", toArgumentsJson(invocation.arguments()));

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", invocation.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireTools(List<ToolDefinition> tools) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.name());
            function.put("description", tool.description());
            function.put("parameters", tool.inputSchema());
            wire.add(Map.of("type", "function", "function", function));
        }
        return wire;
    }

    private String toArgumentsJson(Map<String, Object> arguments) {
        try {
            return mapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new ProviderException(name, "tool arguments are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private ProviderReply parseReply(JsonNode root) {
        JsonNode message = root.path("choices").path(0).path("message");
        List<TextBlock> text = new ArrayList<>();
        if (message.path("content").isTextual()) {
            text.add(new TextBlock(message.path("content").asText()));
        }

        ToolInvocationBlock toolRequest = null;
        JsonNode call = message.path("tool_calls").path(0);
        if (call.isObject()) {
            JsonNode function = call.path("function");
            toolRequest = new ToolInvocationBlock(
                call.path("id").asText(""),
                function.path("name").asText(""),
                parseArguments(function.path("arguments"))
            );
            JsonNode calls = message.path("tool_calls");
            for (int i = 1; i < calls.size(); i++) {
                LOG.warn("Dropping additional tool request {} ({}); only {} runs this turn",
                    calls.path(i).path("function").path("name").asText(""), calls.path(i).path("id").asText(""),
                    toolRequest.name());
            }
        }

        JsonNode usage = root.path("usage");
        TokenUsage tokens = new TokenUsage(
            usage.path("prompt_tokens").asLong(0),
            usage.path("completion_tokens").asLong(0),
            0,
            usage.path("prompt_tokens_details").path("cached_tokens").asLong(0)
        );
        return new ProviderReply(text, toolRequest, tokens);
    }

    private Map<String, Object> parseArguments(JsonNode node) {
        if (node.isObject()) {
            return mapper.convertValue(node, MAP_TYPE);
        }
        String raw = node.asText("");
        if (raw.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(raw, MAP_TYPE);
        } catch (JsonProcessingException e) {
            LOG.warn("Provider {} returned tool arguments that are not a JSON object: {}", name, raw);
            return Map.of();
        }
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderException(name, "interrupted while backing off", ie);
        }
    }
}
