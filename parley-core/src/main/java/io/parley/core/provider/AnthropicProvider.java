package io.parley.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.model.ToolDefinition;
import io.parley.core.model.Turn;
import java.io.IOException;
import java.time.Duration;
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

public final class AnthropicProvider implements ModelProvider {
    private static final Logger LOG = LoggerFactory.getLogger(AnthropicProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    static final String API_VERSION = "2023-06-01";
    static final String CACHING_BETA = "prompt-caching-2024-07-31";
    static final int MIN_CACHEABLE_TOKENS = 2048;

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final GenerationSettings settings;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final AnthropicWireFormat wireFormat;
    private final int maxAttempts;

    public AnthropicProvider(String name, String apiKey, String apiBase, GenerationSettings settings) {
        this(name, apiKey, apiBase, settings, 3);
    }

    public AnthropicProvider(String name, String apiKey, String apiBase, GenerationSettings settings, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
        this.wireFormat = new AnthropicWireFormat(mapper);
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
        long estimatedTokens = (long) Math.ceil(payload.length() / 4.0);
        LOG.debug("Estimated input tokens ~{} (minimum cacheable {})", estimatedTokens, MIN_CACHEABLE_TOKENS);

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Request request = buildRequest(payload, conversationId);
            try (Response response = client.newCall(request).execute()) {
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
                    throw new ProviderException(name, "HTTP " + response.code() + " " + truncate(body, 500),
                        response.code(), null);
                }
                if (body.isBlank()) {
                    return new ProviderReply(List.of(), null, TokenUsage.NONE);
                }
                ProviderReply reply = wireFormat.parseReply(mapper.readTree(body));
                logUsage(reply.usage());
                return reply;
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    LOG.warn("Provider {} call failed (attempt {}/{}): {}", name, attempt, maxAttempts, ioe.getMessage());
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
        payload.put("messages", wireFormat.toMessages(turns));
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }
        if (tools != null && !tools.isEmpty()) {
            payload.put("tools", wireFormat.toTools(tools));
        }
        try {
            return mapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new ProviderException(name, "could not serialize request: " + e.getMessage(), e);
        }
    }

    private Request buildRequest(String payload, String conversationId) {
        Request.Builder builder = new Request.Builder()
            .url(messagesUrl())
            .post(RequestBody.create(payload, JSON))
            .header("x-api-key", apiKey)
            .header("anthropic-version", API_VERSION)
            .header("anthropic-beta", CACHING_BETA)
            .header("content-type", "application/json");
        if (conversationId != null && !conversationId.isBlank()) {
            builder.header("anthropic-conversation-id", conversationId);
        }
        return builder.build();
    }

    private HttpUrl messagesUrl() {
        return apiBase.newBuilder()
            .addPathSegment("messages")
            .build();
    }

    private void logUsage(TokenUsage usage) {
        LOG.info("Provider {} usage: input={} output={} cacheCreation={} cacheRead={}",
            name,
            usage.inputTokens(),
            usage.outputTokens(),
            usage.cacheCreationInputTokens(),
            usage.cacheReadInputTokens());
        if (usage.inputTokens() > 0 && usage.inputTokens() < MIN_CACHEABLE_TOKENS) {
            LOG.warn("Input of {} tokens is below the minimum cacheable size of {}; cache markers have no effect",
                usage.inputTokens(), MIN_CACHEABLE_TOKENS);
        }
    }

    private String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max) + "...";
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
