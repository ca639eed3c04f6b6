package io.parley.core.integration.remote;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.model.ToolDefinition;
import io.parley.core.tool.ToolExecutionException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for a tool server exposing {@code GET /mcp/tools} and {@code POST /mcp/call}.
 * Call results in the MCP {@code content} shape are flattened to their text.
 */
public final class RemoteToolClient implements RemoteToolInvoker {
    private static final Logger LOG = LoggerFactory.getLogger(RemoteToolClient.class);
    private static final MediaType JSON = MediaType.get("application/json");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;

    public RemoteToolClient(String baseUrl) {
        this(baseUrl, Duration.ofSeconds(30));
    }

    public RemoteToolClient(String baseUrl, Duration callTimeout) {
        this.baseUrl = HttpUrl.get(normalizeBaseUrl(baseUrl));
        this.mapper = new ObjectMapper();
        this.client = new OkHttpClient.Builder().callTimeout(callTimeout).build();
    }

    @Override
    public List<ToolDefinition> listTools() throws IOException {
        Request request = new Request.Builder()
            .url(endpoint("tools"))
            .get()
            .build();
        try (Response response = client.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new IOException("tool server returned HTTP " + response.code() + " listing tools");
            }
            JsonNode root = mapper.readTree(body.isBlank() ? "{}" : body);
            JsonNode items = root.isArray() ? root : root.path("tools");
            List<ToolDefinition> tools = new ArrayList<>();
            for (JsonNode item : items) {
                String name = item.path("name").asText("");
                if (name.isBlank()) {
                    continue;
                }
                JsonNode schema = item.has("inputSchema") ? item.get("inputSchema") : item.path("input_schema");
                tools.add(new ToolDefinition(
                    name,
                    item.path("description").asText(""),
                    schema.isObject() ? mapper.convertValue(schema, MAP_TYPE) : Map.of()
                ));
            }
            LOG.info("Discovered {} remote tools at {}", tools.size(), baseUrl);
            return tools;
        }
    }

    @Override
    public String callTool(String toolName, Map<String, Object> arguments) throws ToolExecutionException {
        try {
            Map<String, Object> payload = Map.of(
                "name", toolName,
                "arguments", arguments == null ? Map.of() : arguments
            );
            Request request = new Request.Builder()
                .url(endpoint("call"))
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .build();
            try (Response response = client.newCall(request).execute()) {
                String body = response.body() == null ? "" : response.body().string();
                if (!response.isSuccessful()) {
                    throw new ToolExecutionException(toolName, "tool server returned HTTP " + response.code() + ": " + body);
                }
                return contentOf(toolName, body);
            }
        } catch (IOException e) {
            throw new ToolExecutionException(toolName, "tool server call failed: " + e.getMessage(), e);
        }
    }

    private String contentOf(String toolName, String body) throws IOException, ToolExecutionException {
        if (body.isBlank()) {
            return "";
        }
        JsonNode root = mapper.readTree(body);
        JsonNode result = root.has("result") ? root.get("result") : root;
        JsonNode content = result.path("content");
        String text;
        if (content.isArray()) {
            StringBuilder joined = new StringBuilder();
            for (JsonNode item : content) {
                String part = item.path("text").asText("");
                if (!part.isBlank()) {
                    if (!joined.isEmpty()) {
                        joined.append('\n');
                    }
                    joined.append(part);
                }
            }
            text = joined.toString();
        } else if (content.isTextual()) {
            text = content.asText();
        } else {
            text = mapper.writeValueAsString(result);
        }
        if (result.path("isError").asBoolean(false)) {
            throw new ToolExecutionException(toolName, text);
        }
        return text;
    }

    private HttpUrl endpoint(String action) {
        return baseUrl.newBuilder()
            .addPathSegment("mcp")
            .addPathSegment(action)
            .build();
    }

    private String normalizeBaseUrl(String value) {
        String raw = (value == null || value.isBlank()) ? "http://127.0.0.1:3333" : value.trim();
        if (raw.endsWith("/")) {
            return raw.substring(0, raw.length() - 1);
        }
        return raw;
    }
}
