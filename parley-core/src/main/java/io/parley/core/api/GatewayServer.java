package io.parley.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.parley.core.agent.AgentTimeoutException;
import io.parley.core.chat.ChatRequest;
import io.parley.core.chat.ChatResponse;
import io.parley.core.chat.ChatService;
import io.parley.core.codec.Transcript;
import io.parley.core.codec.TranscriptCodec;
import io.parley.core.model.ToolDefinition;
import io.parley.core.provider.ProviderException;
import io.parley.core.session.Session;
import io.parley.core.session.SessionCredentials;
import io.parley.core.session.SessionRegistry;
import io.parley.core.tool.ToolRegistry;
import io.parley.core.tool.ToolUsageMetrics;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front door: {@code POST /chat}, {@code GET /tools}, {@code GET /tools/metrics},
 * {@code POST /tools/metrics/reset}, {@code GET /sessions} and {@code GET /healthz}. Chat bodies
 * carry history in the provider-style JSON shape read by {@link TranscriptCodec}.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final TranscriptCodec codec;
    private final String host;
    private final int requestedPort;
    private final ChatService chatService;
    private final SessionRegistry sessions;
    private final ToolRegistry tools;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(int port, ChatService chatService, SessionRegistry sessions, ToolRegistry tools) {
        this(port, "127.0.0.1", chatService, sessions, tools);
    }

    public GatewayServer(
        int port,
        String host,
        ChatService chatService,
        SessionRegistry sessions,
        ToolRegistry tools
    ) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.chatService = Objects.requireNonNull(chatService, "chatService must not be null");
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.codec = new TranscriptCodec(mapper);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/chat", this::handleChat)
            .addExactPath("/tools", this::handleTools)
            .addExactPath("/tools/metrics", this::handleToolMetrics)
            .addExactPath("/tools/metrics/reset", this::handleToolMetricsReset)
            .addExactPath("/sessions", this::handleSessions);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on http://{}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (running.getAndSet(false) && server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok", "sessions", sessions.size()));
    }

    private void handleChat(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleChat(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        ChatRequest request;
        try {
            request = toChatRequest(readJsonBody(exchange));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_request", "message", String.valueOf(e.getMessage())));
            return;
        }
        if (request.message() == null || request.message().isBlank()) {
            sendJson(exchange, 400, Map.of("error", "message_required"));
            return;
        }

        try {
            ChatResponse response = chatService.chat(request);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("response", response.responseText());
            payload.put("history", codec.write(response.history()));
            payload.put("sessionId", response.sessionId());
            payload.put("conversationId", response.conversationId());
            payload.put("iterations", response.iterations());
            payload.put("boundReached", response.boundReached());
            sendJson(exchange, 200, payload);
        } catch (ProviderException e) {
            LOG.warn("Chat failed at provider {}: {}", e.provider(), e.getMessage());
            sendJson(exchange, 502, Map.of("error", "provider_error", "message", e.getMessage()));
        } catch (AgentTimeoutException e) {
            sendJson(exchange, 504, Map.of("error", "timeout", "message", e.getMessage()));
        }
    }

    private void handleTools(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        List<Map<String, Object>> rows = tools.definitions().stream()
            .map(this::toToolRow)
            .toList();
        sendJson(exchange, 200, Map.of("tools", rows));
    }

    private void handleToolMetrics(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        ToolUsageMetrics.Report report = chatService.toolMetrics().report();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("baseline", toPhaseRow(report.baseline()));
        payload.put("filtered", toPhaseRow(report.filtered()));
        payload.put("reduction", report.reductionPercent() + "%");
        sendJson(exchange, 200, payload);
    }

    private void handleToolMetricsReset(HttpServerExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        chatService.toolMetrics().reset();
        LOG.info("Tool usage metrics reset");
        sendJson(exchange, 200, Map.of("message", "Metrics reset successfully"));
    }

    private void handleSessions(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        List<Map<String, Object>> rows = sessions.sessions().stream()
            .map(this::toSessionRow)
            .toList();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("count", rows.size());
        payload.put("maxSessions", sessions.settings().maxSessions());
        payload.put("timeoutMinutes", sessions.settings().timeout().toMinutes());
        payload.put("sessions", rows);
        sendJson(exchange, 200, payload);
    }

    private ChatRequest toChatRequest(JsonNode body) {
        Transcript transcript = codec.read(body.path("history"));
        String systemPrompt = transcript.systemPrompt().isBlank() ? null : transcript.systemPrompt();
        Map<String, String> credentials = body.path("credentials").isObject()
            ? mapper.convertValue(body.path("credentials"), STRING_MAP)
            : Map.of();
        return new ChatRequest(
            text(body, "ownerId", "userId"),
            text(body, "sessionId", "session_id"),
            text(body, "message", "prompt"),
            transcript.turns(),
            systemPrompt,
            new SessionCredentials(credentials)
        );
    }

    private String text(JsonNode body, String key, String alias) {
        JsonNode node = body.has(key) ? body.get(key) : body.path(alias);
        return node.isTextual() ? node.asText() : null;
    }

    private Map<String, Object> toToolRow(ToolDefinition definition) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", definition.name());
        row.put("description", definition.description());
        row.put("inputSchema", definition.inputSchema());
        return row;
    }

    private Map<String, Object> toPhaseRow(ToolUsageMetrics.PhaseReport phase) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("requests", phase.requests());
        row.put("totalTokens", phase.totalTokens());
        row.put("avgTokensPerRequest", phase.averageTokens());
        row.put("since", phase.since().toString());
        return row;
    }

    private Map<String, Object> toSessionRow(Session session) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("sessionId", session.sessionId());
        row.put("ownerId", session.ownerId().orElse(null));
        row.put("createdAt", session.createdAt());
        row.put("lastAccessTime", session.lastAccessTime());
        row.put("historySize", session.historySize());
        row.put("notes", session.notes().size());
        row.put("active", session.isPinned());
        return row;
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Could not send error response", e);
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
