package io.parley.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.agent.AgentLoop;
import io.parley.core.agent.AgentSettings;
import io.parley.core.chat.ChatService;
import io.parley.core.provider.DisabledProvider;
import io.parley.core.provider.EchoProvider;
import io.parley.core.provider.ModelProvider;
import io.parley.core.session.CredentialProvider;
import io.parley.core.session.SessionRegistry;
import io.parley.core.session.SessionSettings;
import io.parley.core.tool.ToolRegistry;
import io.parley.core.tool.ToolSelectionSettings;
import io.parley.core.tool.ToolSelector;
import io.parley.core.tool.ToolUsageMetrics;
import io.parley.core.tool.impl.ListNotesTool;
import io.parley.core.tool.impl.NoteTool;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GatewayServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final SessionRegistry sessions = new SessionRegistry(SessionSettings.defaults(), CredentialProvider.none());
    private final ToolRegistry tools = new ToolRegistry();

    GatewayServerTest() {
        tools.register(new NoteTool());
        tools.register(new ListNotesTool());
    }

    @AfterEach
    void tearDown() {
        sessions.close();
    }

    @Test
    void shouldChatAndKeepSessionAcrossRequests() throws Exception {
        try (GatewayServer server = server(new EchoProvider("echo"))) {
            server.start();

            HttpResponse<String> first = post(server, "/chat", "{\"ownerId\": \"alice\", \"message\": \"hello\"}");
            assertThat(first.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(first.body());
            assertThat(body.path("response").asText()).isEqualTo("[echo] hello");
            assertThat(body.path("boundReached").asBoolean()).isFalse();
            assertThat(body.path("history")).hasSize(2);
            assertThat(body.path("history").get(0).path("content").get(0).path("type").asText()).isEqualTo("text");

            String sessionId = body.path("sessionId").asText();
            HttpResponse<String> second = post(server, "/chat",
                "{\"userId\": \"alice\", \"session_id\": \"" + sessionId + "\", \"prompt\": \"again\"}");
            JsonNode secondBody = mapper.readTree(second.body());
            assertThat(secondBody.path("sessionId").asText()).isEqualTo(sessionId);
            assertThat(secondBody.path("history")).hasSize(4);
        }
    }

    @Test
    void shouldAcceptHistoryWithSystemPrompt() throws Exception {
        try (GatewayServer server = server(new EchoProvider("echo"))) {
            server.start();

            HttpResponse<String> response = post(server, "/chat", """
                {
                  "ownerId": "bob",
                  "message": "and now?",
                  "history": [
                    {"role": "system", "content": "Be brief."},
                    {"role": "user", "content": "earlier"},
                    {"role": "assistant", "content": "ok"}
                  ]
                }
                """);

            JsonNode body = mapper.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(body.path("history")).hasSize(4);
            assertThat(body.path("history").get(0).path("content").get(0).path("text").asText()).isEqualTo("earlier");
        }
    }

    @Test
    void shouldRejectBadRequests() throws Exception {
        try (GatewayServer server = server(new EchoProvider("echo"))) {
            server.start();

            HttpResponse<String> missing = post(server, "/chat", "{\"ownerId\": \"alice\"}");
            HttpResponse<String> malformed = post(server, "/chat", "{not json");
            HttpResponse<String> wrongMethod = get(server, "/chat");

            assertThat(missing.statusCode()).isEqualTo(400);
            assertThat(missing.body()).contains("message_required");
            assertThat(malformed.statusCode()).isEqualTo(400);
            assertThat(malformed.body()).contains("invalid_request");
            assertThat(wrongMethod.statusCode()).isEqualTo(405);
        }
    }

    @Test
    void shouldMapProviderFailureToBadGateway() throws Exception {
        try (GatewayServer server = server(new DisabledProvider("anthropic", "missing API key"))) {
            server.start();

            HttpResponse<String> response = post(server, "/chat", "{\"ownerId\": \"carol\", \"message\": \"hi\"}");

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(response.body()).contains("provider_error");
        }
    }

    @Test
    void shouldListToolsSessionsAndHealth() throws Exception {
        try (GatewayServer server = server(new EchoProvider("echo"))) {
            server.start();
            post(server, "/chat", "{\"ownerId\": \"dave\", \"message\": \"hello\"}");

            JsonNode toolsBody = mapper.readTree(get(server, "/tools").body());
            JsonNode sessionsBody = mapper.readTree(get(server, "/sessions").body());
            JsonNode health = mapper.readTree(get(server, "/healthz").body());

            assertThat(toolsBody.path("tools").get(0).path("name").asText()).isEqualTo("create_note");
            assertThat(toolsBody.path("tools").get(0).path("inputSchema").path("type").asText()).isEqualTo("object");
            assertThat(sessionsBody.path("count").asInt()).isEqualTo(1);
            assertThat(sessionsBody.path("sessions").get(0).path("ownerId").asText()).isEqualTo("dave");
            assertThat(sessionsBody.path("sessions").get(0).path("historySize").asInt()).isEqualTo(2);
            assertThat(sessionsBody.path("sessions").get(0).path("active").asBoolean()).isFalse();
            assertThat(health.path("status").asText()).isEqualTo("ok");
        }
    }

    @Test
    void shouldReportAndResetToolMetrics() throws Exception {
        AgentLoop loop = new AgentLoop(new EchoProvider("echo"), new AgentSettings("sys", "echo", "echo", 3));
        ToolSelector selector = new ToolSelector(new ToolSelectionSettings(
            true, false, ToolSelectionSettings.defaultContextKeywords(), Map.of("create_note", List.of("notes"))
        ), null);
        ChatService chat = new ChatService(sessions, loop, tools, null, selector, new ToolUsageMetrics());
        try (GatewayServer server = new GatewayServer(0, chat, sessions, tools)) {
            server.start();
            post(server, "/chat", "{\"ownerId\": \"erin\", \"message\": \"remember the milk\"}");

            JsonNode metrics = mapper.readTree(get(server, "/tools/metrics").body());
            assertThat(metrics.path("filtered").path("requests").asInt()).isEqualTo(1);
            assertThat(metrics.path("filtered").path("avgTokensPerRequest").asLong()).isPositive();
            assertThat(metrics.path("baseline").path("requests").asInt()).isZero();
            assertThat(metrics.path("reduction").asText()).isEqualTo("0%");

            assertThat(get(server, "/tools/metrics/reset").statusCode()).isEqualTo(405);
            HttpResponse<String> reset = post(server, "/tools/metrics/reset", "");
            assertThat(reset.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(reset.body()).path("message").asText()).isEqualTo("Metrics reset successfully");
            assertThat(mapper.readTree(get(server, "/tools/metrics").body()).path("filtered").path("requests").asInt())
                .isZero();
        }
    }

    private GatewayServer server(ModelProvider provider) {
        AgentLoop loop = new AgentLoop(provider, new AgentSettings("sys", "echo", "echo", 3));
        return new GatewayServer(0, new ChatService(sessions, loop, tools), sessions, tools);
    }

    private HttpResponse<String> post(GatewayServer server, String path, String json) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(GatewayServer server, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
            .GET()
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
