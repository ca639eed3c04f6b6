package io.parley.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.model.ToolDefinition;
import io.parley.core.model.ToolInvocationBlock;
import io.parley.core.model.ToolResultBlock;
import io.parley.core.model.Turn;
import io.parley.core.model.UnsupportedBlock;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnthropicProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final GenerationSettings settings = new GenerationSettings("anthropic/claude-3-5-haiku-20241022", 0, 0.2);
    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseTextAndToolUseFromMessagesApi() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "content": [
                    {"type": "text", "text": "partial answer"},
                    {"type": "tool_use", "id": "tool_1", "name": "create_note", "input": {"title": "X"}},
                    {"type": "tool_use", "id": "tool_2", "name": "list_notes", "input": {}}
                  ],
                  "usage": {"input_tokens": 3000, "output_tokens": 7, "cache_read_input_tokens": 2500}
                }
                """));
        AnthropicProvider provider = new AnthropicProvider("anthropic", "sk-ant", server.url("/v1/").toString(), settings, 1);

        ProviderReply reply = provider.send(
            List.of(Turn.user("hi").withCacheMarker()),
            List.of(new ToolDefinition("create_note", "Create a note", null)),
            "conv-1",
            "sys"
        );

        assertThat(reply.text()).isEqualTo("partial answer");
        assertThat(reply.toolRequest()).isEqualTo(new ToolInvocationBlock("tool_1", "create_note", Map.of("title", "X")));
        assertThat(reply.usage()).isEqualTo(new TokenUsage(3000, 7, 0, 2500));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/messages");
        assertThat(request.getHeader("x-api-key")).isEqualTo("sk-ant");
        assertThat(request.getHeader("anthropic-version")).isEqualTo("2023-06-01");
        assertThat(request.getHeader("anthropic-beta")).isEqualTo("prompt-caching-2024-07-31");
        assertThat(request.getHeader("anthropic-conversation-id")).isEqualTo("conv-1");

        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("claude-3-5-haiku-20241022");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(1024);
        assertThat(body.path("system").asText()).isEqualTo("sys");
        assertThat(body.path("tools").get(0).path("input_schema").path("type").asText()).isEqualTo("object");
        JsonNode firstBlock = body.path("messages").get(0).path("content").get(0);
        assertThat(firstBlock.path("cache_control").path("type").asText()).isEqualTo("ephemeral");
    }

    @Test
    void shouldSendToolExchangeAndSkipUnsupportedBlocks() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"content\":[{\"type\":\"text\",\"text\":\"done\"}]}"));
        AnthropicProvider provider = new AnthropicProvider("anthropic", "sk-ant", server.url("/v1/").toString(), settings, 1);

        provider.send(List.of(
            Turn.user("note"),
            Turn.assistant(new ToolInvocationBlock("t1", "create_note", Map.of("title", "X"))),
            Turn.user(new ToolResultBlock("t1", "Created note 1: X"), new UnsupportedBlock("image", "{}"))
        ), List.of(), "conv-1", null);

        JsonNode messages = mapper.readTree(server.takeRequest().getBody().readUtf8()).path("messages");
        assertThat(messages).hasSize(3);
        assertThat(messages.get(1).path("content").get(0).path("type").asText()).isEqualTo("tool_use");
        assertThat(messages.get(2).path("content")).hasSize(1);
        assertThat(messages.get(2).path("content").get(0).path("tool_use_id").asText()).isEqualTo("t1");
        assertThat(messages.get(0).path("content").get(0).has("cache_control")).isFalse();
    }

    @Test
    void shouldRetryOnServerErrors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(529).setBody("overloaded"));
        server.enqueue(new MockResponse().setBody("{\"content\":[{\"type\":\"text\",\"text\":\"second time\"}]}"));
        AnthropicProvider provider = new AnthropicProvider("anthropic", "sk-ant", server.url("/v1/").toString(), settings, 3);

        ProviderReply reply = provider.send(List.of(Turn.user("hi")), List.of(), null, null);

        assertThat(reply.text()).isEqualTo("second time");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldFailFastOnClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"bad\"}"));
        AnthropicProvider provider = new AnthropicProvider("anthropic", "sk-ant", server.url("/v1/").toString(), settings, 3);

        assertThatThrownBy(() -> provider.send(List.of(Turn.user("hi")), List.of(), null, null))
            .isInstanceOf(ProviderException.class)
            .satisfies(error -> assertThat(((ProviderException) error).statusCode()).isEqualTo(400));
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldRequireApiKey() {
        AnthropicProvider provider = new AnthropicProvider("anthropic", "", server.url("/v1/").toString(), settings, 1);

        assertThatThrownBy(() -> provider.send(List.of(Turn.user("hi")), List.of(), null, null))
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("missing API key");
        assertThat(server.getRequestCount()).isZero();
    }
}
