package io.parley.core.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.parley.core.agent.AgentLoop;
import io.parley.core.agent.AgentSettings;
import io.parley.core.agent.AgentTimeoutException;
import io.parley.core.agent.AgentWorkerPool;
import io.parley.core.conversation.ConversationRepairer;
import io.parley.core.model.ToolDefinition;
import io.parley.core.model.ToolInvocationBlock;
import io.parley.core.model.ToolResultBlock;
import io.parley.core.model.Turn;
import io.parley.core.provider.ModelProvider;
import io.parley.core.provider.ProviderException;
import io.parley.core.provider.ProviderReply;
import io.parley.core.provider.ScriptedProvider;
import io.parley.core.session.CredentialProvider;
import io.parley.core.session.Session;
import io.parley.core.session.SessionCredentials;
import io.parley.core.session.SessionRegistry;
import io.parley.core.session.SessionSettings;
import io.parley.core.tool.ToolRegistry;
import io.parley.core.tool.ToolSelectionSettings;
import io.parley.core.tool.ToolSelector;
import io.parley.core.tool.ToolUsageMetrics;
import io.parley.core.tool.impl.ListNotesTool;
import io.parley.core.tool.impl.NoteTool;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ChatServiceTest {

    private final SessionRegistry sessions = new SessionRegistry(SessionSettings.defaults(), CredentialProvider.none());
    private final AgentWorkerPool workers = new AgentWorkerPool(2);
    private final ToolRegistry tools = new ToolRegistry();
    private final AgentSettings settings = new AgentSettings("configured prompt", "scripted", "test/model", 5);

    ChatServiceTest() {
        tools.register(new NoteTool());
        tools.register(new ListNotesTool());
    }

    @AfterEach
    void tearDown() {
        workers.close();
        sessions.close();
    }

    @Test
    void shouldKeepHistoryAcrossMessagesOfSameOwner() {
        ScriptedProvider provider = new ScriptedProvider()
            .thenTool("t1", "create_note", Map.of("title", "Groceries"))
            .thenText("Noted.")
            .thenTool("t2", "list_notes", Map.of())
            .thenText("You have one note.");
        ChatService service = new ChatService(sessions, new AgentLoop(provider, settings), tools, workers);

        ChatResponse first = service.chat(ChatRequest.of("alice", "Remember groceries"));
        ChatResponse second = service.chat(ChatRequest.of("alice", "What notes do I have?"));

        assertThat(first.responseText()).isEqualTo("Noted.");
        assertThat(second.sessionId()).isEqualTo(first.sessionId());
        assertThat(second.conversationId()).isEqualTo(first.conversationId());
        assertThat(second.history()).hasSize(8);
        assertThat(second.history().get(6).toolResults().get(0).content()).isEqualTo("1. Groceries");
    }

    @Test
    void shouldKeepOwnersApart() {
        ScriptedProvider provider = new ScriptedProvider().otherwise(ProviderReply.text("hi"));
        ChatService service = new ChatService(sessions, new AgentLoop(provider, settings), tools);

        ChatResponse alice = service.chat(ChatRequest.of("alice", "hello"));
        ChatResponse bob = service.chat(ChatRequest.of("bob", "hello"));

        assertThat(alice.sessionId()).isNotEqualTo(bob.sessionId());
        assertThat(bob.history()).hasSize(2);
    }

    @Test
    void shouldReplaceHistoryWithRepairedRequestHistory() {
        ScriptedProvider provider = new ScriptedProvider().thenText("fine");
        ChatService service = new ChatService(sessions, new AgentLoop(provider, settings), tools);
        List<Turn> supplied = List.of(
            Turn.user("earlier question"),
            Turn.assistant(new ToolInvocationBlock("t1", "lookup", Map.of())),
            Turn.user(new ToolResultBlock("t1", "answer")),
            Turn.user(new ToolResultBlock("ghost", "stray"))
        );

        ChatResponse response = service.chat(new ChatRequest("carol", null, "and now?", supplied, null, null));

        List<Turn> sent = provider.requests().get(0);
        assertThat(sent).hasSize(5);
        assertThat(sent.get(3).text()).isEqualTo("[Tool Result]: stray");
        assertThat(sent.get(4).text()).isEqualTo("and now?");
        assertThat(response.history()).hasSize(6);
    }

    @Test
    void shouldMergeRequestCredentialsIntoSession() {
        ChatService service = new ChatService(sessions, new AgentLoop(new ScriptedProvider(), settings), tools);

        ChatResponse response = service.chat(new ChatRequest(
            "dave", null, "hi", null, null, new SessionCredentials(Map.of("crm_token", "abc"))
        ));

        assertThat(sessions.find(response.sessionId()).orElseThrow().credentials().get("crm_token")).contains("abc");
    }

    @Test
    void shouldRejectBlankMessage() {
        ChatService service = new ChatService(sessions, new AgentLoop(new ScriptedProvider(), settings), tools);

        assertThatThrownBy(() -> service.chat(ChatRequest.of("erin", " ")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(sessions.size()).isZero();
    }

    @Test
    void shouldUnpinSessionAfterChat() {
        ChatService service = new ChatService(sessions, new AgentLoop(new ScriptedProvider(), settings), tools, workers);

        ChatResponse response = service.chat(ChatRequest.of("frank", "hello"));

        assertThat(sessions.find(response.sessionId()).orElseThrow().isPinned()).isFalse();
    }

    @Test
    void shouldOfferOnlySelectedToolsAndCountThem() {
        ScriptedProvider provider = new ScriptedProvider().thenText("ok").thenText("ok");
        ToolSelectionSettings selection = new ToolSelectionSettings(
            true, false, ToolSelectionSettings.defaultContextKeywords(), Map.of("create_note", List.of("notes"))
        );
        ToolUsageMetrics metrics = new ToolUsageMetrics();
        ChatService service = new ChatService(
            sessions, new AgentLoop(provider, settings), tools, workers, new ToolSelector(selection, provider), metrics
        );

        service.chat(ChatRequest.of("ivy", "Remember the milk"));
        service.chat(ChatRequest.of("ivy", "Hello there"));

        assertThat(provider.offeredTools()).containsExactly(List.of("create_note"), List.of());
        assertThat(service.toolMetrics()).isSameAs(metrics);
        assertThat(metrics.report().filtered().requests()).isEqualTo(2);
        assertThat(metrics.report().baseline().requests()).isZero();
    }

    @Test
    void shouldLeaveSessionIntactWhenProviderFailsMidLoop() {
        ScriptedProvider provider = new ScriptedProvider()
            .thenTool("t1", "create_note", Map.of("title", "Groceries"))
            .thenFail(new ProviderException("scripted", "upstream unavailable", 503, null))
            .thenText("Back again.");
        ChatService service = new ChatService(sessions, new AgentLoop(provider, settings), tools, workers);

        assertThatThrownBy(() -> service.chat(ChatRequest.of("gina", "Remember groceries")))
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("upstream unavailable");

        Session session = sessions.getOrCreate("gina");
        List<Turn> history = session.history();
        assertThat(history).hasSize(3);
        assertThat(history.get(0).text()).isEqualTo("Remember groceries");
        assertThat(history.get(1).toolInvocations()).extracting(ToolInvocationBlock::id).containsExactly("t1");
        assertThat(history.get(2).toolResults()).extracting(ToolResultBlock::invocationId).containsExactly("t1");
        assertThat(new ConversationRepairer().repair(history)).isEqualTo(history);
        assertThat(session.notes()).hasSize(1);
        assertThat(session.isPinned()).isFalse();

        ChatResponse retry = service.chat(ChatRequest.of("gina", "Are you still there?"));

        assertThat(retry.sessionId()).isEqualTo(session.sessionId());
        assertThat(retry.responseText()).isEqualTo("Back again.");
        assertThat(retry.history()).hasSize(5);
    }

    @Test
    void shouldNotOverlapProviderCallsAfterTimeout() throws Exception {
        GatedProvider provider = new GatedProvider();
        AgentWorkerPool impatient = new AgentWorkerPool(2, Duration.ofMillis(300));
        ChatService service = new ChatService(sessions, new AgentLoop(provider, settings), tools, impatient);
        try {
            assertThatThrownBy(() -> service.chat(ChatRequest.of("alice", "first")))
                .isInstanceOf(AgentTimeoutException.class);

            CompletableFuture<ChatResponse> second =
                CompletableFuture.supplyAsync(() -> service.chat(ChatRequest.of("alice", "second")));
            Thread.sleep(200);
            assertThat(provider.calls).hasValue(1);

            provider.gate.countDown();
            ChatResponse response = second.get(5, TimeUnit.SECONDS);

            assertThat(provider.maxInFlight).hasValue(1);
            assertThat(provider.calls).hasValue(2);
            assertThat(response.history()).extracting(Turn::text)
                .containsExactly("first", "answer 1", "second", "answer 2");
        } finally {
            provider.gate.countDown();
            impatient.close();
        }
    }

    /** Blocks every call until the gate opens and ignores cancellation while it waits. */
    private static final class GatedProvider implements ModelProvider {
        private final CountDownLatch gate = new CountDownLatch(1);
        private final AtomicInteger calls = new AtomicInteger();
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();

        @Override
        public String name() {
            return "gated";
        }

        @Override
        public ProviderReply send(List<Turn> turns, List<ToolDefinition> offered, String conversationId, String systemPrompt) {
            int call = calls.incrementAndGet();
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            boolean interrupted = false;
            try {
                while (true) {
                    try {
                        gate.await();
                        break;
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
            } finally {
                inFlight.decrementAndGet();
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return ProviderReply.text("answer " + call);
        }
    }
}
