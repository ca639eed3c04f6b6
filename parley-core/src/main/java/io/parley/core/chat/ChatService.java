package io.parley.core.chat;

import io.parley.core.agent.AgentLoop;
import io.parley.core.agent.AgentWorkerPool;
import io.parley.core.agent.LoopResult;
import io.parley.core.conversation.ConversationRepairer;
import io.parley.core.session.Session;
import io.parley.core.session.SessionRegistry;
import io.parley.core.session.SessionScope;
import io.parley.core.tool.ToolRegistry;
import io.parley.core.tool.ToolSelection;
import io.parley.core.tool.ToolSelector;
import io.parley.core.tool.ToolUsageMetrics;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inbound request pipeline: resolve the caller's session, enter its scope, apply any history and
 * credentials carried by the request, and run one agent loop pass.
 */
public final class ChatService {
    private static final Logger LOG = LoggerFactory.getLogger(ChatService.class);

    private final SessionRegistry sessions;
    private final AgentLoop loop;
    private final ToolRegistry tools;
    private final AgentWorkerPool workers;
    private final ToolSelector selector;
    private final ToolUsageMetrics toolMetrics;
    private final ConversationRepairer repairer = new ConversationRepairer();

    public ChatService(SessionRegistry sessions, AgentLoop loop, ToolRegistry tools) {
        this(sessions, loop, tools, null);
    }

    public ChatService(SessionRegistry sessions, AgentLoop loop, ToolRegistry tools, AgentWorkerPool workers) {
        this(sessions, loop, tools, workers, ToolSelector.unfiltered(), new ToolUsageMetrics());
    }

    public ChatService(
        SessionRegistry sessions,
        AgentLoop loop,
        ToolRegistry tools,
        AgentWorkerPool workers,
        ToolSelector selector,
        ToolUsageMetrics toolMetrics
    ) {
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.loop = Objects.requireNonNull(loop, "loop must not be null");
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.workers = workers;
        this.selector = selector == null ? ToolSelector.unfiltered() : selector;
        this.toolMetrics = toolMetrics == null ? new ToolUsageMetrics() : toolMetrics;
    }

    public ToolUsageMetrics toolMetrics() {
        return toolMetrics;
    }

    public ChatResponse chat(ChatRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (request.message() == null || request.message().isBlank()) {
            throw new IllegalArgumentException("message is required");
        }

        Session session = sessions.resolve(request.ownerId(), request.sessionId());
        try (SessionScope scope = sessions.enter(session)) {
            session.updateCredentials(request.credentials());
            if (!request.history().isEmpty()) {
                session.replaceHistory(repairer.repair(request.history()));
            }
            LOG.debug("Chat for session {} with {} history turns", session.sessionId(), session.historySize());

            LoopResult result = runLoop(scope, request);
            return new ChatResponse(
                result.responseText(),
                result.history(),
                session.sessionId(),
                session.conversationId(),
                result.iterations(),
                result.boundReached()
            );
        }
    }

    private LoopResult runLoop(SessionScope scope, ChatRequest request) {
        Session session = scope.session();
        String systemPrompt = request.systemPrompt();
        Callable<LoopResult> work = () -> {
            ToolSelection selection = selector.select(request.message(), tools.definitions(), session.conversationId());
            toolMetrics.record(selection);
            LOG.debug("Offering {} of {} tools to session {} ({})", selection.tools().size(),
                selection.availableCount(), session.sessionId(), selection.method());
            return systemPrompt == null || systemPrompt.isBlank()
                ? loop.run(session, request.message(), selection.tools(), tools)
                : loop.run(session, request.message(), selection.tools(), tools, systemPrompt);
        };
        try {
            return workers == null ? work.call() : workers.run(scope, work);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for session " + session.sessionId());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Agent work failed for session " + session.sessionId(), e);
        }
    }
}
