package io.parley.core.agent;

import io.parley.core.conversation.CacheAnnotator;
import io.parley.core.conversation.ConversationRepairer;
import io.parley.core.model.Block;
import io.parley.core.model.Role;
import io.parley.core.model.TextBlock;
import io.parley.core.model.ToolDefinition;
import io.parley.core.model.ToolInvocationBlock;
import io.parley.core.model.ToolResultBlock;
import io.parley.core.model.Turn;
import io.parley.core.provider.ModelProvider;
import io.parley.core.provider.ProviderReply;
import io.parley.core.provider.TokenUsage;
import io.parley.core.session.MissingSessionContextException;
import io.parley.core.session.Session;
import io.parley.core.session.SessionContext;
import io.parley.core.tool.ToolExecutionException;
import io.parley.core.tool.ToolExecutor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one user message through the model, executing requested tools until the model answers
 * with plain text or the iteration bound is reached.
 *
 * <p>Every outbound call is built from the session history: the history is repaired, annotated with
 * cache markers and sent. Tool invocations and their results are appended to the history as an
 * assistant turn followed by a user turn, so the history stays structurally valid after every
 * step, including when the provider fails mid-loop.
 */
public final class AgentLoop {
    private static final Logger LOG = LoggerFactory.getLogger(AgentLoop.class);

    static final String BOUND_NOTICE =
        "I could not finish this request within the allowed number of steps. Please try again or narrow the request.";

    private final ModelProvider provider;
    private final AgentSettings settings;
    private final ConversationRepairer repairer;
    private final CacheAnnotator annotator;
    private final DuplicateCallGuard guard;

    public AgentLoop(ModelProvider provider, AgentSettings settings) {
        this(provider, settings, new ConversationRepairer(), new CacheAnnotator(), new DuplicateCallGuard());
    }

    public AgentLoop(
        ModelProvider provider,
        AgentSettings settings,
        ConversationRepairer repairer,
        CacheAnnotator annotator,
        DuplicateCallGuard guard
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.repairer = Objects.requireNonNull(repairer, "repairer must not be null");
        this.annotator = Objects.requireNonNull(annotator, "annotator must not be null");
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
    }

    public LoopResult run(Session session, String userMessage, List<ToolDefinition> tools, ToolExecutor executor) {
        return run(session, userMessage, tools, executor, settings.systemPrompt());
    }

    /** Same as {@link #run(Session, String, List, ToolExecutor)} with a caller-supplied system prompt. */
    public LoopResult run(
        Session session,
        String userMessage,
        List<ToolDefinition> tools,
        ToolExecutor executor,
        String systemPrompt
    ) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        if (userMessage == null || userMessage.isBlank()) {
            throw new IllegalArgumentException("userMessage must not be blank");
        }
        requireBound(session);

        List<ToolDefinition> offered = tools == null ? List.of() : List.copyOf(tools);
        Turn userTurn = Turn.user(userMessage);
        List<Turn> current = session.history();
        if (current.isEmpty() || !userTurn.equals(current.get(current.size() - 1))) {
            session.appendTurn(userTurn);
        }

        LoopState state = LoopState.SENDING;
        TokenUsage usage = TokenUsage.NONE;
        String bestText = "";
        for (int iteration = 1; iteration <= settings.maxIterations(); iteration++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Agent loop for " + session + " was interrupted");
            }
            List<Turn> outbound = annotator.annotate(repairer.repair(session.history()));
            LOG.debug("Session {} iteration {}/{}: {} -> sending {} turns ({} cache markers)",
                session.sessionId(), iteration, settings.maxIterations(), state, outbound.size(),
                CacheAnnotator.countMarkers(outbound));

            ProviderReply reply = provider.send(outbound, offered, session.conversationId(), systemPrompt);
            usage = usage.plus(reply.usage());
            if (!reply.text().isBlank()) {
                bestText = reply.text();
            }
            state = LoopState.AWAITING_TOOL_DECISION;

            if (!reply.hasToolRequest()) {
                if (!reply.textBlocks().isEmpty()) {
                    session.appendTurn(new Turn(Role.ASSISTANT, List.copyOf(reply.textBlocks())));
                }
                state = LoopState.DONE;
                LOG.debug("Session {} finished in {} iterations ({})", session.sessionId(), iteration, state);
                return new LoopResult(reply.text(), session.history(), iteration, false, usage);
            }

            ToolInvocationBlock request = reply.toolRequest();
            if (guard.isDuplicate(request.name(), request.arguments(), session.history())) {
                String freshId = freshId();
                LOG.info("Session {} intercepted duplicate call to {}", session.sessionId(), request.name());
                appendExchange(session, reply.textBlocks(),
                    new ToolInvocationBlock(freshId, request.name(), request.arguments()),
                    "Duplicate tool call intercepted: " + request.name()
                        + " was already called with these arguments. Use the earlier result instead of calling it again.");
                state = LoopState.SENDING;
                continue;
            }

            state = LoopState.EXECUTING;
            ToolInvocationBlock invocation = withUsableId(request, session.history());
            String content = execute(executor, invocation.name(), invocation.arguments(), session);
            appendExchange(session, reply.textBlocks(), invocation, content);
            state = LoopState.SENDING;
        }

        state = LoopState.EXHAUSTED;
        LOG.warn("Session {} reached the iteration bound of {} ({})", session.sessionId(), settings.maxIterations(), state);
        String response = bestText.isBlank() ? BOUND_NOTICE : bestText;
        return new LoopResult(response, session.history(), settings.maxIterations(), true, usage);
    }

    private void requireBound(Session session) {
        Session bound = SessionContext.current();
        if (bound != session) {
            throw new MissingSessionContextException(
                "Agent loop for " + session + " must run inside its own scope, but " + bound + " is bound");
        }
    }

    private String execute(ToolExecutor executor, String name, Map<String, Object> arguments, Session session) {
        try {
            return executor.execute(name, arguments).content();
        } catch (ToolExecutionException e) {
            LOG.warn("Tool {} failed for session {}: {}", name, session.sessionId(), e.getMessage());
            return "Error executing tool: " + e.getMessage();
        } catch (MissingSessionContextException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Tool {} failed unexpectedly for session {}", name, session.sessionId(), e);
            return "Error executing tool: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private void appendExchange(Session session, List<TextBlock> text, ToolInvocationBlock invocation, String result) {
        List<Block> assistantBlocks = new ArrayList<>(text);
        assistantBlocks.add(invocation);
        session.appendTurn(new Turn(Role.ASSISTANT, assistantBlocks));
        session.appendTurn(Turn.user(new ToolResultBlock(invocation.id(), result)));
    }

    private ToolInvocationBlock withUsableId(ToolInvocationBlock request, List<Turn> history) {
        boolean taken = request.id().isBlank() || history.stream()
            .flatMap(turn -> turn.toolInvocations().stream())
            .anyMatch(existing -> existing.id().equals(request.id()));
        return taken ? new ToolInvocationBlock(freshId(), request.name(), request.arguments()) : request;
    }

    private String freshId() {
        return "toolu_" + UUID.randomUUID().toString().replace("-", "");
    }
}
