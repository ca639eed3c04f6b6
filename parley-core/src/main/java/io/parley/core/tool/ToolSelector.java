package io.parley.core.tool;

import io.parley.core.model.ToolDefinition;
import io.parley.core.model.Turn;
import io.parley.core.provider.ModelProvider;
import io.parley.core.provider.ProviderException;
import io.parley.core.provider.ProviderReply;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses which tools to offer the model for a message. Keyword matching runs first; when no
 * context is found and model assistance is on, the model is asked to name the relevant tools.
 * A message that reveals nothing gets no tools.
 */
public final class ToolSelector {
    private static final Logger LOG = LoggerFactory.getLogger(ToolSelector.class);
    private static final Pattern ISSUE_KEY = Pattern.compile("[A-Z]+-\\d+");
    private static final String ISSUE_CONTEXT = "jira";

    private final ToolSelectionSettings settings;
    private final ModelProvider assistant;

    public ToolSelector(ToolSelectionSettings settings, ModelProvider assistant) {
        this.settings = settings == null ? ToolSelectionSettings.disabled() : settings;
        this.assistant = assistant;
    }

    public static ToolSelector unfiltered() {
        return new ToolSelector(ToolSelectionSettings.disabled(), null);
    }

    public ToolSelection select(String message, List<ToolDefinition> available, String conversationId) {
        List<ToolDefinition> all = available == null ? List.of() : List.copyOf(available);
        if (!settings.enabled()) {
            return new ToolSelection(all, ToolSelection.Method.ALL, all.size());
        }

        Set<String> contexts = extractContexts(message);
        if (!contexts.isEmpty()) {
            List<ToolDefinition> matched = all.stream()
                .filter(tool -> servesAny(tool.name(), contexts))
                .toList();
            LOG.info("Keyword tool selection: contexts {} matched {} of {} tools", contexts, matched.size(), all.size());
            return new ToolSelection(matched, ToolSelection.Method.KEYWORD, all.size());
        }

        if (settings.modelAssisted() && assistant != null && !all.isEmpty()) {
            List<ToolDefinition> suggested = askModel(message, all, conversationId);
            if (!suggested.isEmpty()) {
                LOG.info("Model-assisted tool selection picked {}",
                    suggested.stream().map(ToolDefinition::name).toList());
                return new ToolSelection(suggested, ToolSelection.Method.MODEL, all.size());
            }
        }
        LOG.info("No tool context detected; offering no tools");
        return new ToolSelection(List.of(), ToolSelection.Method.NONE, all.size());
    }

    /** Returns the context names whose keywords occur in {@code message}, in configuration order. */
    public Set<String> extractContexts(String message) {
        Set<String> contexts = new LinkedHashSet<>();
        if (message == null || message.isBlank()) {
            return contexts;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : settings.contextKeywords().entrySet()) {
            boolean hit = entry.getValue().stream()
                .anyMatch(keyword -> !keyword.isBlank() && lower.contains(keyword.toLowerCase(Locale.ROOT)));
            if (hit) {
                contexts.add(entry.getKey());
            }
        }
        if (settings.contextKeywords().containsKey(ISSUE_CONTEXT) && ISSUE_KEY.matcher(message).find()) {
            contexts.add(ISSUE_CONTEXT);
        }
        return contexts;
    }

    private boolean servesAny(String toolName, Set<String> contexts) {
        List<String> served = settings.toolContexts().getOrDefault(toolName, List.of());
        for (String candidate : served) {
            String tool = candidate.toLowerCase(Locale.ROOT);
            for (String context : contexts) {
                String detected = context.toLowerCase(Locale.ROOT);
                if (tool.contains(detected) || detected.contains(tool)) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<ToolDefinition> askModel(String message, List<ToolDefinition> all, String conversationId) {
        String catalogue = all.stream()
            .map(tool -> "- " + tool.name() + ": " + tool.description())
            .collect(Collectors.joining("\n"));
        String prompt = "The user sent the following message:\n\"" + message + "\"\n\n"
            + "Available tools:\n" + catalogue + "\n\n"
            + "Which tools are relevant to the user's request?\n"
            + "Answer only with a comma-separated list of tool names.";
        ProviderReply reply;
        try {
            reply = assistant.send(List.of(Turn.user(prompt)), List.of(), conversationId, null);
        } catch (ProviderException e) {
            LOG.warn("Model-assisted tool selection failed: {}", e.getMessage());
            return List.of();
        }
        Set<String> names = Arrays.stream(reply.text().split(","))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toSet());
        List<ToolDefinition> suggested = new ArrayList<>();
        for (ToolDefinition tool : all) {
            if (names.contains(tool.name())) {
                suggested.add(tool);
            }
        }
        return suggested;
    }
}
