package io.parley.core.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.model.ToolInvocationBlock;
import io.parley.core.model.Turn;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Detects a tool request that repeats an invocation already present in the history. Arguments are
 * compared structurally; numbers compare by value, so {@code 1}, {@code 1L} and {@code 1.0} are
 * equal.
 */
public final class DuplicateCallGuard {
    private static final Comparator<JsonNode> BY_VALUE = (left, right) -> {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue());
        }
        return left.equals(right) ? 0 : 1;
    };

    private final ObjectMapper mapper;

    public DuplicateCallGuard() {
        this(new ObjectMapper());
    }

    public DuplicateCallGuard(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public boolean isDuplicate(String name, Map<String, Object> arguments, List<Turn> history) {
        if (name == null || history == null || history.isEmpty()) {
            return false;
        }
        JsonNode candidate = mapper.valueToTree(arguments == null ? Map.of() : arguments);
        for (Turn turn : history) {
            if (!turn.isAssistant()) {
                continue;
            }
            for (ToolInvocationBlock invocation : turn.toolInvocations()) {
                if (name.equals(invocation.name())
                    && candidate.equals(BY_VALUE, mapper.valueToTree(invocation.arguments()))) {
                    return true;
                }
            }
        }
        return false;
    }
}
