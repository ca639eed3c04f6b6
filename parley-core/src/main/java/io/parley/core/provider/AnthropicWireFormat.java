package io.parley.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.model.Block;
import io.parley.core.model.TextBlock;
import io.parley.core.model.ToolDefinition;
import io.parley.core.model.ToolInvocationBlock;
import io.parley.core.model.ToolResultBlock;
import io.parley.core.model.Turn;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Translates turns to and from the Anthropic Messages API shape. */
public final class AnthropicWireFormat {
    private static final Logger LOG = LoggerFactory.getLogger(AnthropicWireFormat.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    static final Map<String, Object> EPHEMERAL = Map.of("type", "ephemeral");

    private final ObjectMapper mapper;

    public AnthropicWireFormat(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public List<Map<String, Object>> toMessages(List<Turn> turns) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (Turn turn : turns) {
            List<Map<String, Object>> content = new ArrayList<>();
            for (Block block : turn.blocks()) {
                Map<String, Object> row = toContentBlock(block);
                if (row != null) {
                    content.add(row);
                }
            }
            if (content.isEmpty()) {
                continue;
            }
            if (turn.cacheMarked()) {
                content.get(0).put("cache_control", EPHEMERAL);
            }
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("role", turn.role().wireName());
            message.put("content", content);
            wire.add(message);
        }
        return wire;
    }

    public List<Map<String, Object>> toTools(List<ToolDefinition> tools) {
        List<Map<String, Object>> mapped = new ArrayList<>();
        if (tools == null) {
            return mapped;
        }
        for (ToolDefinition tool : tools) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", tool.name());
            row.put("description", tool.description());
            row.put("input_schema", tool.inputSchema());
            mapped.add(row);
        }
        return mapped;
    }

    public ProviderReply parseReply(JsonNode root) {
        List<TextBlock> text = new ArrayList<>();
        ToolInvocationBlock toolRequest = null;
        for (JsonNode item : root.path("content")) {
            String type = item.path("type").asText("");
            if (Block.TEXT.equals(type)) {
                text.add(new TextBlock(item.path("text").asText("")));
            } else if (Block.TOOL_USE.equals(type)) {
                if (toolRequest != null) {
                    LOG.warn("Dropping additional tool request {} ({}); only {} runs this turn",
                        item.path("name").asText(""), item.path("id").asText(""), toolRequest.name());
                    continue;
                }
                Map<String, Object> input = item.path("input").isObject()
                    ? mapper.convertValue(item.path("input"), MAP_TYPE)
                    : Map.of();
                toolRequest = new ToolInvocationBlock(item.path("id").asText(""), item.path("name").asText(""), input);
            }
        }
        return new ProviderReply(text, toolRequest, parseUsage(root.path("usage")));
    }

    public TokenUsage parseUsage(JsonNode usage) {
        if (usage == null || !usage.isObject()) {
            return TokenUsage.NONE;
        }
        return new TokenUsage(
            usage.path("input_tokens").asLong(0),
            usage.path("output_tokens").asLong(0),
            usage.path("cache_creation_input_tokens").asLong(0),
            usage.path("cache_read_input_tokens").asLong(0)
        );
    }

    private Map<String, Object> toContentBlock(Block block) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (block instanceof TextBlock text) {
            if (text.isBlank()) {
                return null;
            }
            row.put("type", Block.TEXT);
            row.put("text", text.text());
        } else if (block instanceof ToolInvocationBlock invocation) {
            row.put("type", Block.TOOL_USE);
            row.put("id", invocation.id());
            row.put("name", invocation.name());
            row.put("input", invocation.arguments());
        } else if (block instanceof ToolResultBlock result) {
            row.put("type", Block.TOOL_RESULT);
            row.put("tool_use_id", result.invocationId());
            row.put("content", result.content());
        } else {
            LOG.debug("Not sending unsupported block of type {}", block.type());
            return null;
        }
        return row;
    }
}
