package io.parley.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.model.Block;
import io.parley.core.model.Role;
import io.parley.core.model.TextBlock;
import io.parley.core.model.ToolInvocationBlock;
import io.parley.core.model.ToolResultBlock;
import io.parley.core.model.Turn;
import io.parley.core.model.UnsupportedBlock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes conversation history in the provider-style JSON shape
 * {@code [{"role": "...", "content": "..." | [blocks]}]}.
 *
 * <p>Reading is lenient. Entries that are not objects are skipped, {@code system} entries are
 * collected into the system prompt, OpenAI-style {@code tool} entries become user turns carrying a
 * tool result, and unknown block tags are kept as {@link UnsupportedBlock}. Structural validity is
 * left to the repairer.
 */
public final class TranscriptCodec {
    private static final Logger LOG = LoggerFactory.getLogger(TranscriptCodec.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public TranscriptCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public Transcript read(String json) {
        if (json == null || json.isBlank()) {
            return Transcript.empty();
        }
        try {
            return read(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("history is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Transcript read(JsonNode history) {
        if (history == null || !history.isArray()) {
            return Transcript.empty();
        }
        List<Turn> turns = new ArrayList<>();
        StringBuilder system = new StringBuilder();
        int skipped = 0;

        for (JsonNode entry : history) {
            if (!entry.isObject()) {
                skipped++;
                continue;
            }
            String role = entry.path("role").asText("");
            if ("system".equalsIgnoreCase(role)) {
                String text = textOf(entry.path("content"));
                if (!text.isBlank()) {
                    if (!system.isEmpty()) {
                        system.append("\n\n");
                    }
                    system.append(text);
                }
                continue;
            }
            if ("tool".equalsIgnoreCase(role)) {
                turns.add(Turn.user(new ToolResultBlock(
                    entry.path("tool_call_id").asText(""),
                    textOf(entry.path("content"))
                )));
                continue;
            }
            Role parsed = Role.fromWire(role);
            if (parsed == null) {
                skipped++;
                continue;
            }
            turns.add(new Turn(parsed, readBlocks(entry.path("content"))));
        }

        if (skipped > 0) {
            LOG.debug("Skipped {} unreadable history entries", skipped);
        }
        return new Transcript(turns, system.toString());
    }

    public List<Map<String, Object>> write(List<Turn> turns) {
        List<Map<String, Object>> wire = new ArrayList<>();
        if (turns == null) {
            return wire;
        }
        for (Turn turn : turns) {
            List<Map<String, Object>> content = new ArrayList<>();
            for (Block block : turn.blocks()) {
                content.add(writeBlock(block));
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", turn.role().wireName());
            row.put("content", content);
            wire.add(row);
        }
        return wire;
    }

    private List<Block> readBlocks(JsonNode content) {
        List<Block> blocks = new ArrayList<>();
        if (content.isTextual()) {
            blocks.add(new TextBlock(content.asText()));
        } else if (content.isArray()) {
            for (JsonNode item : content) {
                Block block = readBlock(item);
                if (block != null) {
                    blocks.add(block);
                }
            }
        } else if (content.isObject()) {
            Block block = readBlock(content);
            if (block != null) {
                blocks.add(block);
            }
        }
        return blocks;
    }

    private Block readBlock(JsonNode item) {
        if (item.isTextual()) {
            return new TextBlock(item.asText());
        }
        if (!item.isObject()) {
            return null;
        }
        String type = item.path("type").asText("");
        return switch (type) {
            case Block.TEXT -> new TextBlock(item.path("text").asText(""));
            case Block.TOOL_USE -> new ToolInvocationBlock(
                item.path("id").asText(""),
                item.path("name").asText(""),
                argumentsOf(item.has("input") ? item.get("input") : item.path("arguments"))
            );
            case Block.TOOL_RESULT -> new ToolResultBlock(
                item.has("tool_use_id") ? item.path("tool_use_id").asText("") : item.path("invocationId").asText(""),
                textOf(item.path("content"))
            );
            default -> new UnsupportedBlock(type.isBlank() ? null : type, item.toString());
        };
    }

    private Map<String, Object> argumentsOf(JsonNode node) {
        if (node.isObject()) {
            return mapper.convertValue(node, MAP_TYPE);
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            try {
                JsonNode parsed = mapper.readTree(node.asText());
                if (parsed.isObject()) {
                    return mapper.convertValue(parsed, MAP_TYPE);
                }
            } catch (JsonProcessingException e) {
                LOG.debug("Tool arguments are not a JSON object: {}", e.getOriginalMessage());
            }
        }
        return Map.of();
    }

    private String textOf(JsonNode content) {
        if (content == null || content.isMissingNode() || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder text = new StringBuilder();
            for (JsonNode item : content) {
                String part = item.isTextual() ? item.asText() : item.path("text").asText("");
                if (part.isBlank()) {
                    continue;
                }
                if (!text.isEmpty()) {
                    text.append('\n');
                }
                text.append(part);
            }
            return text.toString();
        }
        return content.toString();
    }

    private Map<String, Object> writeBlock(Block block) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("type", block.type());
        if (block instanceof TextBlock text) {
            row.put("text", text.text());
        } else if (block instanceof ToolInvocationBlock invocation) {
            row.put("id", invocation.id());
            row.put("name", invocation.name());
            row.put("input", invocation.arguments());
        } else if (block instanceof ToolResultBlock result) {
            row.put("tool_use_id", result.invocationId());
            row.put("content", result.content());
        } else if (block instanceof UnsupportedBlock unsupported) {
            row.put("raw", unsupported.raw());
        }
        return row;
    }
}
