package io.parley.core.conversation;

import io.parley.core.model.Block;
import io.parley.core.model.TextBlock;
import io.parley.core.model.ToolInvocationBlock;
import io.parley.core.model.ToolResultBlock;
import io.parley.core.model.Turn;
import io.parley.core.model.UnsupportedBlock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes a turn sequence so that it satisfies the structural rules every provider enforces.
 *
 * <p>Every tool result that survives repair answers a tool invocation defined in a strictly
 * earlier turn, and each invocation id is answered at most once. Results that break this rule
 * are not discarded: they are rewritten as plain text in a turn of their own, so the model can
 * still read them. Repair is pure and never throws; if normalization itself fails the input is
 * returned as-is.
 */
public final class ConversationRepairer {
    private static final Logger LOG = LoggerFactory.getLogger(ConversationRepairer.class);

    static final String ORPHANED_RESULT_PREFIX = "[Tool Result]: ";
    static final String PLACEHOLDER_TEXT = "[Empty message]";

    public List<Turn> repair(List<Turn> turns) {
        return repairWithReport(turns).turns();
    }

    public RepairOutcome repairWithReport(List<Turn> turns) {
        if (turns == null || turns.isEmpty()) {
            return RepairOutcome.unchanged(List.of());
        }
        try {
            RepairOutcome outcome = normalize(turns);
            if (outcome.changed()) {
                LOG.debug(
                    "Repaired conversation: {} -> {} turns (dropped={}, orphaned={}, placeholders={}, unsupported={})",
                    turns.size(),
                    outcome.turns().size(),
                    outcome.droppedTurns(),
                    outcome.orphanedResults(),
                    outcome.placeholderTurns(),
                    outcome.unsupportedBlocks()
                );
            }
            return outcome;
        } catch (RuntimeException e) {
            LOG.warn("Conversation repair failed; sending history unrepaired", e);
            return RepairOutcome.unchanged(turns.stream().filter(Objects::nonNull).toList());
        }
    }

    private RepairOutcome normalize(List<Turn> turns) {
        int dropped = 0;
        int unsupported = 0;

        List<Turn> present = new ArrayList<>();
        List<List<Block>> validBlocks = new ArrayList<>();
        for (Turn turn : turns) {
            if (turn == null || turn.blocks().isEmpty()) {
                dropped++;
                continue;
            }
            List<Block> blocks = new ArrayList<>();
            for (Block block : turn.blocks()) {
                Block normalized = normalizeBlock(block);
                if (normalized != null && normalized != block) {
                    unsupported++;
                }
                if (normalized != null) {
                    blocks.add(normalized);
                }
            }
            present.add(turn);
            validBlocks.add(blocks);
        }

        Map<String, Integer> definedAt = new HashMap<>();
        for (int i = 0; i < validBlocks.size(); i++) {
            for (Block block : validBlocks.get(i)) {
                if (block instanceof ToolInvocationBlock invocation) {
                    definedAt.putIfAbsent(invocation.id(), i);
                }
            }
        }

        int orphaned = 0;
        int placeholders = 0;
        Set<String> answered = new HashSet<>();
        List<Turn> repaired = new ArrayList<>();
        for (int i = 0; i < present.size(); i++) {
            Turn turn = present.get(i);
            List<Block> kept = new ArrayList<>();
            List<Block> orphans = new ArrayList<>();
            for (Block block : validBlocks.get(i)) {
                if (block instanceof ToolResultBlock result) {
                    Integer definingTurn = definedAt.get(result.invocationId());
                    if (definingTurn != null && definingTurn < i && answered.add(result.invocationId())) {
                        kept.add(result);
                    } else {
                        orphans.add(new TextBlock(ORPHANED_RESULT_PREFIX + result.content()));
                    }
                } else {
                    kept.add(block);
                }
            }

            if (kept.isEmpty() && orphans.isEmpty()) {
                repaired.add(new Turn(turn.role(), List.of(new TextBlock(PLACEHOLDER_TEXT))));
                placeholders++;
                continue;
            }
            if (!kept.isEmpty()) {
                repaired.add(new Turn(turn.role(), kept));
            }
            if (!orphans.isEmpty()) {
                repaired.add(new Turn(turn.role(), orphans));
                orphaned += orphans.size();
            }
        }

        return new RepairOutcome(repaired, dropped, orphaned, placeholders, unsupported);
    }

    /** Returns the block, a text stand-in for an unsupported block, or null when it is invalid. */
    private Block normalizeBlock(Block block) {
        if (block instanceof TextBlock text) {
            return text.isBlank() ? null : text;
        }
        if (block instanceof ToolInvocationBlock invocation) {
            return invocation.isValid() ? invocation : null;
        }
        if (block instanceof ToolResultBlock result) {
            return result;
        }
        if (block instanceof UnsupportedBlock unsupported) {
            return new TextBlock("[Unsupported content block: " + unsupported.tag() + "]");
        }
        return new TextBlock("[Unsupported content block: " + block.type() + "]");
    }
}
