package io.parley.core.conversation;

import io.parley.core.model.Turn;
import java.util.List;

public record RepairOutcome(
    List<Turn> turns,
    int droppedTurns,
    int orphanedResults,
    int placeholderTurns,
    int unsupportedBlocks
) {
    public RepairOutcome {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    static RepairOutcome unchanged(List<Turn> turns) {
        return new RepairOutcome(turns, 0, 0, 0, 0);
    }

    public boolean changed() {
        return droppedTurns > 0 || orphanedResults > 0 || placeholderTurns > 0 || unsupportedBlocks > 0;
    }
}
