package io.parley.core.conversation;

import io.parley.core.model.Turn;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses which turns carry a prompt-cache marker for one outbound call.
 *
 * <p>Candidates, in priority order: the first user turn; the turn at the midpoint when the
 * conversation has six or more turns and that turn is a user turn; the second-to-last user turn;
 * the last user turn. A candidate that is already marked does not consume quota, and no more than
 * {@link #MAX_MARKERS} turns are ever marked. Markers present on the input are cleared first.
 */
public final class CacheAnnotator {
    private static final Logger LOG = LoggerFactory.getLogger(CacheAnnotator.class);

    public static final int MAX_MARKERS = 4;
    private static final int MIDPOINT_MIN_TURNS = 6;

    public List<Turn> annotate(List<Turn> turns) {
        if (turns == null || turns.isEmpty()) {
            return List.of();
        }
        List<Turn> result = new ArrayList<>(turns.size());
        for (Turn turn : turns) {
            result.add(Objects.requireNonNull(turn, "turn must not be null").withoutCacheMarker());
        }
        if (result.size() <= 1) {
            return List.copyOf(result);
        }

        Set<Integer> marked = new LinkedHashSet<>();
        for (int candidate : candidates(result)) {
            if (marked.size() >= MAX_MARKERS) {
                break;
            }
            if (candidate < 0 || result.get(candidate).blocks().isEmpty()) {
                continue;
            }
            if (marked.add(candidate)) {
                result.set(candidate, result.get(candidate).withCacheMarker());
            }
        }

        LOG.debug("Applied {} cache markers to {} turns (max {})", marked.size(), result.size(), MAX_MARKERS);
        return List.copyOf(result);
    }

    public static int countMarkers(List<Turn> turns) {
        if (turns == null) {
            return 0;
        }
        return (int) turns.stream().filter(Turn::cacheMarked).count();
    }

    private List<Integer> candidates(List<Turn> turns) {
        List<Integer> candidates = new ArrayList<>(MAX_MARKERS);
        candidates.add(firstUserIndex(turns));

        if (turns.size() >= MIDPOINT_MIN_TURNS) {
            int middle = turns.size() / 2;
            candidates.add(turns.get(middle).isUser() ? middle : -1);
        }

        int lastUser = lastUserIndexBefore(turns, turns.size());
        int secondToLastUser = lastUser < 0 ? -1 : lastUserIndexBefore(turns, lastUser);
        candidates.add(secondToLastUser);
        candidates.add(lastUser);
        return candidates;
    }

    private int firstUserIndex(List<Turn> turns) {
        for (int i = 0; i < turns.size(); i++) {
            if (turns.get(i).isUser()) {
                return i;
            }
        }
        return -1;
    }

    private int lastUserIndexBefore(List<Turn> turns, int exclusiveEnd) {
        for (int i = exclusiveEnd - 1; i >= 0; i--) {
            if (turns.get(i).isUser()) {
                return i;
            }
        }
        return -1;
    }
}
