package io.parley.core.conversation;

import static org.assertj.core.api.Assertions.assertThat;

import io.parley.core.model.Turn;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CacheAnnotatorTest {

    private final CacheAnnotator annotator = new CacheAnnotator();

    @Test
    void shouldNotMarkSingleTurn() {
        List<Turn> annotated = annotator.annotate(List.of(Turn.user("hello")));

        assertThat(CacheAnnotator.countMarkers(annotated)).isZero();
    }

    @Test
    void shouldMarkFirstAndLastUserTurns() {
        List<Turn> annotated = annotator.annotate(List.of(
            Turn.user("one"),
            Turn.assistant("two"),
            Turn.user("three")
        ));

        assertThat(annotated).extracting(Turn::cacheMarked).containsExactly(true, false, true);
    }

    @Test
    void shouldNeverExceedFourMarkers() {
        for (int size = 0; size <= 40; size++) {
            List<Turn> turns = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                turns.add(i % 2 == 0 ? Turn.user("u" + i) : Turn.assistant("a" + i));
            }

            assertThat(CacheAnnotator.countMarkers(annotator.annotate(turns)))
                .isLessThanOrEqualTo(CacheAnnotator.MAX_MARKERS);
        }
    }

    @Test
    void shouldMarkMidpointInLongConversations() {
        List<Turn> turns = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            turns.add(i % 2 == 0 ? Turn.user("u" + i) : Turn.assistant("a" + i));
        }
        turns.set(5, Turn.user("mid"));

        List<Turn> annotated = annotator.annotate(turns);

        assertThat(annotated.get(0).cacheMarked()).isTrue();
        assertThat(annotated.get(5).cacheMarked()).isTrue();
        assertThat(annotated.get(6).cacheMarked()).isTrue();
        assertThat(annotated.get(8).cacheMarked()).isTrue();
        assertThat(CacheAnnotator.countMarkers(annotated)).isEqualTo(4);
    }

    @Test
    void shouldClearStaleMarkersAndBeDeterministic() {
        List<Turn> turns = List.of(
            Turn.user("one"),
            Turn.assistant("two").withCacheMarker(),
            Turn.user("three"),
            Turn.assistant("four").withCacheMarker()
        );

        List<Turn> first = annotator.annotate(turns);
        List<Turn> second = annotator.annotate(first);

        assertThat(first.get(1).cacheMarked()).isFalse();
        assertThat(first.get(3).cacheMarked()).isFalse();
        assertThat(second).isEqualTo(first);
    }
}
