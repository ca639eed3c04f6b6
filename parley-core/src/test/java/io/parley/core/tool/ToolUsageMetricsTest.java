package io.parley.core.tool;

import static org.assertj.core.api.Assertions.assertThat;

import io.parley.core.model.ToolDefinition;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolUsageMetricsTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private final ToolUsageMetrics metrics = new ToolUsageMetrics(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void shouldEstimateFourCharactersPerToken() {
        ToolDefinition tool = new ToolDefinition("abcd", "12345678", null);

        // {"type":"object","properties":{}} is 33 characters
        assertThat(metrics.estimateTokens(List.of(tool))).isEqualTo(12);
        assertThat(metrics.estimateTokens(List.of())).isZero();
    }

    @Test
    void shouldSplitBaselineAndFilteredRequests() {
        List<ToolDefinition> all = List.of(
            new ToolDefinition("create_note", "Create a new note with title and content", null),
            new ToolDefinition("list_notes", "List the notes of this session", null)
        );
        metrics.record(new ToolSelection(all, ToolSelection.Method.ALL, 2));
        metrics.record(new ToolSelection(all, ToolSelection.Method.ALL, 2));
        metrics.record(new ToolSelection(all.subList(0, 1), ToolSelection.Method.KEYWORD, 2));

        ToolUsageMetrics.Report report = metrics.report();

        assertThat(report.baseline().requests()).isEqualTo(2);
        assertThat(report.baseline().totalTokens()).isEqualTo(2 * metrics.estimateTokens(all));
        assertThat(report.filtered().requests()).isEqualTo(1);
        assertThat(report.filtered().averageTokens()).isEqualTo(metrics.estimateTokens(all.subList(0, 1)));
        assertThat(report.reductionPercent()).isBetween(1, 99);
        assertThat(report.baseline().since()).isEqualTo(NOW);
    }

    @Test
    void shouldReportNoReductionWithoutBothPhases() {
        metrics.record(new ToolSelection(List.of(new ToolDefinition("a", "b", null)), ToolSelection.Method.ALL, 1));

        assertThat(metrics.report().reductionPercent()).isZero();
    }

    @Test
    void shouldClearCountersOnReset() {
        metrics.record(new ToolSelection(List.of(new ToolDefinition("a", "b", null)), ToolSelection.Method.ALL, 1));

        metrics.reset();

        assertThat(metrics.report().baseline().requests()).isZero();
        assertThat(metrics.report().baseline().totalTokens()).isZero();
    }
}
