package io.parley.core.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.parley.core.model.ToolDefinition;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts the estimated tokens spent on tool definitions per request, split between requests that
 * were offered every tool (baseline) and requests offered a narrowed set (filtered).
 */
public final class ToolUsageMetrics {
    private static final Logger LOG = LoggerFactory.getLogger(ToolUsageMetrics.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock;
    private Phase baseline;
    private Phase filtered;

    public ToolUsageMetrics() {
        this(Clock.systemUTC());
    }

    public ToolUsageMetrics(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        reset();
    }

    public synchronized void record(ToolSelection selection) {
        long tokens = estimateTokens(selection.tools());
        if (selection.filtered()) {
            filtered = filtered.plus(tokens);
        } else {
            baseline = baseline.plus(tokens);
        }
    }

    public synchronized Report report() {
        PhaseReport base = baseline.report();
        PhaseReport narrowed = filtered.report();
        int reduction = base.averageTokens() > 0 && narrowed.averageTokens() > 0
            ? Math.round((base.averageTokens() - narrowed.averageTokens()) * 100f / base.averageTokens())
            : 0;
        return new Report(base, narrowed, reduction);
    }

    public synchronized void reset() {
        Instant now = clock.instant();
        baseline = new Phase(0, 0, now);
        filtered = new Phase(0, 0, now);
        LOG.debug("Tool usage metrics reset");
    }

    /** Roughly four characters per token over name, description and schema. */
    public long estimateTokens(List<ToolDefinition> tools) {
        double count = 0;
        for (ToolDefinition tool : tools) {
            count += tool.name().length() / 4.0;
            count += tool.description().length() / 4.0;
            count += schemaJson(tool).length() / 4.0;
        }
        return (long) Math.ceil(count);
    }

    private String schemaJson(ToolDefinition tool) {
        try {
            return mapper.writeValueAsString(tool.inputSchema());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Schema of tool " + tool.name() + " is not serializable", e);
        }
    }

    private record Phase(long requests, long totalTokens, Instant since) {

        Phase plus(long tokens) {
            return new Phase(requests + 1, totalTokens + tokens, since);
        }

        PhaseReport report() {
            long average = requests > 0 ? Math.round((double) totalTokens / requests) : 0;
            return new PhaseReport(requests, totalTokens, average, since);
        }
    }

    public record PhaseReport(long requests, long totalTokens, long averageTokens, Instant since) {
    }

    public record Report(PhaseReport baseline, PhaseReport filtered, int reductionPercent) {
    }
}
