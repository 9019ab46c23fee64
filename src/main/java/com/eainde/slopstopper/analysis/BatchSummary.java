package com.eainde.slopstopper.analysis;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated result of one orchestration batch: per-record outcomes, counts per
 * resolution kind, and token and cost totals.
 */
public class BatchSummary {

    private final List<RecordOutcome> outcomes;
    private final Map<Resolution, Integer> counts;
    private final long totalInputTokens;
    private final long totalOutputTokens;
    private final BigDecimal totalCost;

    private BatchSummary(List<RecordOutcome> outcomes) {
        this.outcomes = List.copyOf(outcomes);
        Map<Resolution, Integer> byKind = new EnumMap<>(Resolution.class);
        long in = 0;
        long out = 0;
        BigDecimal cost = BigDecimal.ZERO;
        for (RecordOutcome outcome : outcomes) {
            byKind.merge(outcome.resolution(), 1, Integer::sum);
            in += outcome.inputTokens();
            out += outcome.outputTokens();
            if (outcome.estimatedCost() != null) {
                cost = cost.add(outcome.estimatedCost());
            }
        }
        this.counts = Collections.unmodifiableMap(byKind);
        this.totalInputTokens = in;
        this.totalOutputTokens = out;
        this.totalCost = cost;
    }

    public static BatchSummary aggregate(List<RecordOutcome> outcomes) {
        return new BatchSummary(outcomes);
    }

    public static BatchSummary empty() {
        return new BatchSummary(List.of());
    }

    public List<RecordOutcome> getOutcomes() {
        return outcomes;
    }

    public int count(Resolution resolution) {
        return counts.getOrDefault(resolution, 0);
    }

    public Map<Resolution, Integer> getCounts() {
        return counts;
    }

    public int getTotalCount() {
        return outcomes.size();
    }

    public int getErrorCount() {
        return (int) outcomes.stream().filter(o -> o.resolution().isError()).count();
    }

    public long getTotalInputTokens() {
        return totalInputTokens;
    }

    public long getTotalOutputTokens() {
        return totalOutputTokens;
    }

    public BigDecimal getTotalCost() {
        return totalCost;
    }

    @Override
    public String toString() {
        return "BatchSummary{records=" + outcomes.size() + ", counts=" + counts
                + ", inputTokens=" + totalInputTokens + ", outputTokens=" + totalOutputTokens
                + ", cost=" + totalCost.toPlainString() + "}";
    }
}
