package com.eainde.slopstopper.analysis;

import java.math.BigDecimal;

/**
 * Per-record line of a batch summary.
 *
 * @param detail error detail for failures, {@code null} otherwise
 */
public record RecordOutcome(String videoId,
                            Resolution resolution,
                            String modelUsed,
                            int inputTokens,
                            int outputTokens,
                            BigDecimal estimatedCost,
                            String detail) {

    public static RecordOutcome analyzed(String videoId, PassResult pass, BigDecimal cost) {
        return new RecordOutcome(videoId, Resolution.ANALYZED, pass.modelUsed(),
                pass.inputTokens(), pass.outputTokens(), cost, null);
    }

    public static RecordOutcome of(String videoId, Resolution resolution, String modelUsed, String detail) {
        return new RecordOutcome(videoId, resolution, modelUsed, 0, 0, BigDecimal.ZERO, detail);
    }

    public static RecordOutcome of(String videoId, Resolution resolution) {
        return of(videoId, resolution, null, null);
    }
}
