package com.eainde.slopstopper.store;

import java.math.BigDecimal;

/**
 * Everything written in the single update that moves a record to ANALYZED.
 */
public record AnalysisResult(String analysisJson,
                             int safetyScore,
                             String primaryGenre,
                             boolean slop,
                             boolean brainrot,
                             Boolean isShort,
                             String verdictAction,
                             String modelUsed,
                             String schemaVersion,
                             int inputTokens,
                             int outputTokens,
                             BigDecimal estimatedCost) {
}
