package com.eainde.slopstopper.store;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row of the record store: identity, content, lifecycle, provenance, derived indices and the verdict.
 */
public record VideoRecord(
        String id,
        String title,
        String url,
        String channelId,
        String channelName,
        String channelUrl,
        Instant watchedAt,
        String transcriptText,
        TranscriptStatus transcriptStatus,
        RecordStatus status,
        String errorDetail,
        String skipReason,
        Instant claimedAt,
        String modelUsed,
        String schemaVersion,
        Integer inputTokens,
        Integer outputTokens,
        BigDecimal estimatedCost,
        Integer safetyScore,
        String primaryGenre,
        Boolean slop,
        Boolean brainrot,
        Boolean isShort,
        String verdictAction,
        String analysisPayload,
        Instant analyzedAt
) {

    public boolean hasTranscript() {
        return transcriptStatus == TranscriptStatus.FETCHED && transcriptText != null && !transcriptText.isBlank();
    }
}
