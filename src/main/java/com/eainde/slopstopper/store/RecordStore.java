package com.eainde.slopstopper.store;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent table of canonical records keyed by video id.
 * <p>
 * Status transitions are conditional updates evaluated by the database; callers never
 * read-then-write a status. That is the only coordination between concurrent workers
 * and between separate processes.
 */
public interface RecordStore {

    Optional<VideoRecord> findById(String id);

    List<VideoRecord> findByStatus(RecordStatus status);

    Map<RecordStatus, Integer> countByStatus();

    /**
     * Inserts the video as new, or merges its metadata into the existing row.
     * Status, verdict, indices and provenance of an existing row are never touched.
     */
    UpsertOutcome upsert(IngestedVideo video);

    /**
     * Ids that a batch may try to claim: PENDING, plus IN_PROGRESS rows claimed before
     * {@code staleBefore}. Most recently watched first.
     *
     * @param limit maximum number of ids, or {@code null} for all
     */
    List<String> findClaimable(Instant staleBefore, Integer limit);

    /**
     * Atomically moves PENDING (or stale IN_PROGRESS) to IN_PROGRESS.
     *
     * @return the claim, or empty if the record is missing or held/finished elsewhere
     */
    Optional<Claim> claim(String id, Instant now, Instant staleBefore);

    /**
     * IN_PROGRESS to ANALYZED with verdict, indices and provenance in one update.
     *
     * @return false if the claim is no longer held
     */
    boolean markAnalyzed(Claim claim, AnalysisResult result, Instant analyzedAt);

    /**
     * IN_PROGRESS to ERROR.
     *
     * @return false if the claim is no longer held
     */
    boolean markError(Claim claim, String errorDetail, String modelUsed);

    /**
     * Operator re-analysis: ANALYZED or ERROR back to PENDING, clearing the previous outcome.
     */
    int resetToPending(Collection<String> ids);

    int resetAllErrors();

    /**
     * Attaches transcript text produced by an external fetcher.
     */
    boolean updateTranscript(String id, TranscriptStatus status, String transcriptText);
}
