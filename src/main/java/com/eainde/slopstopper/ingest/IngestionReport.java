package com.eainde.slopstopper.ingest;

/**
 * Counts for one ingestion run.
 *
 * @param entries    raw entries read
 * @param inserted   new PENDING records
 * @param updated    existing records whose metadata changed
 * @param unchanged  existing records already up to date
 * @param skipped    entries written (or kept) as SKIPPED
 * @param duplicates entries collapsed onto another entry of the same run
 */
public record IngestionReport(int entries,
                              int inserted,
                              int updated,
                              int unchanged,
                              int skipped,
                              int duplicates) {
}
