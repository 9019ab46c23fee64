package com.eainde.slopstopper.ingest;

import java.time.Instant;

/**
 * One raw watch-history entry as exported by the source platform. Any field may be missing.
 *
 * @param product     export section the entry came from, e.g. "YouTube" or "YouTube Music"
 * @param rawTime     the timestamp exactly as exported, kept for deterministic ids of skipped entries
 */
public record HistoryEntry(String product,
                           String title,
                           String url,
                           String channelName,
                           String channelUrl,
                           Instant watchedAt,
                           String rawTime) {
}
