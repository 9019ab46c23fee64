package com.eainde.slopstopper.ingest;

import com.eainde.slopstopper.error.MalformedEntryException;
import com.eainde.slopstopper.store.IngestedVideo;
import com.eainde.slopstopper.store.RecordStore;
import com.eainde.slopstopper.store.UpsertOutcome;
import com.eainde.slopstopper.store.WatchMetadata;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns raw history entries into record-store upserts.
 * <p>
 * Entries of one run are first collapsed per id, so the order of the input has no effect,
 * and the store merge only ever touches metadata. Re-running the same or an overlapping
 * export converges on the same store state. No network or LLM calls happen here.
 */
@Slf4j
public class HistoryIngestor {

    private final RecordStore recordStore;
    private final VideoIdExtractor idExtractor;
    private final Set<String> acceptedProducts;

    public HistoryIngestor(RecordStore recordStore, VideoIdExtractor idExtractor, Collection<String> acceptedProducts) {
        this.recordStore = recordStore;
        this.idExtractor = idExtractor;
        this.acceptedProducts = Set.copyOf(acceptedProducts);
    }

    public IngestionReport ingest(List<HistoryEntry> entries) {
        Map<String, IngestedVideo> byId = new TreeMap<>();
        int duplicates = 0;
        int skippedEntries = 0;

        for (HistoryEntry entry : entries) {
            IngestedVideo video = toVideo(entry);
            if (video.isSkipped()) {
                skippedEntries++;
            }
            IngestedVideo previous = byId.get(video.id());
            if (previous != null) {
                duplicates++;
                byId.put(video.id(), previous.mergeWith(video));
            } else {
                byId.put(video.id(), video);
            }
        }

        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        for (IngestedVideo video : byId.values()) {
            UpsertOutcome outcome = recordStore.upsert(video);
            if (video.isSkipped()) {
                continue;
            }
            switch (outcome) {
                case INSERTED -> inserted++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
            }
        }

        IngestionReport report = new IngestionReport(entries.size(), inserted, updated, unchanged,
                skippedEntries, duplicates);
        log.info("Ingestion finished: entries={}, inserted={}, updated={}, unchanged={}, skipped={}, duplicates={}",
                report.entries(), report.inserted(), report.updated(), report.unchanged(),
                report.skipped(), report.duplicates());
        return report;
    }

    IngestedVideo toVideo(HistoryEntry entry) {
        WatchMetadata metadata = new WatchMetadata(
                entry.title(),
                idExtractor.extractChannelId(entry.channelUrl()).orElse(null),
                entry.channelName(),
                entry.channelUrl(),
                entry.watchedAt());
        try {
            String videoId = resolveId(entry);
            return IngestedVideo.pending(videoId, idExtractor.canonicalUrl(videoId), metadata);
        } catch (MalformedEntryException e) {
            log.debug("Skipping entry '{}': {}", entry.url(), e.getMessage());
            return IngestedVideo.skipped(syntheticId(entry), entry.url(), metadata, e.getMessage());
        }
    }

    private String resolveId(HistoryEntry entry) {
        if (entry.product() != null && !acceptedProducts.contains(entry.product())) {
            throw new MalformedEntryException("unsupported product: " + entry.product());
        }
        if (entry.url() == null) {
            throw new MalformedEntryException("no url");
        }
        return idExtractor.extract(entry.url())
                .orElseThrow(() -> new MalformedEntryException("no video id in url: " + entry.url()));
    }

    /**
     * Stable id for an entry without a video id, so re-ingesting it finds the same SKIPPED row.
     */
    static String syntheticId(HistoryEntry entry) {
        String key = entry.product() + "|" + entry.url() + "|" + entry.rawTime() + "|" + entry.title();
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return "skipped-" + HexFormat.of().formatHex(digest, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
