package com.eainde.slopstopper.store;

/**
 * Canonical form of a history entry, ready to be upserted.
 * Only {@link RecordStatus#PENDING} and {@link RecordStatus#SKIPPED} are valid initial states.
 */
public record IngestedVideo(String id,
                            String url,
                            WatchMetadata metadata,
                            RecordStatus initialStatus,
                            String skipReason) {

    public static IngestedVideo pending(String id, String url, WatchMetadata metadata) {
        return new IngestedVideo(id, url, metadata, RecordStatus.PENDING, null);
    }

    public static IngestedVideo skipped(String id, String url, WatchMetadata metadata, String reason) {
        return new IngestedVideo(id, url, metadata, RecordStatus.SKIPPED, reason);
    }

    public boolean isSkipped() {
        return initialStatus == RecordStatus.SKIPPED;
    }

    /**
     * Combines two occurrences of the same id seen in one ingestion run.
     */
    public IngestedVideo mergeWith(IngestedVideo other) {
        if (!id.equals(other.id)) {
            throw new IllegalArgumentException("Cannot merge " + id + " with " + other.id);
        }
        return new IngestedVideo(id, url != null ? url : other.url,
                metadata.mergeWith(other.metadata), initialStatus, skipReason);
    }
}
