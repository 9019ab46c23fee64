package com.eainde.slopstopper.store;

import java.time.Instant;
import java.util.Comparator;
import java.util.function.Predicate;

/**
 * Mutable metadata of a record, the only part re-ingestion is allowed to change.
 * <p>
 * The title and the channel (id, name, url together) each remember when they were seen.
 * {@link #mergeWith(WatchMetadata)} keeps, per group, the maximum of
 * {@code (seenAt, value)} over the non-blank candidates, and the latest {@code watchedAt}.
 * Every choice is a maximum over one total order, so merging is commutative, associative
 * and idempotent: any order or grouping of the same entries gives the same result.
 *
 * @param titleSeenAt   watch time of the entry the title came from, {@code null} without a title
 * @param channelSeenAt watch time of the entry the channel came from, {@code null} without a channel
 */
public record WatchMetadata(String title,
                            String channelId,
                            String channelName,
                            String channelUrl,
                            Instant watchedAt,
                            Instant titleSeenAt,
                            Instant channelSeenAt) {

    private static final Comparator<Instant> INSTANT_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<String> TEXT_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());

    private static final Comparator<WatchMetadata> TITLE_ORDER = Comparator
            .comparing(WatchMetadata::titleSeenAt, INSTANT_ORDER)
            .thenComparing(WatchMetadata::title, TEXT_ORDER);

    private static final Comparator<WatchMetadata> CHANNEL_ORDER = Comparator
            .comparing(WatchMetadata::channelSeenAt, INSTANT_ORDER)
            .thenComparing(WatchMetadata::channelId, TEXT_ORDER)
            .thenComparing(WatchMetadata::channelName, TEXT_ORDER)
            .thenComparing(WatchMetadata::channelUrl, TEXT_ORDER);

    public WatchMetadata {
        title = blankToNull(title);
        channelId = blankToNull(channelId);
        channelName = blankToNull(channelName);
        channelUrl = blankToNull(channelUrl);
        if (title == null) {
            titleSeenAt = null;
        }
        if (channelId == null && channelName == null && channelUrl == null) {
            channelSeenAt = null;
        }
    }

    /**
     * Metadata of a single history entry: everything in it was seen at {@code watchedAt}.
     */
    public WatchMetadata(String title, String channelId, String channelName, String channelUrl, Instant watchedAt) {
        this(title, channelId, channelName, channelUrl, watchedAt, watchedAt, watchedAt);
    }

    public boolean hasTitle() {
        return title != null;
    }

    public boolean hasChannel() {
        return channelId != null || channelName != null || channelUrl != null;
    }

    public WatchMetadata mergeWith(WatchMetadata other) {
        if (other == null || this.equals(other)) {
            return this;
        }
        WatchMetadata titleSource = max(this, other, TITLE_ORDER, WatchMetadata::hasTitle);
        WatchMetadata channelSource = max(this, other, CHANNEL_ORDER, WatchMetadata::hasChannel);
        Instant latest = INSTANT_ORDER.compare(this.watchedAt, other.watchedAt) >= 0 ? this.watchedAt : other.watchedAt;
        return new WatchMetadata(
                titleSource == null ? null : titleSource.title,
                channelSource == null ? null : channelSource.channelId,
                channelSource == null ? null : channelSource.channelName,
                channelSource == null ? null : channelSource.channelUrl,
                latest,
                titleSource == null ? null : titleSource.titleSeenAt,
                channelSource == null ? null : channelSource.channelSeenAt);
    }

    private static WatchMetadata max(WatchMetadata a, WatchMetadata b, Comparator<WatchMetadata> order,
                                     Predicate<WatchMetadata> present) {
        boolean hasA = present.test(a);
        boolean hasB = present.test(b);
        if (!hasA || !hasB) {
            return hasA ? a : hasB ? b : null;
        }
        return order.compare(a, b) >= 0 ? a : b;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
