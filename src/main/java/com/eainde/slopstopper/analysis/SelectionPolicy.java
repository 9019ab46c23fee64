package com.eainde.slopstopper.analysis;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Which records a batch processes: an explicit id set, the N most recently watched
 * claimable records, or every claimable record.
 */
public final class SelectionPolicy {

    public enum Mode { IDS, LIMIT, ALL }

    private final Mode mode;
    private final List<String> ids;
    private final int limit;

    private SelectionPolicy(Mode mode, List<String> ids, int limit) {
        this.mode = mode;
        this.ids = ids;
        this.limit = limit;
    }

    /**
     * Duplicates are dropped; first occurrence order is kept.
     */
    public static SelectionPolicy ids(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("At least one id is required");
        }
        return new SelectionPolicy(Mode.IDS, List.copyOf(new LinkedHashSet<>(ids)), 0);
    }

    public static SelectionPolicy limit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive, was " + limit);
        }
        return new SelectionPolicy(Mode.LIMIT, List.of(), limit);
    }

    public static SelectionPolicy all() {
        return new SelectionPolicy(Mode.ALL, List.of(), 0);
    }

    public Mode mode() {
        return mode;
    }

    public List<String> ids() {
        return ids;
    }

    public int limit() {
        return limit;
    }

    @Override
    public String toString() {
        return switch (mode) {
            case IDS -> "ids" + ids;
            case LIMIT -> "limit " + limit;
            case ALL -> "all";
        };
    }
}
