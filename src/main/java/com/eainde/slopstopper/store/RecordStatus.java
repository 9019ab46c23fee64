package com.eainde.slopstopper.store;

public enum RecordStatus {
    PENDING,
    IN_PROGRESS,
    ANALYZED,
    ERROR,
    SKIPPED
}
