package com.eainde.slopstopper.store;

public enum TranscriptStatus {
    MISSING,
    FETCHED,
    UNAVAILABLE
}
