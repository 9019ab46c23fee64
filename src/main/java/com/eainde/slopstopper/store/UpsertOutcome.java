package com.eainde.slopstopper.store;

public enum UpsertOutcome {
    INSERTED,
    UPDATED,
    UNCHANGED
}
