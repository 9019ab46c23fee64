package com.eainde.slopstopper.store;

import java.time.Instant;

/**
 * Exclusive hold on one record between PENDING/stale IN_PROGRESS and a terminal state.
 * The token guards the resolving update, so a holder whose claim was swept cannot
 * overwrite the attempt that reclaimed it.
 */
public record Claim(String videoId, String token, Instant claimedAt) {
}
