package com.eainde.slopstopper.analysis;

import com.eainde.slopstopper.schema.ValidatedVerdict;

/**
 * Outcome of one build-invoke-validate pass.
 *
 * @param modelUsed model that actually answered, as reported by the provider
 */
public record PassResult(String modelUsed,
                         ValidatedVerdict verdict,
                         int inputTokens,
                         int outputTokens) {
}
