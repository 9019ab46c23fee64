package com.eainde.slopstopper.provider;

import com.eainde.slopstopper.error.FatalPreconditionException;

import java.time.Duration;

/**
 * Connection and retry settings for the analysis provider.
 *
 * @param mode           {@code gemini} or {@code mock}
 * @param maxAttempts    total attempts per record, first call included
 * @param initialBackoff delay before the second attempt; doubles after each failure
 */
public record ProviderSettings(String mode,
                               String apiKey,
                               String model,
                               Double temperature,
                               Duration timeout,
                               int maxAttempts,
                               Duration initialBackoff) {

    public static final String MODE_GEMINI = "gemini";
    public static final String MODE_MOCK = "mock";

    public boolean isMock() {
        return MODE_MOCK.equalsIgnoreCase(mode);
    }

    /**
     * The model name written to {@code model_used}; mock mode always reports {@code mock}.
     */
    public String effectiveModel() {
        return isMock() ? MODE_MOCK : model;
    }

    /**
     * Checked before a batch claims anything.
     *
     * @throws FatalPreconditionException when the provider cannot possibly be reached
     */
    public void verifyReady() {
        if (!isMock() && !MODE_GEMINI.equalsIgnoreCase(mode)) {
            throw new FatalPreconditionException("unknown provider mode '" + mode + "'");
        }
        if (!isMock() && (apiKey == null || apiKey.isBlank())) {
            throw new FatalPreconditionException("GEMINI_API_KEY is not set");
        }
        if (model == null || model.isBlank()) {
            throw new FatalPreconditionException("no provider model configured");
        }
        if (maxAttempts < 1) {
            throw new FatalPreconditionException("max-attempts must be at least 1, was " + maxAttempts);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new FatalPreconditionException("provider timeout must be positive");
        }
    }
}
