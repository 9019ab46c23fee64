package com.eainde.slopstopper.error;

/**
 * Failure talking to the analysis provider: timeouts, rate limits, 5xx, broken connections.
 * Non-retryable transport failures (bad credentials, invalid request) skip the backoff loop.
 */
public class TransportException extends PipelineException {

    private final boolean retryable;

    public TransportException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TransportException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public String kind() {
        return "TransportError";
    }
}
