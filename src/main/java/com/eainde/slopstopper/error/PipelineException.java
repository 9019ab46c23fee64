package com.eainde.slopstopper.error;

/**
 * Base type for failures raised by the ingestion and analysis pipeline.
 * <p>
 * Every subtype maps to one resolution kind; {@link #kind()} is the prefix written
 * into a record's {@code error_detail}.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String kind();

    /**
     * Formats the failure the way it is persisted: {@code <Kind>: <message>}.
     */
    public String toErrorDetail() {
        return kind() + ": " + getMessage();
    }
}
