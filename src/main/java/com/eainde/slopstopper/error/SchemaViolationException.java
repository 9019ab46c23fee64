package com.eainde.slopstopper.error;

/**
 * Provider output that does not satisfy the verdict contract.
 * Never retried: malformed output points at the model or the prompt, not at the network.
 */
public class SchemaViolationException extends PipelineException {

    private final String field;
    private final String reason;

    public SchemaViolationException(String field, String reason) {
        super(field + " " + reason);
        this.field = field;
        this.reason = reason;
    }

    public SchemaViolationException(String field, String reason, Throwable cause) {
        super(field + " " + reason, cause);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String kind() {
        return "SchemaViolation";
    }
}
