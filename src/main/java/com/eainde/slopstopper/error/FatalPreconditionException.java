package com.eainde.slopstopper.error;

/**
 * Missing credentials or configuration. Aborts a batch before any record is claimed.
 */
public class FatalPreconditionException extends PipelineException {

    public FatalPreconditionException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "FatalPrecondition";
    }
}
