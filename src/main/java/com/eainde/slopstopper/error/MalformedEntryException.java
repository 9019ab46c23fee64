package com.eainde.slopstopper.error;

/**
 * A raw history entry that cannot be turned into a canonical record.
 */
public class MalformedEntryException extends PipelineException {

    public MalformedEntryException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "MalformedEntry";
    }
}
