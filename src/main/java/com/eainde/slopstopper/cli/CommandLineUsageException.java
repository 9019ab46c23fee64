package com.eainde.slopstopper.cli;

/**
 * Bad command line; reported with the usage text and exit code 2.
 */
public class CommandLineUsageException extends RuntimeException {

    public CommandLineUsageException(String message) {
        super(message);
    }
}
