package com.example.plantreport.infrastructure.exception;

/**
 * Signals that a generated report could not be written to or read from the ephemeral report directory.
 */
public class ReportStorageException extends InfrastructureException {

    public ReportStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
