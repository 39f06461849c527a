package com.example.rittdoc.exception;

/**
 * Raised when a source document cannot be read. Fatal for the job.
 */
public class ExtractionException extends ConversionException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
