package com.example.rittdoc.exception;

/**
 * Raised when DTD validation cannot actually be performed, so that a missing validator never reads as a pass.
 */
public class SchemaValidationUnavailableException extends ConversionException {

    public SchemaValidationUnavailableException(String message) {
        super(message);
    }

    public SchemaValidationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
