package com.example.rittdoc.exception;

/**
 * Raised when the same original path is registered twice with one reference mapper.
 */
public class DuplicateResourceException extends ConversionException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
