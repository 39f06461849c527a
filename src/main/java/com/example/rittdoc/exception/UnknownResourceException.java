package com.example.rittdoc.exception;

/**
 * Raised when an operation names a resource the reference mapper never registered.
 */
public class UnknownResourceException extends ConversionException {

    public UnknownResourceException(String message) {
        super(message);
    }

    public UnknownResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
