package com.example.rittdoc.exception;

/**
 * Raised when the output archive cannot be assembled.
 */
public class PackagingException extends ConversionException {

    public PackagingException(String message) {
        super(message);
    }

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
