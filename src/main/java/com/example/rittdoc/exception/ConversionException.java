package com.example.rittdoc.exception;

/**
 * Base type for all failures raised by the conversion pipeline.
 */
public abstract class ConversionException extends RuntimeException {

    /**
     * Creates a conversion exception with a descriptive failure message.
     *
     * @param message what went wrong
     */
    protected ConversionException(String message) {
        super(message);
    }

    /**
     * Creates a conversion exception that wraps an underlying cause.
     *
     * @param message what went wrong
     * @param cause   original exception
     */
    protected ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
