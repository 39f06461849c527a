package com.example.rittdoc.exception;

/**
 * Raised when a source file is neither a PDF nor an EPUB.
 */
public class UnsupportedSourceFormatException extends ConversionException {

    public UnsupportedSourceFormatException(String message) {
        super(message);
    }

    public UnsupportedSourceFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
