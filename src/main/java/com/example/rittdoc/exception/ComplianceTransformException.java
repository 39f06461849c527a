package com.example.rittdoc.exception;

/**
 * Raised when a chapter cannot be rewritten into the DTD-legal form.
 */
public class ComplianceTransformException extends ConversionException {

    private final String chapterId;

    /**
     * @param chapterId chapter that failed
     * @param message   which rule could not be applied
     */
    public ComplianceTransformException(String chapterId, String message) {
        super(message);
        this.chapterId = chapterId;
    }

    public String getChapterId() {
        return chapterId;
    }
}
