package com.example.rittdoc.model;

import com.example.rittdoc.exception.UnsupportedSourceFormatException;

import java.nio.file.Path;
import java.util.Locale;

public enum SourceFormat {
    PDF,
    EPUB;

    /**
     * Infers the format from the file extension. Anything other than .pdf, .epub or .epub3 is rejected.
     */
    public static SourceFormat fromPath(Path path) {
        if (path == null || path.getFileName() == null) {
            throw new UnsupportedSourceFormatException("No source file given");
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".pdf")) {
            return PDF;
        }
        if (name.endsWith(".epub") || name.endsWith(".epub3")) {
            return EPUB;
        }
        throw new UnsupportedSourceFormatException("Unsupported source file extension: " + path.getFileName());
    }
}
