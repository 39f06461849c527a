package com.example.rittdoc.dto.conversion;

import lombok.Builder;
import lombok.Value;

/**
 * A single run of text as produced by the layout extractor.
 * Coordinates are in points with the origin at the top-left corner of the page,
 * {@code y} being the top edge of the run.
 */
@Value
@Builder(toBuilder = true)
public class TextRun {
    String text;
    double x;
    double y;
    double width;
    double height;
    int pageNumber;
    double fontSize;
    String fontFamily;
    boolean bold;
    boolean italic;

    public double getBottom() {
        return y + height;
    }
}
