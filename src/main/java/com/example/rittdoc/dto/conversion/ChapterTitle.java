package com.example.rittdoc.dto.conversion;

import lombok.Value;

import java.util.List;

/**
 * Title of one chapter, possibly merged from several source blocks.
 * {@code sourceBlocks} are the paragraphs the title was built from, empty for a placeholder.
 */
@Value
public class ChapterTitle {
    String text;
    double fontSize;
    List<Paragraph> sourceBlocks;
    boolean placeholder;

    public static ChapterTitle placeholder(String text) {
        return new ChapterTitle(text, 0, List.of(), true);
    }
}
