package com.example.rittdoc.dto.conversion;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Paragraph {
    private List<TextRun> runs = new ArrayList<>();
    private int pageNumber; // page of the first run
    private BoundingBox boundingBox;
    private ParagraphRole role = ParagraphRole.BODY;
    private double fontSize;

    public String getText() {
        return runs.stream()
                .map(TextRun::getText)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(" "))
                .replaceAll("\\s+", " ");
    }

    public enum ParagraphRole {
        BODY,
        HEADING_CANDIDATE,
        CAPTION,
        LIST_ITEM
    }
}
