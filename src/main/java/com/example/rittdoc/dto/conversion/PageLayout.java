package com.example.rittdoc.dto.conversion;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageLayout {
    private int pageNumber;
    private double width;
    private double height;
    private List<TextRun> runs = new ArrayList<>();
    private List<ExtractedImage> images = new ArrayList<>();
}
