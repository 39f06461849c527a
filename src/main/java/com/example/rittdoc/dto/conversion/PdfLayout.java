package com.example.rittdoc.dto.conversion;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PdfLayout {
    private String sourceName;
    private BookMetadata metadata = new BookMetadata();
    private List<PageLayout> pages = new ArrayList<>();
    private List<OutlineEntry> outline = new ArrayList<>();
}
