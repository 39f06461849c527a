package com.example.rittdoc.dto.conversion;

import com.example.rittdoc.model.SourceFormat;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Canonical intermediate tree shared by the PDF and EPUB paths. One instance per conversion job.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StructuredDocument {
    private SourceFormat sourceFormat;
    private String sourceName;
    private BookMetadata metadata = new BookMetadata();
    private Element bookInfo;
    private List<StructuredChapter> chapters = new ArrayList<>();

    public Optional<StructuredChapter> findChapter(String chapterId) {
        return chapters.stream().filter(c -> c.getId().equals(chapterId)).findFirst();
    }
}
