package com.example.rittdoc.dto.conversion;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedImage {
    private String originalPath; // identity in the source, e.g. "page3/image1" or "OEBPS/images/a.png"
    private String intermediateName;
    private Path file;
    private BoundingBox boundingBox; // placement on the page, null for EPUB images
    private Integer pixelWidth;
    private Integer pixelHeight;
    private boolean vector;
    private long fileSize;
}
