package com.example.rittdoc.dto.conversion;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw content of an EPUB: the spine documents in reading order and every image in the manifest.
 * Paths are full entry names inside the archive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EpubPackage {
    private String sourceName;
    private String opfPath;
    private BookMetadata metadata = new BookMetadata();
    private List<SpineDocument> spine = new ArrayList<>();
    private List<ManifestImage> images = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SpineDocument {
        private String path;
        private String mediaType;
        private String content;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ManifestImage {
        private String path;
        private String mediaType;
        private byte[] data;
    }
}
