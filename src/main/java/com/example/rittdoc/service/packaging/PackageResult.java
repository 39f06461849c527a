package com.example.rittdoc.service.packaging;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Where a package was staged and zipped. {@code stagingDir} mirrors the archive content.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PackageResult {
    private Path archivePath;
    private Path stagingDir;
    private List<String> chapterFiles = new ArrayList<>();
    private int imageCount;
}
