package com.example.rittdoc.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one conversion job as handed back to the caller.
 */
@Data
@NoArgsConstructor
public class ConversionResult {
    private String sourceName;
    private SourceFormat sourceFormat;
    private JobStatus status;
    private Path archivePath;
    private Path referenceMappingPath;
    private Path validationReportPath;
    private int chapterCount;
    private boolean validationPassed;
    private int findingCount;
    private List<ReferenceProblem> referenceProblems = new ArrayList<>();
    private List<ExcludedChapter> excludedChapters = new ArrayList<>();
    private String failureReason;
}
