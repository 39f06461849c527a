package com.example.rittdoc.config;

import com.example.rittdoc.model.ChapterFailurePolicy;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Configuration
public class ConversionConfig {

    @Value("${rittdoc.output.dir:output}")
    private String outputDir;

    @Value("${rittdoc.dtd.path:}")
    private String dtdPath;

    @Value("${rittdoc.transform.failure-policy:EXCLUDE}")
    private ChapterFailurePolicy failurePolicy;

    @Value("${rittdoc.job.timeout-seconds:3600}")
    private long jobTimeoutSeconds;

    @PostConstruct
    public void init() {
        try {
            Path outputPath = Paths.get(outputDir);
            if (!Files.exists(outputPath)) {
                Files.createDirectories(outputPath);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Could not create output directory " + outputDir, e);
        }
    }

    public Path getOutputDir() {
        return Paths.get(outputDir);
    }

    /**
     * Explicitly configured DTD, or {@code null} when the bundled one should be used.
     */
    public Path getDtdPath() {
        return StringUtils.isBlank(dtdPath) ? null : Paths.get(dtdPath);
    }

    public ChapterFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public long getJobTimeoutSeconds() {
        return jobTimeoutSeconds;
    }
}
