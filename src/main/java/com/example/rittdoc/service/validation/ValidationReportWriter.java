package com.example.rittdoc.service.validation;

import com.example.rittdoc.model.FindingCategory;
import com.example.rittdoc.model.ValidationFinding;
import com.example.rittdoc.model.ValidationReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes a {@link ValidationReport} as the JSON validation audit file of a job.
 */
@Component
public class ValidationReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(ValidationReportWriter.class);

    private final ObjectMapper objectMapper;

    @Autowired
    public ValidationReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(ValidationReport report, Path path) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("dtd", report.getDtd());
        record.put("performed", report.isPerformed());
        record.put("passed", report.isPassed());
        record.put("note", report.getNote());
        record.put("validatedFiles", report.getValidatedFiles());
        record.put("findingCount", report.getFindings().size());
        record.put("findingsByCategory", countByCategory(report));
        record.put("findings", report.getFindings());

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), record);
            logger.info("Validation report written to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write validation report to " + path, e);
        }
    }

    private static Map<FindingCategory, Integer> countByCategory(ValidationReport report) {
        Map<FindingCategory, Integer> counts = new TreeMap<>();
        for (ValidationFinding finding : report.getFindings()) {
            counts.merge(finding.getCategory(), 1, Integer::sum);
        }
        return counts;
    }
}
