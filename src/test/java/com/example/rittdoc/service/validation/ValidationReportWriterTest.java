package com.example.rittdoc.service.validation;

import com.example.rittdoc.model.FindingCategory;
import com.example.rittdoc.model.FindingSeverity;
import com.example.rittdoc.model.ValidationFinding;
import com.example.rittdoc.model.ValidationReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationReportWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ValidationReportWriter writer = new ValidationReportWriter(objectMapper);

    @TempDir
    Path tempDir;

    @Test
    void writesFindingsGroupedByCategory() throws Exception {
        ValidationReport report = new ValidationReport();
        report.setPerformed(true);
        report.setDtd("RITTDOCdtd/v1.1/RittDocBook.dtd");
        report.getValidatedFiles().add("Book.XML");
        report.getFindings().add(new ValidationFinding("ch0001.xml", 4, 7, FindingCategory.UNDECLARED_ELEMENT,
                "Element type \"bogus\" must be declared.", FindingSeverity.ERROR));
        report.getFindings().add(new ValidationFinding("ch0002.xml", 2, 1, FindingCategory.UNDECLARED_ELEMENT,
                "Element type \"blink\" must be declared.", FindingSeverity.ERROR));
        Path target = tempDir.resolve("reports/book_validation_report.json");

        writer.write(report, target);

        JsonNode json = objectMapper.readTree(target.toFile());
        assertThat(json.get("performed").asBoolean()).isTrue();
        assertThat(json.get("passed").asBoolean()).isFalse();
        assertThat(json.get("findingCount").asInt()).isEqualTo(2);
        assertThat(json.get("findingsByCategory").get("UNDECLARED_ELEMENT").asInt()).isEqualTo(2);
        assertThat(json.get("findings").get(0).get("file").asText()).isEqualTo("ch0001.xml");
        assertThat(json.get("findings").get(0).get("line").asInt()).isEqualTo(4);
    }

    @Test
    void notPerformedReportKeepsItsNote() throws Exception {
        Path target = tempDir.resolve("report.json");

        writer.write(ValidationReport.notPerformed("No DTD available"), target);

        JsonNode json = objectMapper.readTree(target.toFile());
        assertThat(json.get("performed").asBoolean()).isFalse();
        assertThat(json.get("passed").asBoolean()).isFalse();
        assertThat(json.get("note").asText()).isEqualTo("No DTD available");
        assertThat(json.get("findings").size()).isZero();
    }
}
