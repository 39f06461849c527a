package com.example.rittdoc.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {
    private String dtd;
    private boolean performed;
    private List<String> validatedFiles = new ArrayList<>();
    private List<ValidationFinding> findings = new ArrayList<>();
    private String note;

    /**
     * A report passes only if validation actually ran and found nothing.
     */
    public boolean isPassed() {
        return performed && findings.isEmpty();
    }

    public static ValidationReport notPerformed(String reason) {
        ValidationReport report = new ValidationReport();
        report.setNote(reason);
        return report;
    }
}
