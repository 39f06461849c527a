package com.example.rittdoc.model;

import lombok.Value;

/**
 * One DTD violation located in a packaged file.
 */
@Value
public class ValidationFinding {
    String file;
    int line;
    int column;
    FindingCategory category;
    String description;
    FindingSeverity severity;
}
