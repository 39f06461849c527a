package com.example.rittdoc.dto.conversion;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Top-level bookmark of a PDF.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OutlineEntry {
    private String title;
    private int pageNumber;
}
