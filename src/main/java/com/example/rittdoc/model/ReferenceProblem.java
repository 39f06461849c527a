package com.example.rittdoc.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceProblem {
    private Type type;
    private String originalPath;
    private String detail;

    public enum Type {
        MISSING_FINAL_NAME,
        FINAL_FILE_NOT_FOUND,
        UNRESOLVED_REFERENCE
    }
}
