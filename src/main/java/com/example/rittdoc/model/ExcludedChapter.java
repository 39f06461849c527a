package com.example.rittdoc.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExcludedChapter {
    private String chapterId;
    private String sourcePath;
    private String reason;
}
