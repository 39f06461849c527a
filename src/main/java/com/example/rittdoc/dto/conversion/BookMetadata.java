package com.example.rittdoc.dto.conversion;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookMetadata {
    private String title;
    private String subtitle;
    private String isbn;
    private List<String> authors = new ArrayList<>();
    private String publisher;
    private String publicationDate;
    private String copyrightYear;
    private String copyrightHolder;
    private String language;
}
