package com.example.rittdoc.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A reference found in a chapter's source: an internal link or an image source.
 * {@code targetPath} is null when the reference could not be matched to a registered resource.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrossReference {
    private ResourceKind kind;
    private String sourceChapter;
    private String originalHref;
    private String targetPath;
    private String targetAnchor;
}
