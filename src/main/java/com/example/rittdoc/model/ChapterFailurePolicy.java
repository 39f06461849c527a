package com.example.rittdoc.model;

/**
 * What the pipeline does when the compliance transform fails for one chapter.
 */
public enum ChapterFailurePolicy {
    ABORT,
    EXCLUDE
}
