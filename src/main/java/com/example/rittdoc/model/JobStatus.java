package com.example.rittdoc.model;

public enum JobStatus {
    SUCCESS,
    SUCCESS_WITH_WARNINGS,
    FAILED
}
