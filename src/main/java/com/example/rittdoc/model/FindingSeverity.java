package com.example.rittdoc.model;

public enum FindingSeverity {
    ERROR,
    FATAL
}
