package com.example.rittdoc.model;

public enum ResourceKind {
    IMAGE,
    LINK
}
