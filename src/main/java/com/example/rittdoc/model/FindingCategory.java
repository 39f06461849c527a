package com.example.rittdoc.model;

public enum FindingCategory {
    INVALID_CONTENT_MODEL,
    UNDECLARED_ELEMENT,
    MISSING_REQUIRED_ATTRIBUTE,
    MISSING_REQUIRED_CHILD,
    INVALID_ATTRIBUTE_VALUE,
    XML_SYNTAX
}
