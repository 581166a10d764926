package com.edwardjones.adtree.model.dto;

public enum ErrorCategory {
    OBJECT_NOT_FOUND,
    INVALID_RESULT,
    NOT_SPECIFIED
}
