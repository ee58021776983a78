package com.vedant.salesanalyst.model;

public enum ErrorKind {
    RETRIEVAL,
    GENERATION_BLOCKED,
    VALIDATION,
    GENERATION,
    EXECUTION,
    NARRATION
}
