package com.vedant.salesanalyst.exception;

import com.vedant.salesanalyst.model.ErrorKind;

/**
 * Base class of every pipeline failure. The kind decides which step suffix and
 * which state fields the orchestrator records.
 */
public class AnalystException extends RuntimeException {

    private final ErrorKind kind;

    public AnalystException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnalystException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
