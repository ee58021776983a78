package com.vedant.salesanalyst.exception;

import com.vedant.salesanalyst.model.ErrorKind;

/** Embedding or index backend failure while building the context. */
public class RetrievalException extends AnalystException {

    public RetrievalException(String message) {
        super(ErrorKind.RETRIEVAL, message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(ErrorKind.RETRIEVAL, message, cause);
    }
}
