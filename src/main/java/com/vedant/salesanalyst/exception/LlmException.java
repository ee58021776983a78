package com.vedant.salesanalyst.exception;

/** Transport or protocol failure talking to the model provider. */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
