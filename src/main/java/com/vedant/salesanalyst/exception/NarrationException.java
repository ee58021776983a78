package com.vedant.salesanalyst.exception;

import com.vedant.salesanalyst.model.ErrorKind;

public class NarrationException extends AnalystException {

    public NarrationException(String message, Throwable cause) {
        super(ErrorKind.NARRATION, message, cause);
    }
}
