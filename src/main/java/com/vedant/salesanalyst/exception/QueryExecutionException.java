package com.vedant.salesanalyst.exception;

import com.vedant.salesanalyst.model.ErrorKind;

public class QueryExecutionException extends AnalystException {

    public QueryExecutionException(String message, Throwable cause) {
        super(ErrorKind.EXECUTION, message, cause);
    }
}
