package com.vedant.salesanalyst.exception;

import com.vedant.salesanalyst.model.ErrorKind;

import java.util.List;

/** Generated SQL still referenced unknown columns or tables after the last attempt. */
public class SqlValidationException extends AnalystException {

    private final String sql;
    private final List<String> errors;

    public SqlValidationException(String sql, List<String> errors, int attempts) {
        super(ErrorKind.VALIDATION, "SQL failed validation after " + attempts + " attempt(s): "
                + String.join("; ", errors));
        this.sql = sql;
        this.errors = List.copyOf(errors);
    }

    public String getSql() { return sql; }

    public List<String> getErrors() { return errors; }
}
