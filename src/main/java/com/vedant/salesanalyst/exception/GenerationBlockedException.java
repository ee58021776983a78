package com.vedant.salesanalyst.exception;

import com.vedant.salesanalyst.model.ErrorKind;

/** The model produced a mutating statement. Never retried. */
public class GenerationBlockedException extends AnalystException {

    private final String keyword;
    private final String sql;

    public GenerationBlockedException(String keyword, String sql) {
        super(ErrorKind.GENERATION_BLOCKED, "SQL validation failed: only SELECT queries are allowed. Blocked keyword "
                + keyword + " in generated statement: " + abbreviate(sql));
        this.keyword = keyword;
        this.sql = sql;
    }

    public String getKeyword() { return keyword; }

    public String getSql() { return sql; }

    private static String abbreviate(String sql) {
        return sql.length() > 100 ? sql.substring(0, 100) : sql;
    }
}
