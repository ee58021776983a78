package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.model.QueryRows;

/** Read-only execution of one accepted statement, returning rows and column names together. */
@FunctionalInterface
public interface QueryRunner {

    QueryRows runQueryWithColumns(String sql);
}
