package com.vedant.salesanalyst.service;

import java.util.List;

/**
 * Parameterised read-only query capability used for catalog lookups, plus the
 * {@link QueryRunner} used for generated statements.
 */
public interface SqlExecutor extends QueryRunner {

    List<List<Object>> runQuery(String sql, Object... params);
}
