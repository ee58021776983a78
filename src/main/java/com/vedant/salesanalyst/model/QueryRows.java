package com.vedant.salesanalyst.model;

import java.util.List;

/** Result rows as positional tuples plus the result column names. */
public record QueryRows(List<List<Object>> rows, List<String> columnNames) {

    public QueryRows {
        rows = rows == null ? List.of() : rows;
        columnNames = columnNames == null ? List.of() : columnNames;
    }

    public static QueryRows empty() {
        return new QueryRows(List.of(), List.of());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
