package com.vedant.salesanalyst.model;

import java.util.List;

/**
 * Contents of a three-tab knowledge workbook: table descriptions, column glossary and
 * golden queries.
 */
public record KnowledgeWorkbook(List<TableEntry> tables, List<ColumnEntry> columns, List<GoldenExample> queries) {

    public KnowledgeWorkbook {
        tables = List.copyOf(tables);
        columns = List.copyOf(columns);
        queries = List.copyOf(queries);
    }

    public record TableEntry(String name, String description) {}

    public record ColumnEntry(String table, String column, String dataType, String comment) {}
}
