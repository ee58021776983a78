package com.vedant.salesanalyst.model;

import java.util.List;

/**
 * Metadata carried next to every indexed schema document.
 * Table documents keep their full column list and relationship hints so a pruned
 * rendering can be produced without going back to the catalog.
 */
public record DocumentMetadata(
        String database,
        String schema,
        String table,
        DocumentKind kind,
        String tableComment,
        List<ColumnDescription> columns,
        List<String> relationships
) {

    public DocumentMetadata {
        columns = columns == null ? List.of() : List.copyOf(columns);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    public static DocumentMetadata overview(String database, String schema) {
        return new DocumentMetadata(database, schema, null, DocumentKind.OVERVIEW, null, List.of(), List.of());
    }

    public static DocumentMetadata table(String database, String schema, String table, String tableComment,
                                         List<ColumnDescription> columns, List<String> relationships) {
        return new DocumentMetadata(database, schema, table, DocumentKind.TABLE, tableComment, columns, relationships);
    }

    public boolean isTable() {
        return kind == DocumentKind.TABLE;
    }

    public boolean isOverview() {
        return kind == DocumentKind.OVERVIEW;
    }
}
