package com.vedant.salesanalyst.model;

/**
 * A directed join edge source_table.source_column -> target_table.target_column.
 */
public record Relationship(
        String sourceTable,
        String sourceColumn,
        String targetTable,
        String targetColumn,
        RelationshipOrigin origin,
        String description
) {

    public record Key(String sourceTable, String sourceColumn, String targetTable, String targetColumn) {}

    public Key key() {
        return new Key(sourceTable, sourceColumn, targetTable, targetColumn);
    }

    public String source() {
        return sourceTable + "." + sourceColumn;
    }

    public String target() {
        return targetTable + "." + targetColumn;
    }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }
}
