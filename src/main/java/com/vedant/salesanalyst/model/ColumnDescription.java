package com.vedant.salesanalyst.model;

/**
 * One catalog column as it appears in a table description.
 * The comment is the business-glossary text from the catalog and may be null.
 */
public record ColumnDescription(String name, String dataType, String comment) {

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }

    // "name (comment, type)" or "name (type)"
    public String describe() {
        if (hasComment()) {
            return name + " (" + comment + ", " + dataType + ")";
        }
        return name + " (" + dataType + ")";
    }
}
