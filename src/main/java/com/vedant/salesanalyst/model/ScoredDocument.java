package com.vedant.salesanalyst.model;

/** A search hit: the document and its squared Euclidean distance to the query. */
public record ScoredDocument(SchemaDocument document, double distance) {

    public String table() {
        return document.getMetadata().table();
    }

    public boolean isOverview() {
        return document.getMetadata().isOverview();
    }
}
