package com.vedant.salesanalyst.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One retrievable unit of schema knowledge: a table description or the schema overview.
 * Immutable; the embedding array is copied in and out.
 */
public final class SchemaDocument {

    private final String text;
    private final float[] embedding;
    private final DocumentMetadata metadata;

    public SchemaDocument(String text, float[] embedding, DocumentMetadata metadata) {
        this.text = Objects.requireNonNull(text, "text");
        this.embedding = embedding == null ? new float[0] : embedding.clone();
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public String getText() { return text; }

    public float[] getEmbedding() { return embedding.clone(); }

    public int dimension() { return embedding.length; }

    public DocumentMetadata getMetadata() { return metadata; }

    /** Same document with its text replaced, used when columns are pruned for the prompt. */
    public SchemaDocument withText(String newText) {
        return new SchemaDocument(newText, embedding, metadata);
    }

    public double squaredDistanceTo(float[] query) {
        if (query.length != embedding.length) {
            throw new IllegalArgumentException("Embedding dimension mismatch: index has "
                    + embedding.length + ", query has " + query.length);
        }
        double sum = 0;
        for (int i = 0; i < embedding.length; i++) {
            double d = embedding[i] - query[i];
            sum += d * d;
        }
        return sum;
    }

    public static String tableText(String schema, String table, String tableComment,
                                   List<ColumnDescription> columns, List<String> relationships) {
        String tableDesc = tableComment != null && !tableComment.isBlank() ? " (" + tableComment + ")" : "";
        String columnsStr = columns.stream().map(ColumnDescription::describe).collect(Collectors.joining(" | "));
        String relStr = relationships == null || relationships.isEmpty()
                ? ""
                : "\nRelationships: " + String.join("; ", relationships);
        return "Schema: " + schema + ", Table: " + schema + "." + table + tableDesc + "\n"
                + "Columns: " + columnsStr + relStr;
    }

    public static String overviewText(String database, String schema, List<String> tables) {
        String qualified = tables.stream().map(t -> schema + "." + t).collect(Collectors.joining(", "));
        return "Database: " + database + ", Schema: " + schema + "\n"
                + "Available tables: " + qualified + "\n"
                + "IMPORTANT: Always use schema-qualified table names: " + schema + ".tablename";
    }

    @Override
    public String toString() {
        return "SchemaDocument{" + metadata.kind() + ", table=" + metadata.table() + "}";
    }
}
