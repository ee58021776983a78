package com.vedant.salesanalyst.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of context retrieval.
 *
 * @param documents       pruned documents shown to the model, overview included
 * @param retrievedTables table names of the retained table documents
 * @param validColumns    lower-cased table name to every column known for it
 */
public record RetrievalResult(
        List<SchemaDocument> documents,
        List<String> retrievedTables,
        Map<String, Set<String>> validColumns
) {}
