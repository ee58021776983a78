package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.exception.RetrievalException;
import com.vedant.salesanalyst.llm.EmbeddingModel;
import com.vedant.salesanalyst.model.ColumnDescription;
import com.vedant.salesanalyst.model.DocumentMetadata;
import com.vedant.salesanalyst.model.GlossaryStatus;
import com.vedant.salesanalyst.model.Relationship;
import com.vedant.salesanalyst.model.SchemaDocument;
import com.vedant.salesanalyst.vector.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Builds one document per table plus one schema overview from the live catalog, embeds them
 * and swaps them into the {@link VectorIndex} in a single step.
 */
@Service
public class SchemaIndexer {

    private static final Logger log = LoggerFactory.getLogger(SchemaIndexer.class);

    private static final String TABLES_SQL =
            "SELECT table_name FROM information_schema.tables " +
            "WHERE table_schema = ? AND table_type = 'BASE TABLE' ORDER BY table_name";

    private static final String COLUMNS_SQL =
            "SELECT c.column_name, c.data_type, d.description " +
            "FROM information_schema.columns c " +
            "LEFT JOIN (SELECT cl.oid, cl.relname, ns.nspname FROM pg_catalog.pg_class cl " +
            "JOIN pg_catalog.pg_namespace ns ON cl.relnamespace = ns.oid WHERE cl.relkind = 'r') t " +
            "ON t.relname = c.table_name AND t.nspname = c.table_schema " +
            "LEFT JOIN pg_catalog.pg_description d ON t.oid = d.objoid AND d.objsubid = c.ordinal_position " +
            "WHERE c.table_schema = ? AND c.table_name = ? ORDER BY c.ordinal_position";

    private static final String TABLE_COMMENT_SQL =
            "SELECT d.description FROM pg_catalog.pg_class c " +
            "JOIN pg_catalog.pg_namespace n ON c.relnamespace = n.oid " +
            "JOIN pg_catalog.pg_description d ON c.oid = d.objoid AND d.objsubid = 0 " +
            "WHERE n.nspname = ? AND c.relname = ?";

    private static final String COMMENTED_COLUMNS_SQL =
            "SELECT COUNT(*) FROM pg_catalog.pg_description d " +
            "JOIN pg_catalog.pg_class c ON d.objoid = c.oid " +
            "JOIN pg_catalog.pg_namespace n ON c.relnamespace = n.oid " +
            "WHERE n.nspname = ? AND d.objsubid > 0";

    private static final String TOTAL_COLUMNS_SQL =
            "SELECT COUNT(*) FROM information_schema.columns WHERE table_schema = ?";

    private final SqlExecutor executor;
    private final EmbeddingModel embeddings;
    private final VectorIndex index;
    private final RelationshipService relationships;
    private final String database;
    private volatile String activeSchema;

    public SchemaIndexer(SqlExecutor executor,
                         EmbeddingModel embeddings,
                         VectorIndex index,
                         RelationshipService relationships,
                         @Value("${analyst.database:sales_analyst}") String database,
                         @Value("${analyst.schema:northwind}") String schema) {
        this.executor = executor;
        this.embeddings = embeddings;
        this.index = index;
        this.relationships = relationships;
        this.database = database;
        this.activeSchema = schema;
    }

    public String activeSchema() {
        return activeSchema;
    }

    public String database() {
        return database;
    }

    /**
     * Re-indexes the schema. The index keeps serving the previous schema until every
     * document has been embedded; a failure leaves it untouched.
     */
    public GlossaryStatus reindex(String schema) {
        List<SchemaDocument> documents = buildDocuments(schema);
        index.rebuild(documents);
        activeSchema = schema;
        log.info("Indexed schema {}: {} documents", schema, documents.size());
        return detectGlossaryStatus(schema);
    }

    List<SchemaDocument> buildDocuments(String schema) {
        List<String> tableNames = executor.runQuery(TABLES_SQL, schema).stream()
                .map(r -> String.valueOf(r.get(0)))
                .toList();
        if (tableNames.isEmpty()) {
            throw new RetrievalException("No tables found in schema '" + schema + "'");
        }

        List<Relationship> rels = relationships.allRelationships(executor, schema);
        Map<String, List<String>> relMap = RelationshipService.buildRelationshipMap(rels, schema);

        List<SchemaDocument> documents = new ArrayList<>();
        for (String table : tableNames) {
            List<ColumnDescription> columns = executor.runQuery(COLUMNS_SQL, schema, table).stream()
                    .map(r -> new ColumnDescription(String.valueOf(r.get(0)), String.valueOf(r.get(1)),
                            r.get(2) == null ? null : r.get(2).toString()))
                    .toList();
            if (columns.isEmpty()) {
                log.warn("Table {}.{} has no visible columns, skipping", schema, table);
                continue;
            }
            String comment = tableComment(schema, table);
            List<String> tableRels = relMap.getOrDefault(table, List.of());
            String text = SchemaDocument.tableText(schema, table, comment, columns, tableRels);
            documents.add(new SchemaDocument(text, embed(text),
                    DocumentMetadata.table(database, schema, table, comment, columns, tableRels)));
        }

        String overview = SchemaDocument.overviewText(database, schema, tableNames);
        documents.add(new SchemaDocument(overview, embed(overview), DocumentMetadata.overview(database, schema)));
        return documents;
    }

    private String tableComment(String schema, String table) {
        try {
            List<List<Object>> rows = executor.runQuery(TABLE_COMMENT_SQL, schema, table);
            return rows.isEmpty() || rows.get(0).get(0) == null ? null : rows.get(0).get(0).toString();
        } catch (RuntimeException e) {
            log.debug("No table comment for {}.{}: {}", schema, table, e.getMessage());
            return null;
        }
    }

    private float[] embed(String text) {
        try {
            return embeddings.embed(text);
        } catch (RuntimeException e) {
            throw new RetrievalException("Embedding failed while indexing: " + e.getMessage(), e);
        }
    }

    /* ============================================================
       GLOSSARY DETECTION
       ============================================================ */
    public GlossaryStatus detectGlossaryStatus(String schema) {
        long commented;
        long total;
        List<String> tables;
        try {
            commented = count(executor.runQuery(COMMENTED_COLUMNS_SQL, schema));
            total = count(executor.runQuery(TOTAL_COLUMNS_SQL, schema));
            tables = executor.runQuery(TABLES_SQL, schema).stream().map(r -> String.valueOf(r.get(0))).toList();
        } catch (RuntimeException e) {
            log.warn("Glossary detection failed for schema {}: {}", schema, e.getMessage());
            return GlossaryStatus.unknown();
        }
        return classify(commented, total, tables);
    }

    static GlossaryStatus classify(long commentedColumns, long totalColumns, List<String> tables) {
        double commentPct = totalColumns > 0 ? commentedColumns * 100.0 / totalColumns : 0;

        // cryptic names: short segments joined by underscores, e.g. t_cust_mst
        long cryptic = tables.stream().filter(SchemaIndexer::looksAbbreviated).count();
        double crypticPct = tables.isEmpty() ? 0 : cryptic * 100.0 / tables.size();

        if (commentPct >= 50) {
            return new GlossaryStatus("glossary",
                    "Business glossary detected: " + (int) commentPct
                            + "% of columns have descriptions. Using metadata for AI queries.",
                    "success");
        }
        if (crypticPct >= 50 && commentPct < 10) {
            return new GlossaryStatus("cryptic_no_glossary",
                    "Cryptic object names detected (" + (int) crypticPct + "% abbreviated) with minimal glossary ("
                            + (int) commentPct + "% commented). For best results, add COMMENT ON to your tables and columns.",
                    "warning");
        }
        return new GlossaryStatus("descriptive",
                "Descriptive object names detected; using table/column names directly for AI queries.",
                "success");
    }

    private static boolean looksAbbreviated(String name) {
        String[] parts = Arrays.stream(name.split("_")).filter(p -> !p.isEmpty()).toArray(String[]::new);
        if (parts.length < 2) {
            return false;
        }
        double avg = Arrays.stream(parts).mapToInt(String::length).average().orElse(0);
        return avg <= 4;
    }

    private static long count(List<List<Object>> rows) {
        if (rows.isEmpty() || rows.get(0).isEmpty() || rows.get(0).get(0) == null) {
            return 0;
        }
        return ((Number) rows.get(0).get(0)).longValue();
    }
}
