package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.exception.LlmException;
import com.vedant.salesanalyst.exception.RetrievalException;
import com.vedant.salesanalyst.llm.EmbeddingModel;
import com.vedant.salesanalyst.model.DocumentMetadata;
import com.vedant.salesanalyst.model.GlossaryStatus;
import com.vedant.salesanalyst.model.SchemaDocument;
import com.vedant.salesanalyst.vector.VectorIndex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vedant.salesanalyst.service.FakeSqlExecutor.row;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SchemaIndexerTest {

    private final VectorIndex index = new VectorIndex();
    private final RelationshipService relationships = new RelationshipService(mock(RelationshipOverlayStore.class));

    private FakeSqlExecutor northwind() {
        return new FakeSqlExecutor()
                .on("FOREIGN KEY", List.of(row("orders", "customerid", "customers", "customerid")))
                .on("d.description IS NOT NULL", List.of(row("customers", "companyname", "Legal name")))
                .on("information_schema.tables", List.of(row("customers"), row("orders")))
                .on("ORDER BY c.ordinal_position", (sql, params) -> "customers".equals(params[1])
                        ? List.of(row("customerid", "character varying", null),
                                  row("companyname", "character varying", "Legal name"))
                        : List.of(row("orderid", "integer", null), row("customerid", "character varying", null)))
                .on("d.objsubid = 0", (sql, params) -> "customers".equals(params[1])
                        ? List.of(row("Buyers"))
                        : List.of())
                .on("d.objsubid > 0", List.of(row(1L)))
                .on("COUNT(*) FROM information_schema.columns", List.of(row(4L)));
    }

    private SchemaIndexer indexer(FakeSqlExecutor executor, EmbeddingModel embeddings) {
        return new SchemaIndexer(executor, embeddings, index, relationships, "sales_analyst", "northwind");
    }

    @Test
    void buildsOneDocumentPerTablePlusOverview() {
        List<SchemaDocument> docs = indexer(northwind(), text -> new float[]{1f, 0f}).buildDocuments("northwind");

        assertEquals(3, docs.size());
        assertEquals("Schema: northwind, Table: northwind.customers (Buyers)\n"
                        + "Columns: customerid (character varying) | companyname (Legal name, character varying)\n"
                        + "Relationships: Referenced by northwind.orders.customerid",
                docs.get(0).getText());
        assertEquals("Schema: northwind, Table: northwind.orders\n"
                        + "Columns: orderid (integer) | customerid (character varying)\n"
                        + "Relationships: customerid -> northwind.customers.customerid",
                docs.get(1).getText());
        assertEquals("Database: sales_analyst, Schema: northwind\n"
                        + "Available tables: northwind.customers, northwind.orders\n"
                        + "IMPORTANT: Always use schema-qualified table names: northwind.tablename",
                docs.get(2).getText());

        DocumentMetadata meta = docs.get(0).getMetadata();
        assertEquals("customers", meta.table());
        assertEquals(2, meta.columns().size());
        assertTrue(docs.get(2).getMetadata().isOverview());
    }

    @Test
    void reindexSwapsIndexAndReportsGlossaryStatus() {
        SchemaIndexer indexer = indexer(northwind(), text -> new float[]{1f, 0f});

        GlossaryStatus status = indexer.reindex("northwind");

        assertEquals(3, index.size());
        assertEquals(2, index.tableCount());
        assertEquals("northwind", indexer.activeSchema());
        assertEquals("descriptive", status.status());
    }

    @Test
    void reindexingTwiceGivesIdenticalIndex() {
        SchemaIndexer indexer = indexer(northwind(), text -> new float[]{(float) text.length(), 0f});

        indexer.reindex("northwind");
        List<String> texts = index.texts();
        List<DocumentMetadata> metadata = index.metadata();
        indexer.reindex("northwind");

        assertEquals(texts, index.texts());
        assertEquals(metadata, index.metadata());
    }

    @Test
    void schemaWithoutTablesFailsAndKeepsTheOldIndex() {
        indexer(northwind(), text -> new float[]{1f}).reindex("northwind");

        SchemaIndexer empty = indexer(new FakeSqlExecutor(), text -> new float[]{1f});

        assertThrows(RetrievalException.class, () -> empty.reindex("staging"));
        assertEquals(3, index.size());
    }

    @Test
    void embeddingFailureAbortsIndexing() {
        EmbeddingModel broken = text -> {
            throw new LlmException("HTTP 401");
        };
        assertThrows(RetrievalException.class, () -> indexer(northwind(), broken).reindex("northwind"));
        assertTrue(index.isEmpty());
    }

    @Test
    void glossaryDetectionFallsBackToUnknown() {
        FakeSqlExecutor executor = new FakeSqlExecutor().failing("d.objsubid > 0");
        assertEquals("unknown", indexer(executor, text -> new float[]{1f}).detectGlossaryStatus("northwind").status());
    }

    @Test
    void classifiesCommentedSchemaAsGlossary() {
        GlossaryStatus status = SchemaIndexer.classify(6, 10, List.of("t_cust_mst"));
        assertEquals("glossary", status.status());
        assertTrue(status.message().contains("60%"));
    }

    @Test
    void classifiesAbbreviatedUncommentedSchemaAsCryptic() {
        GlossaryStatus status = SchemaIndexer.classify(0, 10, List.of("t_cust_mst", "t_ord_hdr", "customers"));
        assertEquals("cryptic_no_glossary", status.status());
        assertEquals("warning", status.type());
    }

    @Test
    void classifiesReadableNamesAsDescriptive() {
        assertEquals("descriptive", SchemaIndexer.classify(2, 10, List.of("customers", "order_details")).status());
    }
}
