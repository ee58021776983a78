package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.exception.LlmException;
import com.vedant.salesanalyst.exception.RetrievalException;
import com.vedant.salesanalyst.llm.EmbeddingModel;
import com.vedant.salesanalyst.llm.LanguageModel;
import com.vedant.salesanalyst.model.ColumnDescription;
import com.vedant.salesanalyst.model.DocumentMetadata;
import com.vedant.salesanalyst.model.GoldenExample;
import com.vedant.salesanalyst.model.RetrievalResult;
import com.vedant.salesanalyst.model.SchemaDocument;
import com.vedant.salesanalyst.vector.VectorIndex;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ContextRetrieverTest {

    private static final String SCHEMA = "northwind";

    private final LanguageModel llm = mock(LanguageModel.class);
    private final GoldenExampleStore examples = mock(GoldenExampleStore.class);
    private final VectorIndex index = new VectorIndex();

    private static SchemaDocument table(String name, float position, List<ColumnDescription> columns) {
        String text = SchemaDocument.tableText(SCHEMA, name, null, columns, List.of());
        return new SchemaDocument(text, new float[]{position},
                DocumentMetadata.table("sales_analyst", SCHEMA, name, null, columns, List.of()));
    }

    private static SchemaDocument overview(float position, String... tables) {
        return new SchemaDocument(SchemaDocument.overviewText("sales_analyst", SCHEMA, List.of(tables)),
                new float[]{position}, DocumentMetadata.overview("sales_analyst", SCHEMA));
    }

    private static List<ColumnDescription> cols(String... names) {
        return Arrays.stream(names).map(n -> new ColumnDescription(n, "integer", null)).toList();
    }

    // the question sits at the origin of a one-dimensional space
    private ContextRetriever retriever(EmbeddingModel embeddings) {
        return new ContextRetriever(embeddings, llm, index, examples);
    }

    @Test
    void largeSchemaKeepsHitsWithinRelativeThresholdPlusOverview() {
        // squared distances 1.0, 1.1, 1.3, 5.0, 9.0, 16.0 and 100.0 for the overview
        index.rebuild(List.of(
                table("t1", 1.0f, cols("a")),
                table("t2", (float) Math.sqrt(1.1), cols("a")),
                table("t3", (float) Math.sqrt(1.3), cols("a")),
                table("t4", (float) Math.sqrt(5.0), cols("a")),
                table("t5", 3f, cols("a")),
                table("t6", 4f, cols("a")),
                overview(10f, "t1", "t2", "t3", "t4", "t5", "t6")));

        RetrievalResult result = retriever(text -> new float[]{0f}).retrieve("question", SCHEMA);

        assertEquals(List.of("t1", "t2"), result.retrievedTables());
        assertEquals(3, result.documents().size());
        assertTrue(result.documents().get(2).getMetadata().isOverview());
        verifyNoInteractions(llm);
    }

    @Test
    void smallSchemaUsesModelTableSelection() {
        index.rebuild(List.of(
                table("customers", 1f, List.of(new ColumnDescription("cst_rgn", "character varying", "customer region"))),
                table("orders", 2f, cols("orderid")),
                table("products", 3f, cols("productid")),
                overview(4f, "customers", "orders", "products")));
        when(llm.complete(anyString(), anyDouble(), anyInt())).thenReturn("northwind.customers");

        RetrievalResult result = retriever(text -> new float[]{0f}).retrieve("Sales per customer region?", SCHEMA);

        assertEquals(List.of("customers"), result.retrievedTables());
        assertEquals(2, result.documents().size());
        assertTrue(result.documents().get(0).getText().contains("cst_rgn (customer region, character varying)"));
        verify(llm).complete(contains("- customers"), eq(0.0), anyInt());
    }

    @Test
    void smallSchemaKeepsEverythingWhenSelectionFails() {
        index.rebuild(List.of(table("customers", 1f, cols("customerid")), table("orders", 2f, cols("orderid")),
                overview(3f, "customers", "orders")));
        when(llm.complete(anyString(), anyDouble(), anyInt())).thenThrow(new LlmException("timeout"));

        RetrievalResult result = retriever(text -> new float[]{0f}).retrieve("anything", SCHEMA);

        assertEquals(List.of("customers", "orders"), result.retrievedTables());
        assertEquals(3, result.documents().size());
    }

    @Test
    void unmatchedSelectionAnswerKeepsEverything() {
        index.rebuild(List.of(table("customers", 1f, cols("customerid")), overview(3f, "customers")));
        when(llm.complete(anyString(), anyDouble(), anyInt())).thenReturn("I am not sure.");

        RetrievalResult result = retriever(text -> new float[]{0f}).retrieve("anything", SCHEMA);

        assertEquals(List.of("customers"), result.retrievedTables());
    }

    @Test
    void emptyIndexFallsBackToOverviewOnlyContext() {
        RetrievalResult result = retriever(text -> new float[]{0f}).retrieve("How many customers?", SCHEMA);

        assertTrue(result.retrievedTables().isEmpty());
        assertEquals(1, result.documents().size());
        assertEquals("Use northwind schema. Query information_schema to discover available tables and columns.",
                result.documents().get(0).getText());
        assertTrue(result.validColumns().isEmpty());
    }

    @Test
    void embeddingFailureIsARetrievalError() {
        index.rebuild(List.of(table("customers", 1f, cols("customerid"))));
        EmbeddingModel broken = text -> {
            throw new LlmException("provider down");
        };
        assertThrows(RetrievalException.class, () -> retriever(broken).retrieve("q", SCHEMA));
    }

    @Test
    void wideTablesArePrunedButKeepKeyAndExampleColumns() {
        List<ColumnDescription> columns = cols("orderid", "customerid", "shipname", "shipaddress", "shipcity",
                "shipregion", "shippostalcode", "shipcountry", "freight", "orderdate", "requireddate", "shippeddate");
        SchemaDocument orders = table("orders", 0f, columns);
        Map<String, Float> positions = Map.of("freight", 0.1f, "orderdate", 0.2f, "shippeddate", 0.3f,
                "shipcity", 0.4f, "shipcountry", 0.5f);
        EmbeddingModel embeddings = text -> {
            for (Map.Entry<String, Float> e : positions.entrySet()) {
                if (text.startsWith("orders." + e.getKey() + " ")) {
                    return new float[]{e.getValue()};
                }
            }
            return new float[]{5f};
        };
        index.rebuild(List.of(orders));

        SchemaDocument pruned = retriever(embeddings)
                .pruneColumns(orders, new float[]{0f}, Set.of("shipregion"));

        String text = pruned.getText();
        assertTrue(text.contains("Columns: orderid (integer) | customerid (integer) | shipcity (integer) | "
                + "shipregion (integer) | shipcountry (integer) | freight (integer) | orderdate (integer) | "
                + "shippeddate (integer)"), text);
        assertFalse(text.contains("shipname"));
        assertFalse(text.contains("requireddate"));
    }

    @Test
    void whitelistHoldsEveryColumnEvenWhenPruned() {
        List<ColumnDescription> columns = cols("orderid", "c1", "c2", "c3", "c4", "c5", "c6", "c7", "c8", "c9");
        index.rebuild(List.of(table("Orders", 0f, columns), overview(1f, "Orders")));
        when(llm.complete(anyString(), anyDouble(), anyInt())).thenReturn("Orders");

        RetrievalResult result = retriever(text -> new float[]{0f}).retrieve("q", SCHEMA);

        assertEquals(10, result.validColumns().get("orders").size());
        assertTrue(result.validColumns().get("orders").contains("c9"));
    }

    @Test
    void columnsUsedByGoldenExamplesAreCollected() {
        List<ColumnDescription> columns = cols("orderid", "c1", "c2", "c3", "c4", "c5", "c6", "c7", "c8", "c9");
        index.rebuild(List.of(table("orders", 0f, columns)));
        when(llm.complete(anyString(), anyDouble(), anyInt())).thenReturn("orders");
        when(examples.examplesFor(SCHEMA)).thenReturn(List.of(
                new GoldenExample("q", "SELECT o.c9 FROM northwind.orders o")));
        // every column is equally far away, so only the first five, the key and the example column survive
        RetrievalResult result = retriever(text -> new float[]{0f}).retrieve("q", SCHEMA);

        String text = result.documents().get(0).getText();
        assertTrue(text.contains("c9 (integer)"), text);
        assertFalse(text.contains("c8 (integer)"), text);
    }

    @Test
    void keptColumnCountIsAQuarterClampedToFiveAndTen() {
        assertEquals(5, ContextRetriever.keptColumnCount(9));
        assertEquals(6, ContextRetriever.keptColumnCount(24));
        assertEquals(10, ContextRetriever.keptColumnCount(80));
    }

    @Test
    void parsesTableNamesFromModelAnswer() {
        assertEquals(Set.of("orders", "customers"),
                ContextRetriever.parseTableNames("northwind.orders, `customers`\n"));
    }

    @Test
    void unreadableExamplesDoNotStopRetrieval() {
        List<ColumnDescription> columns = cols("orderid", "c1", "c2", "c3", "c4", "c5", "c6", "c7", "c8", "c9");
        index.rebuild(List.of(table("orders", 0f, columns)));
        when(llm.complete(anyString(), anyDouble(), anyInt())).thenReturn("orders");
        when(examples.examplesFor(SCHEMA)).thenThrow(new YAMLException("expected the node content, but found '-'"));

        RetrievalResult result = retriever(text -> new float[]{0f}).retrieve("q", SCHEMA);

        assertEquals(List.of("orders"), result.retrievedTables());
        assertTrue(result.documents().get(0).getText().contains("c4 (integer)"));
    }

    @Test
    void onlyKeyShapedNamesAreAlwaysKept() {
        List<ColumnDescription> columns = cols("c1", "c2", "c3", "c4", "c5", "provider", "holiday", "order_id",
                "id_card", "shipkey", "invoice_number", "c9");
        SchemaDocument orders = table("orders", 0f, columns);
        index.rebuild(List.of(orders));

        String text = retriever(t -> new float[]{0f}).pruneColumns(orders, new float[]{0f}, Set.of()).getText();

        assertTrue(text.contains("order_id (integer)"), text);
        assertTrue(text.contains("id_card (integer)"), text);
        assertTrue(text.contains("shipkey (integer)"), text);
        assertTrue(text.contains("invoice_number (integer)"), text);
        assertFalse(text.contains("provider"), text);
        assertFalse(text.contains("holiday"), text);
        assertFalse(text.contains("c9 (integer)"), text);
    }

    @Test
    void columnEmbeddingsAreReusedUntilTheIndexChanges() {
        List<ColumnDescription> columns = cols("orderid", "c1", "c2", "c3", "c4", "c5", "c6", "c7", "c8", "c9");
        SchemaDocument orders = table("orders", 0f, columns);
        index.rebuild(List.of(orders));
        AtomicInteger calls = new AtomicInteger();
        ContextRetriever retriever = retriever(text -> {
            calls.incrementAndGet();
            return new float[]{0f};
        });

        retriever.pruneColumns(orders, new float[]{0f}, Set.of());
        retriever.pruneColumns(orders, new float[]{0f}, Set.of());
        assertEquals(10, calls.get());

        index.rebuild(List.of(orders));
        retriever.pruneColumns(orders, new float[]{0f}, Set.of());
        assertEquals(20, calls.get());
    }
}
