package com.vedant.salesanalyst.vector;

import com.vedant.salesanalyst.model.DocumentMetadata;
import com.vedant.salesanalyst.model.SchemaDocument;
import com.vedant.salesanalyst.model.ScoredDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VectorIndexTest {

    private static SchemaDocument doc(String table, float... embedding) {
        return new SchemaDocument("Table " + table, embedding,
                DocumentMetadata.table("db", "sales", table, null, List.of(), List.of()));
    }

    @Test
    void emptyIndexReturnsNoResults() {
        VectorIndex index = new VectorIndex();
        assertTrue(index.search(new float[]{1f, 2f}, 8).isEmpty());
        assertTrue(index.isEmpty());
    }

    @Test
    void searchReturnsNearestFirstWithSquaredDistance() {
        VectorIndex index = new VectorIndex();
        index.rebuild(List.of(doc("far", 3f, 0f), doc("near", 1f, 0f), doc("mid", 2f, 0f)));

        List<ScoredDocument> hits = index.search(new float[]{0f, 0f}, 2);

        assertEquals(2, hits.size());
        assertEquals("near", hits.get(0).table());
        assertEquals(1.0, hits.get(0).distance(), 1e-9);
        assertEquals("mid", hits.get(1).table());
        assertEquals(4.0, hits.get(1).distance(), 1e-9);
    }

    @Test
    void kLargerThanIndexReturnsEverything() {
        VectorIndex index = new VectorIndex();
        index.add(List.of(doc("a", 1f), doc("b", 2f)));
        assertEquals(2, index.search(new float[]{0f}, 10).size());
    }

    @Test
    void equalDistancesKeepInsertionOrder() {
        VectorIndex index = new VectorIndex();
        index.rebuild(List.of(doc("first", 1f), doc("second", -1f), doc("third", 1f)));

        List<ScoredDocument> hits = index.search(new float[]{0f}, 3);

        assertEquals(List.of("first", "second", "third"), hits.stream().map(ScoredDocument::table).toList());
    }

    @Test
    void rebuildingWithSameDocumentsIsIdempotent() {
        List<SchemaDocument> docs = List.of(doc("customers", 0f, 1f), doc("orders", 1f, 1f), doc("products", 2f, 2f));
        VectorIndex index = new VectorIndex();

        index.rebuild(docs);
        List<String> texts = index.texts();
        List<DocumentMetadata> metadata = index.metadata();
        List<String> firstHits = index.search(new float[]{1f, 1f}, 2).stream().map(ScoredDocument::table).toList();

        index.rebuild(docs);

        assertEquals(texts, index.texts());
        assertEquals(metadata, index.metadata());
        assertEquals(firstHits, index.search(new float[]{1f, 1f}, 2).stream().map(ScoredDocument::table).toList());
        assertEquals(3, index.size());
    }

    @Test
    void resetClearsAndBumpsGeneration() {
        VectorIndex index = new VectorIndex();
        index.rebuild(List.of(doc("a", 1f)));
        long generation = index.generation();

        index.reset();

        assertTrue(index.isEmpty());
        assertTrue(index.generation() > generation);
    }

    @Test
    void mixedDimensionsAreRejectedAndIndexIsUnchanged() {
        VectorIndex index = new VectorIndex();
        index.rebuild(List.of(doc("a", 1f, 1f)));

        assertThrows(IllegalArgumentException.class,
                () -> index.rebuild(List.of(doc("b", 1f, 1f), doc("c", 1f))));
        assertEquals(List.of("Table a"), index.texts());
    }

    @Test
    void queryWithWrongDimensionIsRejected() {
        VectorIndex index = new VectorIndex();
        index.rebuild(List.of(doc("a", 1f, 1f)));
        assertThrows(IllegalArgumentException.class, () -> index.search(new float[]{1f}, 1));
    }

    @Test
    void tableCountIgnoresOverview() {
        VectorIndex index = new VectorIndex();
        index.rebuild(List.of(doc("a", 1f),
                new SchemaDocument("overview", new float[]{0f}, DocumentMetadata.overview("db", "sales"))));
        assertEquals(1, index.tableCount());
    }
}
