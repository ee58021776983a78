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
import com.vedant.salesanalyst.model.ScoredDocument;
import com.vedant.salesanalyst.vector.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Turns a question into the smallest useful slice of schema knowledge.
 *
 * <ol>
 *   <li>nearest {@value #SEARCH_K} documents to the question embedding;</li>
 *   <li>small schemas: a model pass picks tables by name and description; larger ones keep
 *       every hit within {@value #RELATIVE_THRESHOLD} times the best distance;</li>
 *   <li>the overview document is always kept;</li>
 *   <li>wide tables are cut down to their closest columns plus key and example columns.</li>
 * </ol>
 *
 * The validation whitelist is built from the full, unpruned column lists of every indexed table.
 */
@Service
public class ContextRetriever {

    private static final Logger log = LoggerFactory.getLogger(ContextRetriever.class);

    static final int SEARCH_K = 8;
    static final double RELATIVE_THRESHOLD = 1.15;
    static final int SMALL_SCHEMA_TABLES = 5;
    static final int PRUNE_ABOVE_COLUMNS = 8;
    static final int MIN_KEPT_COLUMNS = 5;
    static final int MAX_KEPT_COLUMNS = 10;

    private static final Pattern KEY_FRAGMENT = Pattern.compile("(?:^|_)id_|id$|key|number", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final EmbeddingModel embeddings;
    private final LanguageModel languageModel;
    private final VectorIndex index;
    private final GoldenExampleStore exampleStore;

    private final AtomicReference<ColumnCache> columnCache = new AtomicReference<>(new ColumnCache(-1, Map.of()));

    public ContextRetriever(EmbeddingModel embeddings,
                            LanguageModel languageModel,
                            VectorIndex index,
                            GoldenExampleStore exampleStore) {
        this.embeddings = embeddings;
        this.languageModel = languageModel;
        this.index = index;
        this.exampleStore = exampleStore;
    }

    public RetrievalResult retrieve(String question, String schema) {
        float[] queryEmbedding;
        List<ScoredDocument> hits;
        try {
            queryEmbedding = embeddings.embed(question);
            hits = index.search(queryEmbedding, SEARCH_K);
        } catch (RuntimeException e) {
            throw new RetrievalException("Context retrieval failed: " + e.getMessage(), e);
        }

        if (hits.isEmpty()) {
            log.warn("Vector index returned nothing for schema {}, using overview-only context", schema);
            return overviewOnly(schema);
        }

        List<ScoredDocument> kept = index.tableCount() <= SMALL_SCHEMA_TABLES
                ? selectByModel(question, hits)
                : filterByDistance(hits);
        kept = withOverview(kept, hits);

        Set<String> exampleColumns = exampleColumns(schema);
        List<SchemaDocument> documents = new ArrayList<>();
        List<String> tables = new ArrayList<>();
        for (ScoredDocument hit : kept) {
            SchemaDocument doc = hit.document();
            if (doc.getMetadata().isTable()) {
                tables.add(doc.getMetadata().table());
                documents.add(pruneColumns(doc, queryEmbedding, exampleColumns));
            } else {
                documents.add(doc);
            }
        }

        log.info("Retrieved tables for '{}': {}", question, tables);
        return new RetrievalResult(documents, tables, validColumns());
    }

    /* ============================================================
       TABLE SELECTION
       ============================================================ */

    /** Keeps hits within {@value #RELATIVE_THRESHOLD} times the smallest distance. */
    static List<ScoredDocument> filterByDistance(List<ScoredDocument> hits) {
        double best = hits.stream().mapToDouble(ScoredDocument::distance).min().orElse(0);
        double cutoff = best * RELATIVE_THRESHOLD;
        return hits.stream().filter(h -> h.distance() <= cutoff).toList();
    }

    private List<ScoredDocument> selectByModel(String question, List<ScoredDocument> hits) {
        List<ScoredDocument> tableHits = hits.stream().filter(h -> !h.isOverview()).toList();
        if (tableHits.isEmpty()) {
            return hits;
        }
        StringBuilder catalog = new StringBuilder();
        for (ScoredDocument hit : tableHits) {
            DocumentMetadata meta = hit.document().getMetadata();
            catalog.append("- ").append(meta.table());
            if (meta.tableComment() != null && !meta.tableComment().isBlank()) {
                catalog.append(": ").append(meta.tableComment());
            }
            catalog.append("\n");
        }
        String prompt = "Given the question and the list of tables below, list the table names needed to answer it.\n"
                + "Reply with table names only, comma-separated, nothing else.\n\n"
                + "Tables:\n" + catalog + "\n"
                + "Question: " + question;

        String answer;
        try {
            answer = languageModel.complete(prompt, 0.0, 200);
        } catch (LlmException e) {
            log.warn("Table selection pass failed, keeping all retrieved tables: {}", e.getMessage());
            return hits;
        }

        Set<String> chosen = parseTableNames(answer);
        List<ScoredDocument> selected = hits.stream()
                .filter(h -> h.isOverview() || chosen.contains(h.table().toLowerCase(Locale.ROOT)))
                .toList();
        if (selected.stream().noneMatch(h -> !h.isOverview())) {
            log.debug("Table selection answer '{}' matched no table, keeping all", answer);
            return hits;
        }
        return selected;
    }

    // "sales.orders, customers" -> {orders, customers}
    static Set<String> parseTableNames(String answer) {
        Set<String> names = new HashSet<>();
        if (answer == null) {
            return names;
        }
        for (String token : answer.split("[,\\n]")) {
            String t = token.replace("`", "").replace("\"", "").replace("-", " ").trim();
            if (t.contains(".")) {
                t = t.substring(t.lastIndexOf('.') + 1);
            }
            if (TABLE_NAME.matcher(t).matches()) {
                names.add(t.toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    private List<ScoredDocument> withOverview(List<ScoredDocument> kept, List<ScoredDocument> hits) {
        if (kept.stream().anyMatch(ScoredDocument::isOverview)) {
            return kept;
        }
        Optional<ScoredDocument> overview = hits.stream().filter(ScoredDocument::isOverview).findFirst();
        if (overview.isEmpty()) {
            overview = index.documents().stream()
                    .filter(d -> d.getMetadata().isOverview())
                    .findFirst()
                    .map(d -> new ScoredDocument(d, Double.MAX_VALUE));
        }
        if (overview.isEmpty()) {
            return kept;
        }
        List<ScoredDocument> out = new ArrayList<>(kept);
        out.add(overview.get());
        return out;
    }

    private RetrievalResult overviewOnly(String schema) {
        String text = "Use " + schema + " schema. Query information_schema to discover available tables and columns.";
        SchemaDocument doc = new SchemaDocument(text, new float[0], DocumentMetadata.overview(null, schema));
        return new RetrievalResult(List.of(doc), List.of(), Map.of());
    }

    /* ============================================================
       COLUMN PRUNING
       ============================================================ */
    SchemaDocument pruneColumns(SchemaDocument doc, float[] queryEmbedding, Set<String> exampleColumns) {
        DocumentMetadata meta = doc.getMetadata();
        List<ColumnDescription> columns = meta.columns();
        if (columns.size() <= PRUNE_ABOVE_COLUMNS) {
            return doc;
        }

        List<Double> distances = new ArrayList<>(columns.size());
        for (ColumnDescription column : columns) {
            float[] emb = columnEmbedding(meta.table() + "." + column.describe());
            if (emb == null) {
                // an unembeddable column is ranked last but can still come back as a key column
                distances.add(Double.MAX_VALUE);
            } else {
                distances.add(squaredDistance(emb, queryEmbedding));
            }
        }

        Set<Integer> keep = new TreeSet<>(topColumns(distances, keptColumnCount(columns.size())));
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i).name();
            if (KEY_FRAGMENT.matcher(name).find() || exampleColumns.contains(name.toLowerCase(Locale.ROOT))) {
                keep.add(i);
            }
        }

        List<ColumnDescription> pruned = new ArrayList<>();
        for (int i : keep) {
            pruned.add(columns.get(i));
        }
        log.debug("Pruned {}.{} from {} to {} columns", meta.schema(), meta.table(), columns.size(), pruned.size());
        return doc.withText(SchemaDocument.tableText(meta.schema(), meta.table(), meta.tableComment(),
                pruned, meta.relationships()));
    }

    /** A quarter of the columns, never fewer than 5 nor more than 10. */
    static int keptColumnCount(int columnCount) {
        return Math.max(MIN_KEPT_COLUMNS, Math.min(MAX_KEPT_COLUMNS, columnCount / 4));
    }

    // indexes of the n smallest distances; stable on ties
    static List<Integer> topColumns(List<Double> distances, int n) {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < distances.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble(distances::get));
        return order.subList(0, Math.min(n, order.size()));
    }

    private float[] columnEmbedding(String text) {
        Map<String, float[]> cache = cacheFor(index.generation());
        float[] cached = cache.get(text);
        if (cached != null) {
            return cached;
        }
        try {
            float[] emb = embeddings.embed(text);
            cache.put(text, emb);
            return emb;
        } catch (RuntimeException e) {
            log.warn("Could not embed column '{}': {}", text, e.getMessage());
            return null;
        }
    }

    // a rebuilt index gets a fresh map; writers still holding an older map only touch that one
    private Map<String, float[]> cacheFor(long generation) {
        ColumnCache current = columnCache.get();
        while (current.generation() != generation) {
            ColumnCache fresh = new ColumnCache(generation, new ConcurrentHashMap<>());
            if (columnCache.compareAndSet(current, fresh)) {
                return fresh.embeddings();
            }
            current = columnCache.get();
        }
        return current.embeddings();
    }

    private record ColumnCache(long generation, Map<String, float[]> embeddings) {}

    private static double squaredDistance(float[] a, float[] b) {
        if (a.length != b.length) {
            return Double.MAX_VALUE;
        }
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    private Set<String> exampleColumns(String schema) {
        List<GoldenExample> examples;
        try {
            examples = exampleStore.examplesFor(schema);
        } catch (RuntimeException e) {
            log.warn("Could not read golden examples for schema {}, pruning without them: {}", schema, e.getMessage());
            return Set.of();
        }
        Set<String> names = new HashSet<>();
        for (GoldenExample example : examples) {
            for (String token : example.sql().toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")) {
                if (!token.isEmpty()) {
                    names.add(token);
                }
            }
        }
        return names;
    }

    /* ============================================================
       WHITELIST
       ============================================================ */
    Map<String, Set<String>> validColumns() {
        Map<String, Set<String>> valid = new LinkedHashMap<>();
        for (SchemaDocument doc : index.documents()) {
            DocumentMetadata meta = doc.getMetadata();
            if (!meta.isTable()) {
                continue;
            }
            Set<String> cols = valid.computeIfAbsent(meta.table().toLowerCase(Locale.ROOT), k -> new LinkedHashSet<>());
            for (ColumnDescription column : meta.columns()) {
                cols.add(column.name().toLowerCase(Locale.ROOT));
            }
        }
        return valid;
    }
}
