package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.llm.EmbeddingModel;
import com.vedant.salesanalyst.model.GoldenExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the golden examples whose questions sit closest to the current question.
 * Example questions are embedded once and cached per schema.
 */
@Service
public class ExampleSelector {

    private static final Logger log = LoggerFactory.getLogger(ExampleSelector.class);

    static final int TOP_K = 3;

    private final EmbeddingModel embeddings;
    private final GoldenExampleStore store;
    private final Map<String, float[]> cache = new ConcurrentHashMap<>();

    public ExampleSelector(EmbeddingModel embeddings, GoldenExampleStore store) {
        this.embeddings = embeddings;
        this.store = store;
    }

    public List<GoldenExample> select(String question, String schema) {
        return select(question, schema, TOP_K);
    }

    public List<GoldenExample> select(String question, String schema, int k) {
        List<GoldenExample> examples = store.examplesFor(schema);
        if (examples.isEmpty() || k <= 0) {
            return List.of();
        }
        float[] target = embeddings.embed(question);

        record Ranked(GoldenExample example, double distance) {}
        List<Ranked> ranked = new ArrayList<>();
        for (GoldenExample ex : examples) {
            float[] emb = exampleEmbedding(schema, ex);
            if (emb == null || emb.length != target.length) {
                continue;
            }
            double sum = 0;
            for (int i = 0; i < emb.length; i++) {
                double d = emb[i] - target[i];
                sum += d * d;
            }
            ranked.add(new Ranked(ex, sum));
        }
        ranked.sort(Comparator.comparingDouble(Ranked::distance));

        List<GoldenExample> top = ranked.stream().limit(k).map(Ranked::example).toList();
        log.info("Selected {} of {} golden examples for schema {}", top.size(), examples.size(), schema);
        return top;
    }

    /** Drops cached embeddings, e.g. after the examples of a schema were replaced. */
    public void invalidate(String schema) {
        cache.keySet().removeIf(k -> k.startsWith(schema + "\u0000"));
    }

    private float[] exampleEmbedding(String schema, GoldenExample example) {
        String key = schema + "\u0000" + example.question();
        float[] cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        try {
            float[] emb = embeddings.embed(example.question());
            cache.put(key, emb);
            return emb;
        } catch (RuntimeException e) {
            log.warn("Skipping golden example '{}': embedding failed: {}", example.question(), e.getMessage());
            return null;
        }
    }
}
