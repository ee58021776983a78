package com.vedant.salesanalyst.vector;

import com.vedant.salesanalyst.model.DocumentMetadata;
import com.vedant.salesanalyst.model.ScoredDocument;
import com.vedant.salesanalyst.model.SchemaDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exact nearest-neighbour store over schema document embeddings, squared Euclidean distance.
 *
 * <p>Documents live in an immutable {@link Snapshot}; every mutation builds a new snapshot and
 * publishes it in one volatile write, so texts, metadata and embeddings of the same position
 * always belong together. Mutations are serialised by a lock. Searches never lock and see
 * either the old or the new snapshot, never a half-built one.</p>
 */
@Component
public class VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(VectorIndex.class);

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /** Appends documents after the existing ones. */
    public void add(Collection<SchemaDocument> documents) {
        writeLock.lock();
        try {
            List<SchemaDocument> merged = new ArrayList<>(snapshot.documents());
            merged.addAll(documents);
            snapshot = Snapshot.of(merged, snapshot.generation() + 1);
        } finally {
            writeLock.unlock();
        }
    }

    /** Replaces the whole document set in one step. */
    public void rebuild(Collection<SchemaDocument> documents) {
        Snapshot next;
        writeLock.lock();
        try {
            next = Snapshot.of(new ArrayList<>(documents), snapshot.generation() + 1);
            snapshot = next;
        } finally {
            writeLock.unlock();
        }
        log.info("Vector index rebuilt: {} documents, generation {}", next.size(), next.generation());
    }

    public void reset() {
        writeLock.lock();
        try {
            snapshot = new Snapshot(List.of(), 0, snapshot.generation() + 1);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * The k closest documents in ascending distance. Ties keep insertion order.
     * An empty index yields an empty list.
     */
    public List<ScoredDocument> search(float[] queryEmbedding, int k) {
        Snapshot current = snapshot;
        if (current.size() == 0 || k <= 0) {
            return List.of();
        }
        if (queryEmbedding.length != current.dimension()) {
            throw new IllegalArgumentException("Query embedding has dimension " + queryEmbedding.length
                    + " but the index holds dimension " + current.dimension());
        }
        List<ScoredDocument> scored = new ArrayList<>(current.size());
        for (SchemaDocument doc : current.documents()) {
            scored.add(new ScoredDocument(doc, doc.squaredDistanceTo(queryEmbedding)));
        }
        scored.sort(Comparator.comparingDouble(ScoredDocument::distance));
        return List.copyOf(scored.subList(0, Math.min(k, scored.size())));
    }

    public List<SchemaDocument> documents() {
        return snapshot.documents();
    }

    public List<String> texts() {
        return snapshot.documents().stream().map(SchemaDocument::getText).toList();
    }

    public List<DocumentMetadata> metadata() {
        return snapshot.documents().stream().map(SchemaDocument::getMetadata).toList();
    }

    public long tableCount() {
        return snapshot.documents().stream().filter(d -> d.getMetadata().isTable()).count();
    }

    public int size() {
        return snapshot.size();
    }

    public boolean isEmpty() {
        return snapshot.size() == 0;
    }

    /** Incremented on every mutation; lets callers drop caches tied to an older index. */
    public long generation() {
        return snapshot.generation();
    }

    record Snapshot(List<SchemaDocument> documents, int dimension, long generation) {

        static final Snapshot EMPTY = new Snapshot(List.of(), 0, 0);

        static Snapshot of(List<SchemaDocument> documents, long generation) {
            if (documents.isEmpty()) {
                return new Snapshot(List.of(), 0, generation);
            }
            int dimension = documents.get(0).dimension();
            for (SchemaDocument doc : documents) {
                if (doc.dimension() != dimension) {
                    throw new IllegalArgumentException("All embeddings must have dimension " + dimension
                            + " but " + doc + " has " + doc.dimension());
                }
            }
            return new Snapshot(List.copyOf(documents), dimension, generation);
        }

        int size() {
            return documents.size();
        }
    }
}
