package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.model.Relationship;
import com.vedant.salesanalyst.model.RelationshipOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Merges join metadata from declared foreign keys, {@code [FK: table.column]} column comments
 * and the YAML/UI overlay into one deduplicated list.
 *
 * <p>Priority, lowest first: fk_constraint, comment_fk, yaml. Edges are keyed by
 * (source_table, source_column, target_table, target_column) and the later source wins.</p>
 */
@Service
public class RelationshipService {

    private static final Logger log = LoggerFactory.getLogger(RelationshipService.class);

    static final Pattern FK_TAG = Pattern.compile("\\[FK:\\s*(\\w+)\\.(\\w+)\\]", Pattern.CASE_INSENSITIVE);

    private static final String FK_SQL =
            "SELECT tc.table_name, kcu.column_name, ccu.table_name, ccu.column_name " +
            "FROM information_schema.table_constraints tc " +
            "JOIN information_schema.key_column_usage kcu ON tc.constraint_name = kcu.constraint_name " +
            "JOIN information_schema.constraint_column_usage ccu ON tc.constraint_name = ccu.constraint_name " +
            "WHERE tc.constraint_type = 'FOREIGN KEY' AND tc.table_schema = ?";

    private static final String COMMENT_SQL =
            "SELECT c.table_name, c.column_name, d.description " +
            "FROM information_schema.columns c " +
            "LEFT JOIN (SELECT cl.oid, cl.relname, ns.nspname FROM pg_catalog.pg_class cl " +
            "JOIN pg_catalog.pg_namespace ns ON cl.relnamespace = ns.oid WHERE cl.relkind = 'r') t " +
            "ON t.relname = c.table_name AND t.nspname = c.table_schema " +
            "LEFT JOIN pg_catalog.pg_description d ON t.oid = d.objoid AND d.objsubid = c.ordinal_position " +
            "WHERE c.table_schema = ? AND d.description IS NOT NULL";

    private final RelationshipOverlayStore overlayStore;

    public RelationshipService(RelationshipOverlayStore overlayStore) {
        this.overlayStore = overlayStore;
    }

    /* ============================================================
       SOURCES
       ============================================================ */
    public List<Relationship> foreignKeyRelationships(SqlExecutor executor, String schema) {
        List<Relationship> rels = new ArrayList<>();
        try {
            for (List<Object> r : executor.runQuery(FK_SQL, schema)) {
                rels.add(new Relationship(str(r.get(0)), str(r.get(1)), str(r.get(2)), str(r.get(3)),
                        RelationshipOrigin.FK_CONSTRAINT, ""));
            }
        } catch (RuntimeException e) {
            log.warn("Could not read foreign key constraints for schema {}: {}", schema, e.getMessage());
            return List.of();
        }
        return rels;
    }

    public List<Relationship> commentRelationships(SqlExecutor executor, String schema) {
        List<Relationship> rels = new ArrayList<>();
        try {
            for (List<Object> r : executor.runQuery(COMMENT_SQL, schema)) {
                parseCommentTag(str(r.get(0)), str(r.get(1)), str(r.get(2))).ifPresent(rels::add);
            }
        } catch (RuntimeException e) {
            log.warn("Could not read column comments for schema {}: {}", schema, e.getMessage());
            return List.of();
        }
        return rels;
    }

    static Optional<Relationship> parseCommentTag(String table, String column, String comment) {
        if (comment == null) {
            return Optional.empty();
        }
        Matcher m = FK_TAG.matcher(comment);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new Relationship(table, column, m.group(1), m.group(2), RelationshipOrigin.COMMENT_FK, ""));
    }

    public List<Relationship> overlayRelationships(String schema) {
        return overlayStore.list(schema);
    }

    /* ============================================================
       MERGE
       ============================================================ */
    public List<Relationship> allRelationships(SqlExecutor executor, String schema) {
        List<Relationship> merged = merge(
                foreignKeyRelationships(executor, schema),
                commentRelationships(executor, schema),
                overlayRelationships(schema));
        log.info("Relationships for schema {}: {} after merge", schema, merged.size());
        return merged;
    }

    /** Sources in priority order, lowest first. */
    @SafeVarargs
    public static List<Relationship> merge(List<Relationship>... sources) {
        Map<Relationship.Key, Relationship> seen = new LinkedHashMap<>();
        for (List<Relationship> source : sources) {
            for (Relationship rel : source) {
                seen.put(rel.key(), rel);
            }
        }
        return new ArrayList<>(seen.values());
    }

    /**
     * Per table, human-readable join hints: forward {@code col -> schema.table.col (description)}
     * on the source table and {@code Referenced by schema.table.col (description)} on the target.
     */
    public static Map<String, List<String>> buildRelationshipMap(List<Relationship> relationships, String schema) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (Relationship rel : relationships) {
            String suffix = rel.hasDescription() ? " (" + rel.description() + ")" : "";
            map.computeIfAbsent(rel.sourceTable(), k -> new ArrayList<>())
                    .add(rel.sourceColumn() + " -> " + schema + "." + rel.targetTable() + "." + rel.targetColumn() + suffix);
            map.computeIfAbsent(rel.targetTable(), k -> new ArrayList<>())
                    .add("Referenced by " + schema + "." + rel.sourceTable() + "." + rel.sourceColumn() + suffix);
        }
        return map;
    }

    /* ============================================================
       OVERLAY EDITS
       ============================================================ */
    public void addRelationship(String schema, String sourceTable, String sourceColumn,
                                String targetTable, String targetColumn, String description) {
        overlayStore.add(schema, sourceTable, sourceColumn, targetTable, targetColumn, description);
        log.info("Saved relationship {}.{} -> {}.{} for schema {}", sourceTable, sourceColumn, targetTable, targetColumn, schema);
    }

    public boolean deleteRelationship(String schema, String source, String target) {
        boolean removed = overlayStore.delete(schema, source, target);
        log.info("Delete relationship {} -> {} for schema {}: {}", source, target, schema, removed ? "removed" : "not found");
        return removed;
    }

    private static String str(Object o) {
        return o == null ? null : o.toString();
    }
}
