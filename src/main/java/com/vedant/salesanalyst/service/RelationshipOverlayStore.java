package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.model.Relationship;
import com.vedant.salesanalyst.model.RelationshipOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Manually declared relationships, persisted per schema in a YAML file:
 *
 * <pre>
 * northwind:
 *   - source: orders.customerid
 *     target: customers.customerid
 *     description: each order belongs to one customer
 * </pre>
 */
@Service
public class RelationshipOverlayStore {

    private static final Logger log = LoggerFactory.getLogger(RelationshipOverlayStore.class);

    private final Path path;
    private final Yaml yaml;

    @Autowired
    public RelationshipOverlayStore(@Value("${analyst.relationships-path:relationships.yaml}") String path) {
        this(Path.of(path));
    }

    public RelationshipOverlayStore(Path path) {
        this.path = path;
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    public synchronized List<Relationship> list(String schema) {
        List<Relationship> rels = new ArrayList<>();
        for (Map<String, Object> entry : load().getOrDefault(schema, List.of())) {
            String[] src = String.valueOf(entry.get("source")).split("\\.");
            String[] tgt = String.valueOf(entry.get("target")).split("\\.");
            if (src.length != 2 || tgt.length != 2) {
                log.warn("Skipping malformed relationship entry in {}: {}", path, entry);
                continue;
            }
            Object desc = entry.get("description");
            rels.add(new Relationship(src[0], src[1], tgt[0], tgt[1], RelationshipOrigin.YAML,
                    desc == null ? "" : desc.toString()));
        }
        return rels;
    }

    /** Upsert keyed by (source, target); an existing entry only gets its description replaced. */
    public synchronized void add(String schema, String sourceTable, String sourceColumn,
                                 String targetTable, String targetColumn, String description) {
        Map<String, List<Map<String, Object>>> data = load();
        List<Map<String, Object>> entries = data.computeIfAbsent(schema, k -> new ArrayList<>());
        String source = sourceTable + "." + sourceColumn;
        String target = targetTable + "." + targetColumn;
        String desc = description == null ? "" : description;

        for (Map<String, Object> existing : entries) {
            if (source.equals(existing.get("source")) && target.equals(existing.get("target"))) {
                existing.put("description", desc);
                save(data);
                return;
            }
        }
        entries.add(entry(source, target, desc));
        save(data);
    }

    public synchronized boolean delete(String schema, String source, String target) {
        Map<String, List<Map<String, Object>>> data = load();
        List<Map<String, Object>> entries = data.get(schema);
        if (entries == null) {
            return false;
        }
        boolean removed = entries.removeIf(e -> source.equals(e.get("source")) && target.equals(e.get("target")));
        if (removed) {
            save(data);
        }
        return removed;
    }

    /** Drops every overlay entry of the schema and writes the given ones instead. */
    public synchronized void replaceAll(String schema, List<Relationship> relationships) {
        Map<String, List<Map<String, Object>>> data = load();
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Relationship r : relationships) {
            entries.add(entry(r.source(), r.target(), r.description() == null ? "" : r.description()));
        }
        data.put(schema, entries);
        save(data);
    }

    private static Map<String, Object> entry(String source, String target, String description) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("source", source);
        e.put("target", target);
        e.put("description", description);
        return e;
    }

    @SuppressWarnings("unchecked")
    private Map<String, List<Map<String, Object>>> load() {
        if (!Files.exists(path)) {
            return new LinkedHashMap<>();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Object loaded = yaml.load(reader);
            if (!(loaded instanceof Map)) {
                return new LinkedHashMap<>();
            }
            Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : ((Map<String, Object>) loaded).entrySet()) {
                List<Map<String, Object>> entries = new ArrayList<>();
                if (e.getValue() instanceof List<?> list) {
                    for (Object item : list) {
                        if (item instanceof Map) {
                            entries.add(new LinkedHashMap<>((Map<String, Object>) item));
                        }
                    }
                }
                data.put(e.getKey(), entries);
            }
            return data;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read relationship overlay " + path, e);
        }
    }

    private void save(Map<String, List<Map<String, Object>>> data) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                yaml.dump(data, writer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write relationship overlay " + path, e);
        }
    }
}
