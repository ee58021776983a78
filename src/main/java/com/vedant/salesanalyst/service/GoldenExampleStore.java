package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.model.GoldenExample;
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
 * Curated question/SQL pairs per schema, kept in a YAML file ({@code schema: [{question, sql}]}).
 * Read-only for the pipeline; only the workbook import writes it.
 */
@Service
public class GoldenExampleStore {

    private static final Logger log = LoggerFactory.getLogger(GoldenExampleStore.class);

    private final Path path;
    private final Yaml yaml;

    @Autowired
    public GoldenExampleStore(@Value("${analyst.examples-path:examples.yaml}") String path) {
        this(Path.of(path));
    }

    public GoldenExampleStore(Path path) {
        this.path = path;
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setDefaultScalarStyle(DumperOptions.ScalarStyle.PLAIN);
        this.yaml = new Yaml(options);
    }

    public synchronized List<GoldenExample> examplesFor(String schema) {
        Object entries = load().get(schema);
        if (!(entries instanceof List<?> list)) {
            return List.of();
        }
        List<GoldenExample> examples = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> m && m.get("question") != null && m.get("sql") != null) {
                examples.add(new GoldenExample(m.get("question").toString().trim(), m.get("sql").toString().trim()));
            } else {
                log.warn("Skipping malformed golden example for schema {}: {}", schema, item);
            }
        }
        return examples;
    }

    public synchronized void replace(String schema, List<GoldenExample> examples) {
        Map<String, Object> data = load();
        List<Map<String, String>> entries = new ArrayList<>();
        for (GoldenExample ex : examples) {
            Map<String, String> e = new LinkedHashMap<>();
            e.put("question", ex.question());
            e.put("sql", ex.sql());
            entries.add(e);
        }
        data.put(schema, entries);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                yaml.dump(data, writer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write golden examples " + path, e);
        }
        log.info("Saved {} golden examples for schema {}", examples.size(), schema);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> load() {
        if (!Files.exists(path)) {
            return new LinkedHashMap<>();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Object loaded = yaml.load(reader);
            return loaded instanceof Map ? new LinkedHashMap<>((Map<String, Object>) loaded) : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read golden examples " + path, e);
        }
    }
}
