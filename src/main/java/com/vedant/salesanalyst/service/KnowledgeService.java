package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.model.KnowledgeWorkbook;
import com.vedant.salesanalyst.model.Relationship;
import com.vedant.salesanalyst.util.KnowledgeWorkbookParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Imports a knowledge workbook: its golden queries replace the schema's examples and the
 * join columns it implies replace the schema's relationship overlay.
 */
@Service
public class KnowledgeService {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeService.class);

    private final GoldenExampleStore exampleStore;
    private final RelationshipOverlayStore overlayStore;
    private final ExampleSelector exampleSelector;

    public KnowledgeService(GoldenExampleStore exampleStore,
                            RelationshipOverlayStore overlayStore,
                            ExampleSelector exampleSelector) {
        this.exampleStore = exampleStore;
        this.overlayStore = overlayStore;
        this.exampleSelector = exampleSelector;
    }

    public ImportSummary processUpload(String schema, MultipartFile file) throws IOException {
        String name = file.getOriginalFilename() == null ? "" : file.getOriginalFilename().toLowerCase();
        if (!name.endsWith(".xlsx") && !name.endsWith(".xls")) {
            throw new IllegalArgumentException("Knowledge workbook must be an Excel file, got '" + name + "'");
        }
        try (InputStream in = file.getInputStream()) {
            return importWorkbook(schema, in);
        }
    }

    public ImportSummary importWorkbook(String schema, InputStream in) throws IOException {
        if (schema == null || schema.isBlank()) {
            throw new IllegalArgumentException("Schema name is required");
        }
        KnowledgeWorkbook workbook = KnowledgeWorkbookParser.parse(in);
        List<Relationship> rels = KnowledgeWorkbookParser.detectJoinColumns(workbook.columns());

        overlayStore.replaceAll(schema, rels);
        exampleStore.replace(schema, workbook.queries());
        exampleSelector.invalidate(schema);

        logger.info("Imported workbook for schema {}: {} tables, {} columns, {} relationships, {} golden queries",
                schema, workbook.tables().size(), workbook.columns().size(), rels.size(), workbook.queries().size());
        return new ImportSummary(schema, workbook.tables().size(), workbook.columns().size(), rels.size(),
                workbook.queries().size());
    }

    public record ImportSummary(String schema, int tables, int columns, int relationships, int queries) {}
}
