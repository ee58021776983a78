package com.vedant.salesanalyst.controller;

import com.vedant.salesanalyst.dto.UploadResponseDTO;
import com.vedant.salesanalyst.service.KnowledgeService;
import com.vedant.salesanalyst.service.SchemaIndexer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/knowledge")
public class KnowledgeController {

    private final KnowledgeService knowledgeService;
    private final SchemaIndexer schemaIndexer;

    public KnowledgeController(KnowledgeService knowledgeService, SchemaIndexer schemaIndexer) {
        this.knowledgeService = knowledgeService;
        this.schemaIndexer = schemaIndexer;
    }

    @PostMapping("/upload")
    public ResponseEntity<UploadResponseDTO> upload(@RequestPart("file") MultipartFile file,
                                                    @RequestParam(required = false) String schema) {
        String target = schema == null || schema.isBlank() ? schemaIndexer.activeSchema() : schema;
        try {
            KnowledgeService.ImportSummary s = knowledgeService.processUpload(target, file);
            UploadResponseDTO resp = new UploadResponseDTO(s.schema(), s.tables(), s.columns(), s.relationships(),
                    s.queries(), "Imported " + s.relationships() + " relationships and " + s.queries() + " golden queries");
            return ResponseEntity.ok(resp);
        } catch (Exception ex) {
            return ResponseEntity.badRequest().body(new UploadResponseDTO(target, 0, 0, 0, 0, "Upload failed: " + ex.getMessage()));
        }
    }
}
