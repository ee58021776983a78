package com.vedant.salesanalyst.controller;

import com.vedant.salesanalyst.dto.RelationshipRequestDTO;
import com.vedant.salesanalyst.model.GlossaryStatus;
import com.vedant.salesanalyst.model.Relationship;
import com.vedant.salesanalyst.service.RelationshipService;
import com.vedant.salesanalyst.service.SchemaIndexer;
import com.vedant.salesanalyst.service.SqlExecutor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schema")
public class SchemaController {

    private final SchemaIndexer schemaIndexer;
    private final RelationshipService relationshipService;
    private final SqlExecutor sqlExecutor;

    public SchemaController(SchemaIndexer schemaIndexer, RelationshipService relationshipService, SqlExecutor sqlExecutor) {
        this.schemaIndexer = schemaIndexer;
        this.relationshipService = relationshipService;
        this.sqlExecutor = sqlExecutor;
    }

    @PostMapping("/reindex")
    public ResponseEntity<?> reindex(@RequestParam(required = false) String schema) {
        String target = schema == null || schema.isBlank() ? schemaIndexer.activeSchema() : schema;
        try {
            GlossaryStatus status = schemaIndexer.reindex(target);
            return ResponseEntity.ok(status);
        } catch (Exception ex) {
            return ResponseEntity.status(500).body(Map.of("message", "Re-index failed: " + ex.getMessage()));
        }
    }

    @GetMapping("/relationships")
    public ResponseEntity<List<Relationship>> relationships(@RequestParam(required = false) String schema) {
        String target = schema == null || schema.isBlank() ? schemaIndexer.activeSchema() : schema;
        return ResponseEntity.ok(relationshipService.allRelationships(sqlExecutor, target));
    }

    @PostMapping("/relationships")
    public ResponseEntity<Map<String, String>> addRelationship(@RequestParam(required = false) String schema,
                                                               @RequestBody RelationshipRequestDTO req) {
        if (isBlank(req.getSourceTable()) || isBlank(req.getSourceColumn())
                || isBlank(req.getTargetTable()) || isBlank(req.getTargetColumn())) {
            return ResponseEntity.badRequest().body(Map.of("message", "Source and target table and column are required"));
        }
        String target = isBlank(schema) ? schemaIndexer.activeSchema() : schema;
        relationshipService.addRelationship(target, req.getSourceTable().trim(), req.getSourceColumn().trim(),
                req.getTargetTable().trim(), req.getTargetColumn().trim(), req.getDescription());
        return ResponseEntity.ok(Map.of("status", "saved", "note", "Re-index the schema to use it in answers"));
    }

    @DeleteMapping("/relationships")
    public ResponseEntity<Map<String, String>> deleteRelationship(@RequestParam(required = false) String schema,
                                                                  @RequestParam String source,
                                                                  @RequestParam String target) {
        String s = isBlank(schema) ? schemaIndexer.activeSchema() : schema;
        if (!relationshipService.deleteRelationship(s, source, target)) {
            return ResponseEntity.status(404).body(Map.of("message", "No relationship " + source + " -> " + target));
        }
        return ResponseEntity.ok(Map.of("status", "deleted"));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
