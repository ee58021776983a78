package com.vedant.salesanalyst.controller;

import com.vedant.salesanalyst.dto.NLQueryRequestDTO;
import com.vedant.salesanalyst.dto.NLQueryResponseDTO;
import com.vedant.salesanalyst.dto.SaveQueryRequestDTO;
import com.vedant.salesanalyst.entity.QueryHistory;
import com.vedant.salesanalyst.model.WorkflowState;
import com.vedant.salesanalyst.service.QueryService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    @PostMapping("/nl")
    public ResponseEntity<NLQueryResponseDTO> nlQuery(@RequestBody NLQueryRequestDTO req) {
        try {
            WorkflowState state = queryService.ask(req.getNlQuery());
            return ResponseEntity.ok(NLQueryResponseDTO.from(state));
        } catch (IllegalArgumentException ex) {
            NLQueryResponseDTO dto = new NLQueryResponseDTO();
            dto.setMessage(ex.getMessage());
            return ResponseEntity.badRequest().body(dto);
        } catch (Exception ex) {
            NLQueryResponseDTO dto = new NLQueryResponseDTO();
            dto.setMessage("Execution error: " + ex.getMessage());
            return ResponseEntity.status(500).body(dto);
        }
    }

    @PostMapping("/explain")
    public ResponseEntity<Map<String, String>> explain(@RequestBody Map<String, String> body) {
        try {
            return ResponseEntity.ok(Map.of("explanation", queryService.explain(body.get("sql"))));
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().body(Map.of("message", ex.getMessage()));
        } catch (Exception ex) {
            return ResponseEntity.status(500).body(Map.of("message", "Explanation failed: " + ex.getMessage()));
        }
    }

    @PostMapping("/history")
    public ResponseEntity<Map<String, Object>> save(@RequestBody SaveQueryRequestDTO req) {
        try {
            Long id = queryService.save(req.getQuestion(), req.getSql(), req.getColumns(), req.getRows(), req.getAnalysis());
            return ResponseEntity.ok(Map.of("id", id, "message", "Saved"));
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().body(Map.of("message", ex.getMessage()));
        }
    }

    @GetMapping("/history")
    public ResponseEntity<List<QueryHistory>> history(@RequestParam(required = false) String schema,
                                                      @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(queryService.history(schema, limit));
    }

    @DeleteMapping("/history/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable Long id) {
        if (!queryService.delete(id)) {
            return ResponseEntity.status(404).body(Map.of("message", "No saved query with id " + id));
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    @GetMapping("/history/{id}/csv")
    public ResponseEntity<String> csv(@PathVariable Long id) {
        return queryService.exportCsv(id)
                .map(csv -> ResponseEntity.ok()
                        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"query-" + id + ".csv\"")
                        .contentType(MediaType.parseMediaType("text/csv"))
                        .body(csv))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
