package com.vedant.salesanalyst.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.salesanalyst.entity.QueryHistory;
import com.vedant.salesanalyst.model.WorkflowState;
import com.vedant.salesanalyst.repository.QueryHistoryRepository;
import com.vedant.salesanalyst.util.CsvExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Entry point for the web layer: answers questions against the live database and keeps
 * the saved query history.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    static final int MAX_SAVED_ROWS = 100;
    static final int TRIMMED_ROWS = 20;
    static final int MAX_RESULTS_JSON = 65535;
    static final int MAX_ANALYSIS = 30000;

    private final AnalysisWorkflow workflow;
    private final ResultNarrator narrator;
    private final SqlExecutor sqlExecutor;
    private final SchemaIndexer schemaIndexer;
    private final QueryHistoryRepository historyRepository;
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    public QueryService(
            AnalysisWorkflow workflow,
            ResultNarrator narrator,
            SqlExecutor sqlExecutor,
            SchemaIndexer schemaIndexer,
            QueryHistoryRepository historyRepository
    ) {
        this.workflow = workflow;
        this.narrator = narrator;
        this.sqlExecutor = sqlExecutor;
        this.schemaIndexer = schemaIndexer;
        this.historyRepository = historyRepository;
    }

    /* ============================================================
       MAIN: NL → SQL → EXECUTE → ANALYSIS
       ============================================================ */
    public WorkflowState ask(String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be empty");
        }
        return workflow.execute(question.trim(), schemaIndexer.activeSchema(), sqlExecutor);
    }

    public String explain(String sql) {
        return narrator.explain(sql);
    }

    /* ============================================================
       SAVED HISTORY
       ============================================================ */
    public Long save(String question, String sql, List<String> columns, List<List<Object>> rows, String analysis) {
        if (question == null || question.isBlank() || sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("Question and SQL are required");
        }
        List<List<Object>> safeRows = rows == null ? List.of() : rows;

        QueryHistory h = new QueryHistory();
        h.setSchemaName(schemaIndexer.activeSchema());
        h.setQuestion(question);
        h.setGeneratedSql(sql);
        h.setRowCount(safeRows.size());
        h.setAnalysis(analysis == null || analysis.length() <= MAX_ANALYSIS ? analysis : analysis.substring(0, MAX_ANALYSIS));
        h.setResultsJson(resultsJson(columns, safeRows));

        Long id = historyRepository.save(h).getId();
        log.info("Saved query {} for schema {} ({} rows)", id, h.getSchemaName(), safeRows.size());
        return id;
    }

    /** Up to 100 rows; cut to 20 when the JSON would not fit its column. */
    String resultsJson(List<String> columns, List<List<Object>> rows) {
        List<String> cols = columns == null ? List.of() : columns;
        try {
            String json = mapper.writeValueAsString(new SavedResults(cols, head(rows, MAX_SAVED_ROWS)));
            if (json.length() > MAX_RESULTS_JSON) {
                json = mapper.writeValueAsString(new SavedResults(cols, head(rows, TRIMMED_ROWS)));
            }
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize query results", e);
        }
    }

    public List<QueryHistory> history(String schema, int limit) {
        String target = schema == null || schema.isBlank() ? schemaIndexer.activeSchema() : schema;
        return historyRepository.findBySchemaNameOrderBySavedAtDesc(target, PageRequest.of(0, Math.max(1, limit)));
    }

    public boolean delete(Long id) {
        if (!historyRepository.existsById(id)) {
            return false;
        }
        historyRepository.deleteById(id);
        log.info("Deleted saved query {}", id);
        return true;
    }

    public Optional<String> exportCsv(Long id) {
        return historyRepository.findById(id).map(h -> {
            if (h.getResultsJson() == null || h.getResultsJson().isBlank()) {
                return "";
            }
            try {
                SavedResults saved = mapper.readValue(h.getResultsJson(), SavedResults.class);
                return CsvExporter.toCsv(saved.columns(), saved.rows());
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Saved results of query " + id + " are not valid JSON", e);
            }
        });
    }

    private static List<List<Object>> head(List<List<Object>> rows, int n) {
        return rows.size() > n ? rows.subList(0, n) : rows;
    }

    /* ============================================================
       SUPPORT CLASSES
       ============================================================ */
    public record SavedResults(List<String> columns, List<List<Object>> rows) {}
}
