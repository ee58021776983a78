package com.vedant.salesanalyst.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The single record threaded through one question's pipeline run.
 * Created per question and never shared between questions. Stages fill in their own
 * fields; on failure the fields filled so far are kept for diagnostics.
 */
public class WorkflowState {

    private final String query;
    private final Instant timestamp;
    private final List<String> stepsCompleted = new ArrayList<>();

    private String schema;
    private List<SchemaDocument> relevantContext = List.of();
    private List<String> retrievedTables = List.of();
    private List<GoldenExample> examples = List.of();
    private String generatedSql;
    private int generationAttempts;
    private List<String> sqlValidationErrors = List.of();
    private List<List<Object>> queryResults;
    private List<String> columnNames = List.of();
    private Double executionTime;
    private String analysis;
    private ErrorKind errorKind;
    private String error;
    private String friendlyError;

    public WorkflowState(String query) {
        this(query, Instant.now());
    }

    public WorkflowState(String query, Instant timestamp) {
        this.query = query;
        this.timestamp = timestamp;
    }

    public void markStep(String step) {
        stepsCompleted.add(step);
    }

    public void fail(ErrorKind kind, String step, String error) {
        this.errorKind = kind;
        this.error = error;
        stepsCompleted.add(step);
    }

    public boolean hasError() {
        return error != null;
    }

    public String getQuery() { return query; }

    public Instant getTimestamp() { return timestamp; }

    public List<String> getStepsCompleted() { return Collections.unmodifiableList(stepsCompleted); }

    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }

    public List<SchemaDocument> getRelevantContext() { return relevantContext; }
    public void setRelevantContext(List<SchemaDocument> relevantContext) { this.relevantContext = relevantContext; }

    public List<String> getRetrievedTables() { return retrievedTables; }
    public void setRetrievedTables(List<String> retrievedTables) { this.retrievedTables = retrievedTables; }

    public List<GoldenExample> getExamples() { return examples; }
    public void setExamples(List<GoldenExample> examples) { this.examples = examples; }

    public String getGeneratedSql() { return generatedSql; }
    public void setGeneratedSql(String generatedSql) { this.generatedSql = generatedSql; }

    public int getGenerationAttempts() { return generationAttempts; }
    public void setGenerationAttempts(int generationAttempts) { this.generationAttempts = generationAttempts; }

    public List<String> getSqlValidationErrors() { return sqlValidationErrors; }
    public void setSqlValidationErrors(List<String> sqlValidationErrors) { this.sqlValidationErrors = sqlValidationErrors; }

    public List<List<Object>> getQueryResults() { return queryResults; }
    public void setQueryResults(List<List<Object>> queryResults) { this.queryResults = queryResults; }

    public List<String> getColumnNames() { return columnNames; }
    public void setColumnNames(List<String> columnNames) { this.columnNames = columnNames; }

    public Double getExecutionTime() { return executionTime; }
    public void setExecutionTime(Double executionTime) { this.executionTime = executionTime; }

    public String getAnalysis() { return analysis; }
    public void setAnalysis(String analysis) { this.analysis = analysis; }

    public ErrorKind getErrorKind() { return errorKind; }

    public String getError() { return error; }

    public String getFriendlyError() { return friendlyError; }
    public void setFriendlyError(String friendlyError) { this.friendlyError = friendlyError; }
}
